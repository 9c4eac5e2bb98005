package authrelay.core.model;

import java.util.Objects;

/**
 * Validated identity endpoint selected from configuration.
 *
 * @param rawValue      the configuration value as entered
 * @param normalizedUrl validated login URL, always terminated by {@code /}
 * @param displayName   name shown for the provider registered against this endpoint
 */
public record EndpointDescriptor(String rawValue, String normalizedUrl, String displayName) {

    public EndpointDescriptor {
        Objects.requireNonNull(rawValue, "rawValue cannot be null");
        Objects.requireNonNull(normalizedUrl, "normalizedUrl cannot be null");
        Objects.requireNonNull(displayName, "displayName cannot be null");
        if (!normalizedUrl.endsWith("/")) {
            throw new IllegalArgumentException("normalizedUrl must end with '/': " + normalizedUrl);
        }
    }

    /**
     * Descriptor for a fixed, known-good endpoint (the default provider).
     */
    public static EndpointDescriptor fixed(String url, String displayName) {
        final var normalized = url.endsWith("/") ? url : url + "/";
        return new EndpointDescriptor(url, normalized, displayName);
    }
}
