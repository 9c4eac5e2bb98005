package authrelay.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * Telemetry event emitted for a session operation outcome.
 *
 * <p>Properties never contain personal data. Scope lists are redacted before they are
 * put into an event.
 *
 * @param name       event name from the fixed taxonomy (see {@link SessionEventType})
 * @param properties event properties
 */
public record TelemetryEvent(String name, Map<String, String> properties) {

    /** Version of the event schema; bumped whenever names or property keys change. */
    public static final String SCHEMA_VERSION = "1";

    /** Property carrying the redacted, JSON-serialized scope list. */
    public static final String SCOPES_PROPERTY = "scopes";

    public TelemetryEvent {
        Objects.requireNonNull(name, "name cannot be null");
        properties = properties != null ? Map.copyOf(properties) : Map.of();
    }

    public static TelemetryEvent of(String name) {
        return new TelemetryEvent(name, Map.of());
    }
}
