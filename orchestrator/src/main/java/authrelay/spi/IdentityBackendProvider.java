package authrelay.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import authrelay.core.model.EndpointDescriptor;

/**
 * SPI for identity backend implementations.
 *
 * <p>Platform teams can implement this interface to plug in the component that performs
 * the real login protocol against an identity endpoint (device code flow, browser
 * redirect, token refresh).
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>memory (priority: 0) - In-memory backend (development only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (authrelay.providers.backend.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 *
 * <h2>Custom Implementation Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class MsalIdentityBackendProvider implements IdentityBackendProvider {
 *
 *     @Override
 *     public String name() {
 *         return "msal";
 *     }
 *
 *     @Override
 *     public int priority() {
 *         return 100;
 *     }
 *
 *     @Override
 *     public IdentityBackend create(EndpointDescriptor endpoint) {
 *         return new MsalIdentityBackend(endpoint.normalizedUrl(), tokenCache);
 *     }
 * }
 * }</pre>
 */
public interface IdentityBackendProvider {

    /**
     * Return the provider name for configuration selection.
     *
     * @return Provider name (e.g., "memory", "msal")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * <p>Higher priority providers are preferred when multiple providers are available.
     *
     * @return Priority value (higher = more preferred)
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Create a health indicator for this provider.
     *
     * @return Health check response, or empty if not supported
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }

    /**
     * Create a new, uninitialized backend for the given endpoint.
     *
     * <p>Each call must return a fresh instance. The caller initializes it and closes it
     * when the owning provider registration is disposed.
     *
     * @param endpoint the login endpoint the backend talks to
     * @return a new backend instance
     */
    IdentityBackend create(EndpointDescriptor endpoint);
}
