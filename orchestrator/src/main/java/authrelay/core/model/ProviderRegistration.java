package authrelay.core.model;

import java.util.Objects;

import authrelay.core.port.in.SessionCapabilities;
import authrelay.core.port.out.Disposable;
import authrelay.spi.IdentityBackend;

/**
 * A provider registered with the host.
 *
 * <p>Owned by the lifecycle manager: it is created when the provider is registered and
 * {@linkplain #dispose() disposed} before any replacement for the same id is created.
 *
 * @param id           provider id the host knows the provider by
 * @param displayName  name shown by the host
 * @param kind         slot the provider occupies
 * @param endpoint     login endpoint the backend talks to
 * @param backend      identity backend owned by this registration
 * @param capabilities capability object handed to the host
 * @param handle       host handle that removes the registration
 * @param options      registration options
 */
public record ProviderRegistration(
        String id,
        String displayName,
        ProviderKind kind,
        EndpointDescriptor endpoint,
        IdentityBackend backend,
        SessionCapabilities capabilities,
        Disposable handle,
        ProviderOptions options) {

    public ProviderRegistration {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(displayName, "displayName cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(endpoint, "endpoint cannot be null");
        Objects.requireNonNull(backend, "backend cannot be null");
        Objects.requireNonNull(capabilities, "capabilities cannot be null");
        Objects.requireNonNull(handle, "handle cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
    }

    public boolean supportsMultipleAccounts() {
        return options.supportsMultipleAccounts();
    }

    /**
     * Remove the registration from the host, then close the backend.
     */
    public void dispose() {
        try {
            handle.dispose();
        } finally {
            backend.close();
        }
    }
}
