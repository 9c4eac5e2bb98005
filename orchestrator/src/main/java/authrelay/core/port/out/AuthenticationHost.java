package authrelay.core.port.out;

import authrelay.core.model.ProviderOptions;
import authrelay.core.port.in.SessionCapabilities;

/**
 * Port for the host application's provider registration mechanism.
 */
public interface AuthenticationHost {

    /**
     * Register a provider with the host.
     *
     * @param providerId   provider id; at most one registration per id may be live
     * @param displayName  name shown to users
     * @param capabilities session operations the host will call
     * @param options      registration options
     * @return handle that removes the registration
     * @throws IllegalStateException if a registration with the same id is still live
     */
    Disposable register(
            String providerId, String displayName, SessionCapabilities capabilities, ProviderOptions options);
}
