package authrelay.core.port.in;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import authrelay.core.model.LifecycleState;
import authrelay.core.model.ProviderRegistration;

/**
 * Use case for starting, reconfiguring and stopping the registered providers.
 */
public interface ProviderLifecycle {

    /**
     * Register the default provider, then apply the current alternate configuration.
     * Starting an already started lifecycle is a no-op.
     */
    Uni<Void> start();

    /**
     * Re-read the alternate endpoint setting and rebuild the alternate provider.
     * Safe to call repeatedly; calls are applied one at a time in call order.
     */
    Uni<Void> applyConfiguration();

    /**
     * React to a changed setting. Only changes affecting the alternate endpoint setting
     * trigger a rebuild.
     *
     * @param key the changed setting key or section
     */
    Uni<Void> onConfigurationChanged(String key);

    /**
     * Dispose every registration. Idempotent.
     */
    void stop();

    LifecycleState state();

    /**
     * Currently registered providers, default first.
     */
    List<ProviderRegistration> registrations();

    Optional<ProviderRegistration> findRegistration(String providerId);
}
