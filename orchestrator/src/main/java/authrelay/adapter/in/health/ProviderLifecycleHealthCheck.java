package authrelay.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import authrelay.core.model.LifecycleState;
import authrelay.core.model.ProviderRegistration;
import authrelay.core.port.in.ProviderLifecycle;
import authrelay.core.service.IdentityBackendProviderRegistry;

/**
 * Readiness check for the provider lifecycle.
 *
 * <p>UP once the default provider is registered and until shutdown.
 */
@Readiness
@ApplicationScoped
public class ProviderLifecycleHealthCheck implements HealthCheck {

    private final ProviderLifecycle lifecycle;
    private final IdentityBackendProviderRegistry backendRegistry;

    @Inject
    public ProviderLifecycleHealthCheck(ProviderLifecycle lifecycle, IdentityBackendProviderRegistry backendRegistry) {
        this.lifecycle = lifecycle;
        this.backendRegistry = backendRegistry;
    }

    @Override
    public HealthCheckResponse call() {
        final var state = lifecycle.state();
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("provider-lifecycle");
        builder.withData("state", state.name());
        builder.withData(
                "providers",
                String.join(
                        ",",
                        lifecycle.registrations().stream()
                                .map(ProviderRegistration::id)
                                .toList()));

        backendRegistry.getAvailableProviders().stream()
                .flatMap(provider -> provider.healthCheck().stream())
                .forEach(response -> builder.withData(
                        response.getName(), response.getStatus().name()));

        final var ready = state == LifecycleState.DEFAULT_ACTIVE || state == LifecycleState.DEFAULT_AND_ALTERNATE_ACTIVE;
        return ready ? builder.up().build() : builder.down().build();
    }
}
