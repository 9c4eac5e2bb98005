package authrelay.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import authrelay.core.model.LifecycleState;
import authrelay.core.port.in.ProviderLifecycle;
import authrelay.core.service.IdentityBackendProviderRegistry;
import authrelay.spi.IdentityBackendProvider;

@DisplayName("ProviderLifecycleHealthCheck")
class ProviderLifecycleHealthCheckTest {

    private ProviderLifecycle lifecycle;
    private ProviderLifecycleHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        lifecycle = mock(ProviderLifecycle.class);
        var registry = mock(IdentityBackendProviderRegistry.class);
        var provider = mock(IdentityBackendProvider.class);
        when(provider.healthCheck()).thenReturn(Optional.of(HealthCheckResponse.named("identity-backend-memory")
                .up()
                .build()));
        when(registry.getAvailableProviders()).thenReturn(List.of(provider));
        when(lifecycle.registrations()).thenReturn(List.of());

        healthCheck = new ProviderLifecycleHealthCheck(lifecycle, registry);
    }

    @Test
    @DisplayName("should return UP once the default provider is active")
    void shouldReturnUpWhenActive() {
        when(lifecycle.state()).thenReturn(LifecycleState.DEFAULT_AND_ALTERNATE_ACTIVE);

        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("provider-lifecycle", response.getName());
        var data = response.getData().orElseThrow();
        assertEquals("DEFAULT_AND_ALTERNATE_ACTIVE", data.get("state"));
        assertEquals("UP", data.get("identity-backend-memory"));
    }

    @Test
    @DisplayName("should return DOWN before start and after stop")
    void shouldReturnDownWhenInactive() {
        when(lifecycle.state()).thenReturn(LifecycleState.UNINITIALIZED, LifecycleState.STOPPED);

        assertEquals(HealthCheckResponse.Status.DOWN, healthCheck.call().getStatus());
        assertEquals(HealthCheckResponse.Status.DOWN, healthCheck.call().getStatus());
    }
}
