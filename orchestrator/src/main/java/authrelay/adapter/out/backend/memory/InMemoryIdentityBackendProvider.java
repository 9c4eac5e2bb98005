package authrelay.adapter.out.backend.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import authrelay.core.model.EndpointDescriptor;
import authrelay.spi.IdentityBackend;
import authrelay.spi.IdentityBackendProvider;

/**
 * In-memory identity backend provider.
 *
 * <p>Lowest priority fallback. All backends it creates share one credential store.
 */
@ApplicationScoped
public class InMemoryIdentityBackendProvider implements IdentityBackendProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryIdentityBackendProvider.class);
    private static final int PRIORITY = 0; // Lowest priority - fallback only

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private final InMemoryCredentialStore store = new InMemoryCredentialStore();

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public IdentityBackend create(EndpointDescriptor endpoint) {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Identity backend is in-memory only!");
            LOG.warn("  Sign-ins are simulated and sessions are lost on restart.");
            LOG.warn("  Configure a real IdentityBackendProvider for production.");
            LOG.warn("========================================================================");
        }
        return new InMemoryIdentityBackend(endpoint, store);
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("identity-backend-memory")
                .up()
                .withData("type", "in-memory")
                .withData("sessions", store.getSessionCount())
                .build());
    }
}
