package authrelay.adapter.out.host;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import authrelay.core.model.ProviderOptions;
import authrelay.core.port.in.SessionCapabilities;
import authrelay.core.port.out.AuthenticationHost;
import authrelay.core.port.out.Disposable;

/**
 * In-process provider registry standing in for the host application.
 *
 * <p>Enforces the host rule that at most one provider may be registered per id: a second
 * registration for a live id fails with {@link IllegalStateException}. Handles are
 * idempotent and only remove the registration they created.
 */
@ApplicationScoped
public class InMemoryAuthenticationHost implements AuthenticationHost {

    private static final Logger LOG = Logger.getLogger(InMemoryAuthenticationHost.class);

    private final ConcurrentMap<String, HostedProvider> providers = new ConcurrentHashMap<>();

    @Override
    public Disposable register(
            String providerId, String displayName, SessionCapabilities capabilities, ProviderOptions options) {
        final var hosted = new HostedProvider(providerId, displayName, capabilities, options);
        final var existing = providers.putIfAbsent(providerId, hosted);
        if (existing != null) {
            throw new IllegalStateException("Authentication provider '%s' is already registered as '%s'"
                    .formatted(providerId, existing.displayName()));
        }
        LOG.debugf("Host registered provider %s (%s)", providerId, displayName);

        final var disposed = new AtomicBoolean(false);
        return () -> {
            if (disposed.compareAndSet(false, true) && providers.remove(providerId, hosted)) {
                LOG.debugf("Host unregistered provider %s", providerId);
            }
        };
    }

    public Optional<HostedProvider> find(String providerId) {
        return Optional.ofNullable(providers.get(providerId));
    }

    public List<String> registeredProviderIds() {
        return providers.keySet().stream().sorted().toList();
    }

    public int size() {
        return providers.size();
    }

    /**
     * A provider as the host sees it.
     */
    public record HostedProvider(
            String id, String displayName, SessionCapabilities capabilities, ProviderOptions options) {}
}
