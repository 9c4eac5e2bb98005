package authrelay.adapter.out.backend.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import authrelay.core.model.Session;
import authrelay.core.port.out.CredentialStore;

/**
 * In-memory implementation of CredentialStore.
 *
 * <p>This implementation is intended for development and testing only.
 * Sessions are lost on restart and nothing is encrypted.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCredentialStore.class);

    private final ConcurrentMap<String, Map<String, Session>> namespaces = new ConcurrentHashMap<>();

    @Override
    public Uni<List<Session>> list(String namespace) {
        return Uni.createFrom().item(() -> {
            final var sessions = namespaces.get(namespace);
            if (sessions == null) {
                return List.of();
            }
            synchronized (sessions) {
                return List.copyOf(new ArrayList<>(sessions.values()));
            }
        });
    }

    @Override
    public Uni<Void> save(String namespace, Session session) {
        return Uni.createFrom().item(() -> {
            final var sessions = namespaces.computeIfAbsent(namespace, ns -> new LinkedHashMap<>());
            synchronized (sessions) {
                sessions.put(session.id(), session);
            }
            LOG.debugf("Stored session %s in %s", session.id(), namespace);
            return null;
        });
    }

    @Override
    public Uni<Session> remove(String namespace, String sessionId) {
        return Uni.createFrom().item(() -> {
            final var sessions = namespaces.get(namespace);
            if (sessions == null) {
                return null;
            }
            synchronized (sessions) {
                return sessions.remove(sessionId);
            }
        });
    }

    /**
     * Get the number of stored sessions across all namespaces (for health checks).
     */
    public int getSessionCount() {
        return namespaces.values().stream()
                .mapToInt(sessions -> {
                    synchronized (sessions) {
                        return sessions.size();
                    }
                })
                .sum();
    }
}
