package authrelay.adapter.out.backend.memory;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;
import org.jboss.logging.Logger;

import authrelay.core.model.EndpointDescriptor;
import authrelay.core.model.Session;
import authrelay.core.model.SessionsChangedEvent;
import authrelay.core.port.out.CredentialStore;
import authrelay.spi.IdentityBackend;

/**
 * Identity backend that signs in without talking to an identity provider.
 *
 * <p>Sessions are kept in a {@link CredentialStore} namespaced by the endpoint URL, so a
 * backend rebuilt for the same endpoint sees the sessions of its predecessor. Intended
 * for development and tests only.
 *
 * <p>Once closed, every operation fails with {@link IllegalStateException}.
 */
public class InMemoryIdentityBackend implements IdentityBackend {

    private static final Logger LOG = Logger.getLogger(InMemoryIdentityBackend.class);

    private final EndpointDescriptor endpoint;
    private final CredentialStore store;
    private final BroadcastProcessor<SessionsChangedEvent> changes = BroadcastProcessor.create();
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger accountCounter = new AtomicInteger();

    public InMemoryIdentityBackend(EndpointDescriptor endpoint, CredentialStore store) {
        this.endpoint = endpoint;
        this.store = store;
    }

    @Override
    public Uni<Void> initialize() {
        return ensureOpen().chain(() -> store.list(namespace())).invoke(sessions -> {
            initialized.set(true);
            accountCounter.set(sessions.size());
            LOG.debugf("Initialized backend for %s with %d stored session(s)", namespace(), sessions.size());
        }).replaceWithVoid();
    }

    @Override
    public Uni<List<Session>> getSessions(List<String> scopes) {
        return ensureOpen().chain(() -> store.list(namespace())).map(sessions -> sessions.stream()
                .filter(session -> scopes == null || session.scopes().containsAll(scopes))
                .toList());
    }

    @Override
    public Uni<Session> createSession(List<String> scopes) {
        return ensureOpen().chain(() -> {
            final var account = "account-%d@%s".formatted(accountCounter.incrementAndGet(), endpoint.displayName());
            final var session = new Session(UUID.randomUUID().toString(), account, scopes);
            return store.save(namespace(), session).replaceWith(session);
        }).invoke(session -> publish(SessionsChangedEvent.added(session)));
    }

    @Override
    public Uni<Void> removeSessionById(String sessionId) {
        return ensureOpen().chain(() -> store.remove(namespace(), sessionId)).invoke(removed -> {
            if (removed == null) {
                LOG.debugf("Session %s not found in %s", sessionId, namespace());
                return;
            }
            publish(SessionsChangedEvent.removed(removed));
        }).replaceWithVoid();
    }

    @Override
    public Multi<SessionsChangedEvent> onDidChangeSessions() {
        return changes;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            changes.onComplete();
            LOG.debugf("Closed backend for %s", namespace());
        }
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void publish(SessionsChangedEvent event) {
        if (!closed.get()) {
            changes.onNext(event);
        }
    }

    private Uni<Void> ensureOpen() {
        if (closed.get()) {
            return Uni.createFrom()
                    .failure(new IllegalStateException("Identity backend for %s has been disposed".formatted(namespace())));
        }
        return Uni.createFrom().voidItem();
    }

    private String namespace() {
        return endpoint.normalizedUrl();
    }
}
