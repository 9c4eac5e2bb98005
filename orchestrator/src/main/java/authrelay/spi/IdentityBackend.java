package authrelay.spi;

import java.util.List;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import authrelay.core.model.Session;
import authrelay.core.model.SessionsChangedEvent;

/**
 * Identity backend bound to a single login endpoint.
 *
 * <p>An identity backend performs the actual interactive login and token refresh
 * protocol for one endpoint and owns the sessions it creates. The orchestration layer
 * never talks to an identity provider directly; it forwards session calls to a backend
 * and wraps them with scope normalization and telemetry.
 *
 * <p>Instances are created by an {@link IdentityBackendProvider} and are owned by the
 * provider registration that wraps them. When the registration is replaced, the backend
 * is {@linkplain #close() closed}. Calls that complete after {@code close()} has begun
 * must fail gracefully (for example with an {@link IllegalStateException}) rather than
 * crash.
 */
public interface IdentityBackend {

    /**
     * Prepare the backend for use (load stored sessions, warm caches).
     *
     * @return Uni completing when the backend is ready
     */
    Uni<Void> initialize();

    /**
     * Return stored sessions matching the requested scopes.
     *
     * @param scopes requested scopes; empty means all sessions
     * @return matching sessions
     */
    Uni<List<Session>> getSessions(List<String> scopes);

    /**
     * Run the login flow and create a session for the given scopes.
     *
     * @param scopes scopes in canonical (sorted) order
     * @return the created session
     */
    Uni<Session> createSession(List<String> scopes);

    /**
     * Remove a session and its stored credentials.
     *
     * @param sessionId the session identifier
     * @return Uni completing when the session is gone
     */
    Uni<Void> removeSessionById(String sessionId);

    /**
     * Stream of session changes made by this backend.
     *
     * @return change events; completes when the backend is closed
     */
    Multi<SessionsChangedEvent> onDidChangeSessions();

    /**
     * Release resources held by this backend. Must be idempotent.
     */
    void close();
}
