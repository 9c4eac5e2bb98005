package authrelay.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import authrelay.core.model.Session;
import authrelay.core.model.SessionsChangedEvent;

/**
 * Capability object a provider hands to the host.
 *
 * <p>The host calls these methods to list, create and remove sessions for one provider.
 */
public interface SessionCapabilities {

    /**
     * Stream of session changes for this provider.
     */
    Multi<SessionsChangedEvent> onSessionsChanged();

    /**
     * List sessions matching the requested scopes.
     *
     * @param scopes requested scopes, passed to the backend as given
     * @return matching sessions
     */
    Uni<List<Session>> getSessions(List<String> scopes);

    /**
     * Create a session for the requested scopes.
     *
     * @param scopes requested scopes in any order
     * @return the created session; fails with the backend's error when login fails
     */
    Uni<Session> createSession(List<String> scopes);

    /**
     * Remove a session. Completes normally even when the backend fails.
     *
     * @param sessionId the session to remove
     * @return Uni completing when the removal attempt finished
     */
    Uni<Void> removeSession(String sessionId);
}
