package authrelay.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import authrelay.core.model.Session;

/**
 * Port for persisting session material.
 *
 * <p>Sessions are grouped by namespace (one per login endpoint) so backends created for
 * the same endpoint see each other's sessions across a provider swap.
 */
public interface CredentialStore {

    Uni<List<Session>> list(String namespace);

    Uni<Void> save(String namespace, Session session);

    /**
     * Remove a stored session.
     *
     * @return the removed session, or null when none was stored under the id
     */
    Uni<Session> remove(String namespace, String sessionId);
}
