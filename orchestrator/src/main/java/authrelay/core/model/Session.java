package authrelay.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Authentication session owned by an identity backend.
 *
 * <p>The orchestration layer never persists sessions; it only forwards them between the
 * host and the backend.
 *
 * @param id           backend-assigned session identifier
 * @param accountLabel label of the signed-in account
 * @param scopes       scopes granted to the session, in the order the backend stored them
 */
public record Session(String id, String accountLabel, List<String> scopes) {

    public Session {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(accountLabel, "accountLabel cannot be null");
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
    }
}
