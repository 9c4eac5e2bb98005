package authrelay.adapter.in.dto;

import java.util.List;

/**
 * Request body for creating a session.
 *
 * @param scopes requested scopes, any order
 */
public record CreateSessionRequest(List<String> scopes) {

    public CreateSessionRequest {
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
    }
}
