package authrelay.adapter.in.dto;

import java.util.List;

import authrelay.core.model.Session;

/**
 * Session as returned by the REST API.
 */
public record SessionDto(String id, String accountLabel, List<String> scopes) {

    public static SessionDto fromModel(Session session) {
        return new SessionDto(session.id(), session.accountLabel(), session.scopes());
    }
}
