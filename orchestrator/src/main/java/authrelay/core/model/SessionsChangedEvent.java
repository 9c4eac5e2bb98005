package authrelay.core.model;

import java.util.List;

/**
 * Sessions added, removed or changed by an identity backend.
 */
public record SessionsChangedEvent(List<Session> added, List<Session> removed, List<Session> changed) {

    public SessionsChangedEvent {
        added = added != null ? List.copyOf(added) : List.of();
        removed = removed != null ? List.copyOf(removed) : List.of();
        changed = changed != null ? List.copyOf(changed) : List.of();
    }

    public static SessionsChangedEvent added(Session session) {
        return new SessionsChangedEvent(List.of(session), List.of(), List.of());
    }

    public static SessionsChangedEvent removed(Session session) {
        return new SessionsChangedEvent(List.of(), List.of(session), List.of());
    }
}
