package authrelay.core.service;

import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import authrelay.core.model.FailurePolicy;
import authrelay.core.model.ProviderKind;
import authrelay.core.model.Session;
import authrelay.core.model.SessionEventType;
import authrelay.core.model.SessionsChangedEvent;
import authrelay.core.model.TelemetryEvent;
import authrelay.core.port.in.SessionCapabilities;
import authrelay.core.port.out.TelemetryGateway;
import authrelay.spi.IdentityBackend;

/**
 * Capability object the host calls for one provider.
 *
 * <p>Wraps an identity backend and applies the same contract to every provider:
 * <ul>
 *   <li>{@code getSessions} - passed through unchanged, no telemetry</li>
 *   <li>{@code createSession} - scopes sorted for the backend; one {@code login} or
 *       {@code loginFailed} event; failures reach the caller unchanged</li>
 *   <li>{@code removeSession} - one {@code logout} or {@code logoutFailed} event;
 *       failures are logged and absorbed</li>
 * </ul>
 */
public class SessionBroker implements SessionCapabilities {

    private static final Logger LOG = Logger.getLogger(SessionBroker.class);

    private final String providerId;
    private final ProviderKind kind;
    private final IdentityBackend backend;
    private final TelemetryGateway telemetry;

    public SessionBroker(String providerId, ProviderKind kind, IdentityBackend backend, TelemetryGateway telemetry) {
        this.providerId = providerId;
        this.kind = kind;
        this.backend = backend;
        this.telemetry = telemetry;
    }

    @Override
    public Multi<SessionsChangedEvent> onSessionsChanged() {
        return backend.onDidChangeSessions();
    }

    @Override
    public Uni<List<Session>> getSessions(List<String> scopes) {
        return Uni.createFrom().deferred(() -> backend.getSessions(scopes));
    }

    @Override
    public Uni<Session> createSession(List<String> scopes) {
        final var redactedScopes = ScopeNormalizer.telemetryForm(scopes);
        final var sortedScopes = ScopeNormalizer.protocolForm(scopes);

        final var operation = Uni.createFrom()
                .deferred(() -> backend.createSession(sortedScopes))
                .invoke(session -> LOG.debugf("Session %s created by provider %s", session.id(), providerId));

        return track(
                operation,
                SessionEventType.LOGIN,
                SessionEventType.LOGIN_FAILED,
                Map.of(TelemetryEvent.SCOPES_PROPERTY, redactedScopes),
                FailurePolicy.PROPAGATE,
                "Login with provider " + providerId);
    }

    @Override
    public Uni<Void> removeSession(String sessionId) {
        final var operation = Uni.createFrom().deferred(() -> backend.removeSessionById(sessionId));

        return track(
                operation,
                SessionEventType.LOGOUT,
                SessionEventType.LOGOUT_FAILED,
                Map.of(),
                FailurePolicy.ABSORB,
                "Logout of session " + sessionId + " from provider " + providerId);
    }

    private <T> Uni<T> track(
            Uni<T> operation,
            SessionEventType success,
            SessionEventType failure,
            Map<String, String> successProperties,
            FailurePolicy policy,
            String description) {
        final var tracked = operation
                .onItem()
                .invoke(item -> telemetry.emit(new TelemetryEvent(success.eventName(kind), successProperties)))
                .onFailure()
                .invoke(error -> {
                    LOG.debugf("%s failed: %s", description, error.getMessage());
                    telemetry.emit(TelemetryEvent.of(failure.eventName(kind)));
                });
        return policy.apply(tracked, description);
    }
}
