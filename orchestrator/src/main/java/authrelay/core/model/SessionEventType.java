package authrelay.core.model;

/**
 * Telemetry taxonomy for session operations.
 *
 * <p>Event names combine the operation, the provider qualifier and the outcome, e.g.
 * {@code login}, {@code loginFailed}, {@code loginAzureCloud},
 * {@code logoutAzureCloudFailed}.
 */
public enum SessionEventType {
    LOGIN("login", false),
    LOGIN_FAILED("login", true),
    LOGOUT("logout", false),
    LOGOUT_FAILED("logout", true);

    private final String operation;
    private final boolean failure;

    SessionEventType(String operation, boolean failure) {
        this.operation = operation;
        this.failure = failure;
    }

    public String eventName(ProviderKind kind) {
        return operation + kind.eventQualifier() + (failure ? "Failed" : "");
    }
}
