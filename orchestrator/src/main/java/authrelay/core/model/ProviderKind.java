package authrelay.core.model;

/**
 * The two provider slots managed by the lifecycle manager.
 */
public enum ProviderKind {
    /** Fixed provider registered once at startup and never replaced. */
    DEFAULT(""),
    /** Optional sovereign-cloud provider selected by configuration. */
    ALTERNATE("AzureCloud");

    private final String eventQualifier;

    ProviderKind(String eventQualifier) {
        this.eventQualifier = eventQualifier;
    }

    /**
     * Qualifier inserted into telemetry event names to tell the slots apart.
     */
    public String eventQualifier() {
        return eventQualifier;
    }
}
