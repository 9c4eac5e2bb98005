package authrelay.spi;

import authrelay.core.model.TelemetryEvent;

/**
 * SPI for delivering telemetry events to a transport.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. Register them in:
 * {@code META-INF/services/authrelay.spi.TelemetryEventHandler}
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - Logs events using JBoss Logging (priority 0)</li>
 *   <li>{@code metrics} - Counts events with Micrometer (priority 10)</li>
 * </ul>
 *
 * <p>Events never carry personal data; scope lists arrive already redacted.
 */
public interface TelemetryEventHandler {

    /**
     * Returns the unique name of this handler.
     *
     * @return handler name (e.g., "logging", "appinsights")
     */
    String name();

    /**
     * Returns the priority of this handler. Higher priority handlers are invoked first.
     *
     * @return priority value
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this handler should receive events.
     *
     * @return true if the handler's transport is configured
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle a telemetry event.
     *
     * <p>Runs on the dispatcher thread. Exceptions are caught and logged by the dispatcher
     * and do not prevent other handlers from receiving the event.
     *
     * @param event the event
     */
    void handle(TelemetryEvent event);

    /**
     * Called during shutdown to release any resources.
     */
    default void close() {}
}
