package authrelay.adapter.out.telemetry;

import java.util.TreeMap;

import org.jboss.logging.Logger;

import authrelay.core.model.TelemetryEvent;
import authrelay.spi.TelemetryEventHandler;

/**
 * Telemetry handler that logs events using JBoss Logging.
 *
 * <p>Built-in handler with priority 0. Failure events are logged at INFO, everything
 * else at DEBUG, under the {@code authrelay.telemetry} category.
 */
public class LoggingTelemetryEventHandler implements TelemetryEventHandler {

    private static final Logger LOG = Logger.getLogger("authrelay.telemetry");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(TelemetryEvent event) {
        final var message = format(event);
        if (event.name().endsWith("Failed")) {
            LOG.info(message);
        } else {
            LOG.debug(message);
        }
    }

    static String format(TelemetryEvent event) {
        return String.format(
                "TELEMETRY: event=%s schema=%s properties=%s",
                event.name(), TelemetryEvent.SCHEMA_VERSION, new TreeMap<>(event.properties()));
    }
}
