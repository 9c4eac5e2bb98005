package authrelay.adapter.out.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import authrelay.core.model.TelemetryEvent;
import authrelay.spi.TelemetryEventHandler;

/**
 * Telemetry handler that counts events with Micrometer.
 *
 * <p>Built-in handler with priority 10. Records
 * {@code authrelay.telemetry.events} tagged with the event name and schema version.
 * Scope properties are not used as tags.
 */
public class MetricsTelemetryEventHandler implements TelemetryEventHandler {

    static final String METRIC_NAME = "authrelay.telemetry.events";

    private MeterRegistry registry;

    public MetricsTelemetryEventHandler() {
        // Default constructor for ServiceLoader
    }

    public MetricsTelemetryEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Set the meter registry. Called by the dispatcher after ServiceLoader instantiation.
     *
     * @param registry the Micrometer registry
     */
    public void setMeterRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return registry != null;
    }

    @Override
    public void handle(TelemetryEvent event) {
        if (registry == null) {
            return;
        }

        Counter.builder(METRIC_NAME)
                .description("Session telemetry events by name")
                .tag("event", event.name())
                .tag("schema", TelemetryEvent.SCHEMA_VERSION)
                .register(registry)
                .increment();
    }
}
