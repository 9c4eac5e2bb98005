package authrelay.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for session telemetry.
 *
 * <p>Example configuration:
 * <pre>{@code
 * authrelay.telemetry.enabled=true
 * authrelay.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "authrelay.telemetry")
public interface TelemetryConfigMapping {

    /**
     * Master toggle. When disabled, events are dropped before reaching any handler.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Metrics configuration.
     */
    MetricsConfig metrics();

    interface MetricsConfig {
        /**
         * Count telemetry events with Micrometer.
         * Requires authrelay.telemetry.enabled=true to take effect.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
