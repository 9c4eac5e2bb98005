package authrelay.core.port.out;

import authrelay.core.model.TelemetryEvent;

/**
 * Port for fire-and-forget telemetry.
 *
 * <p>Implementations must never throw to the caller and must not block it.
 */
public interface TelemetryGateway {

    void emit(TelemetryEvent event);
}
