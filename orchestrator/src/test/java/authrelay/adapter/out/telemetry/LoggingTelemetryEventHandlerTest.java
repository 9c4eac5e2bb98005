package authrelay.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import authrelay.core.model.TelemetryEvent;

@DisplayName("LoggingTelemetryEventHandler")
class LoggingTelemetryEventHandlerTest {

    private final LoggingTelemetryEventHandler handler = new LoggingTelemetryEventHandler();

    @Test
    @DisplayName("should format name, schema and sorted properties")
    void shouldFormatEvent() {
        var event = new TelemetryEvent("login", Map.of("scopes", "[\"{guid}\"]", "attempt", "1"));

        assertEquals(
                "TELEMETRY: event=login schema=1 properties={attempt=1, scopes=[\"{guid}\"]}",
                LoggingTelemetryEventHandler.format(event));
    }

    @Test
    @DisplayName("should handle success and failure events")
    void shouldHandleEvents() {
        assertDoesNotThrow(() -> handler.handle(TelemetryEvent.of("logout")));
        assertDoesNotThrow(() -> handler.handle(TelemetryEvent.of("logoutFailed")));
        assertEquals("logging", handler.name());
        assertEquals(0, handler.priority());
    }
}
