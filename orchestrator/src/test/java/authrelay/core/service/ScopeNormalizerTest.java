package authrelay.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ScopeNormalizer")
class ScopeNormalizerTest {

    private static final String TENANT = "72f988bf-86f1-41af-91ab-2d7cd011db47";
    private static final String CLIENT = "AEBC6443-996D-45C2-90F0-388FF96FAA56";

    @Nested
    @DisplayName("protocolForm()")
    class ProtocolFormTests {

        @Test
        @DisplayName("should sort scopes ascending")
        void shouldSortScopesAscending() {
            final var result = ScopeNormalizer.protocolForm(List.of("profile", "email", "openid", "offline_access"));

            assertEquals(List.of("email", "offline_access", "openid", "profile"), result);
        }

        @Test
        @DisplayName("should keep every scope, including duplicates")
        void shouldBePermutationOfInput() {
            final var input = List.of("b", "a", "b", "VSCODE_TENANT:organizations", "a");

            final var result = ScopeNormalizer.protocolForm(input);

            assertEquals(input.size(), result.size());
            final var remaining = new ArrayList<>(input);
            result.forEach(remaining::remove);
            assertTrue(remaining.isEmpty());
            for (int i = 1; i < result.size(); i++) {
                assertTrue(result.get(i - 1).compareTo(result.get(i)) <= 0);
            }
        }

        @Test
        @DisplayName("should order uppercase before lowercase")
        void shouldUseLexicographicOrder() {
            assertEquals(List.of("Z", "a"), ScopeNormalizer.protocolForm(List.of("a", "Z")));
        }

        @Test
        @DisplayName("should not modify the input list")
        void shouldNotModifyInput() {
            final var input = new ArrayList<>(List.of("c", "b", "a"));

            ScopeNormalizer.protocolForm(input);

            assertEquals(List.of("c", "b", "a"), input);
        }

        @Test
        @DisplayName("should return empty list for null")
        void shouldReturnEmptyForNull() {
            assertTrue(ScopeNormalizer.protocolForm(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("telemetryForm()")
    class TelemetryFormTests {

        @Test
        @DisplayName("should replace GUIDs with placeholder in request order")
        void shouldRedactGuids() {
            final var result = ScopeNormalizer.telemetryForm(
                    List.of("VSCODE_TENANT:" + TENANT, "openid", "VSCODE_CLIENT_ID:" + CLIENT));

            assertEquals("[\"VSCODE_TENANT:{guid}\",\"openid\",\"VSCODE_CLIENT_ID:{guid}\"]", result);
            assertFalse(result.contains(TENANT));
            assertFalse(result.contains(CLIENT));
        }

        @Test
        @DisplayName("should replace every GUID inside one scope")
        void shouldRedactAllGuidsInScope() {
            final var result = ScopeNormalizer.telemetryForm(List.of(TENANT + "/" + CLIENT));

            assertEquals("[\"{guid}/{guid}\"]", result);
        }

        @Test
        @DisplayName("should leave scopes without GUIDs unchanged")
        void shouldLeaveOtherScopesUnchanged() {
            final var result = ScopeNormalizer.telemetryForm(List.of("https://graph.microsoft.com/.default", "email"));

            assertEquals("[\"https://graph.microsoft.com/.default\",\"email\"]", result);
        }

        @Test
        @DisplayName("should not treat malformed GUIDs as GUIDs")
        void shouldIgnoreMalformedGuids() {
            final var almostGuid = "72f988bf-86f1-41af-91ab-2d7cd011db4";

            assertEquals(almostGuid, ScopeNormalizer.redact(almostGuid));
        }

        @Test
        @DisplayName("should serialize empty and null lists as empty JSON array")
        void shouldSerializeEmpty() {
            assertEquals("[]", ScopeNormalizer.telemetryForm(List.of()));
            assertEquals("[]", ScopeNormalizer.telemetryForm(null));
        }

        @Test
        @DisplayName("should not modify the input list")
        void shouldNotModifyInput() {
            final var input = new ArrayList<>(List.of("scope:" + TENANT));

            ScopeNormalizer.telemetryForm(input);

            assertEquals(List.of("scope:" + TENANT), input);
        }
    }
}
