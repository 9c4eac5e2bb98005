package authrelay.adapter.out.host;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import authrelay.core.model.ProviderOptions;
import authrelay.core.port.in.SessionCapabilities;

@DisplayName("InMemoryAuthenticationHost")
class InMemoryAuthenticationHostTest {

    private InMemoryAuthenticationHost host;
    private SessionCapabilities capabilities;

    @BeforeEach
    void setUp() {
        host = new InMemoryAuthenticationHost();
        capabilities = mock(SessionCapabilities.class);
    }

    @Test
    @DisplayName("should expose registered providers")
    void shouldExposeRegisteredProviders() {
        host.register("microsoft-sovereign-cloud", "Azure China", capabilities, ProviderOptions.MULTIPLE_ACCOUNTS);
        host.register("microsoft", "Microsoft", capabilities, ProviderOptions.MULTIPLE_ACCOUNTS);

        assertEquals(List.of("microsoft", "microsoft-sovereign-cloud"), host.registeredProviderIds());
        var hosted = host.find("microsoft-sovereign-cloud").orElseThrow();
        assertEquals("Azure China", hosted.displayName());
        assertTrue(hosted.options().supportsMultipleAccounts());
    }

    @Test
    @DisplayName("should reject a second registration for a live id")
    void shouldRejectDuplicateRegistration() {
        host.register("microsoft", "Microsoft", capabilities, ProviderOptions.MULTIPLE_ACCOUNTS);

        var error = assertThrows(
                IllegalStateException.class,
                () -> host.register("microsoft", "Other", capabilities, ProviderOptions.MULTIPLE_ACCOUNTS));
        assertTrue(error.getMessage().contains("already registered"));
        assertEquals("Microsoft", host.find("microsoft").orElseThrow().displayName());
    }

    @Test
    @DisplayName("should allow re-registration after dispose")
    void shouldAllowReRegistrationAfterDispose() {
        var handle = host.register("microsoft", "Microsoft", capabilities, ProviderOptions.MULTIPLE_ACCOUNTS);

        handle.dispose();
        host.register("microsoft", "Microsoft", capabilities, ProviderOptions.MULTIPLE_ACCOUNTS);

        assertEquals(1, host.size());
    }

    @Test
    @DisplayName("should ignore stale and repeated disposal")
    void shouldIgnoreStaleDisposal() {
        var first = host.register("microsoft", "First", capabilities, ProviderOptions.MULTIPLE_ACCOUNTS);
        first.dispose();
        host.register("microsoft", "Second", capabilities, ProviderOptions.MULTIPLE_ACCOUNTS);

        first.dispose();

        assertEquals("Second", host.find("microsoft").orElseThrow().displayName());
    }
}
