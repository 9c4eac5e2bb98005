package authrelay.adapter.in.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.quarkiverse.resteasy.problem.HttpProblem;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import authrelay.adapter.in.dto.CreateSessionRequest;
import authrelay.core.model.EndpointDescriptor;
import authrelay.core.model.ProviderKind;
import authrelay.core.model.ProviderOptions;
import authrelay.core.model.ProviderRegistration;
import authrelay.core.model.Session;
import authrelay.core.port.in.ProviderLifecycle;
import authrelay.core.port.in.SessionCapabilities;
import authrelay.spi.IdentityBackend;

@DisplayName("ProviderResource")
@ExtendWith(MockitoExtension.class)
class ProviderResourceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    @Mock
    private ProviderLifecycle lifecycle;

    @Mock
    private SessionCapabilities capabilities;

    private ProviderResource resource;
    private ProviderRegistration registration;

    @BeforeEach
    void setUp() {
        registration = new ProviderRegistration(
                "microsoft-sovereign-cloud",
                "Azure China",
                ProviderKind.ALTERNATE,
                new EndpointDescriptor("Azure China", "https://login.chinacloudapi.cn/", "Azure China"),
                mock(IdentityBackend.class),
                capabilities,
                () -> {},
                ProviderOptions.MULTIPLE_ACCOUNTS);
        lenient().when(lifecycle.findRegistration(anyString())).thenReturn(Optional.empty());
        lenient().when(lifecycle.findRegistration("microsoft-sovereign-cloud")).thenReturn(Optional.of(registration));

        resource = new ProviderResource();
        resource.lifecycle = lifecycle;
    }

    @Nested
    @DisplayName("Providers")
    class Providers {

        @Test
        @DisplayName("should list registered providers")
        void shouldListProviders() {
            when(lifecycle.registrations()).thenReturn(List.of(registration));

            var providers = resource.listProviders();

            assertEquals(1, providers.size());
            var dto = providers.get(0);
            assertEquals("microsoft-sovereign-cloud", dto.id());
            assertEquals("ALTERNATE", dto.kind());
            assertEquals("https://login.chinacloudapi.cn/", dto.endpoint());
            assertEquals(true, dto.supportsMultipleAccounts());
        }

        @Test
        @DisplayName("should throw not found for unknown provider")
        void shouldThrowForUnknownProvider() {
            var error = assertThrows(HttpProblem.class, () -> resource.getProvider("github"));

            assertEquals(404, error.getStatusCode());
            assertEquals("Authentication provider 'github' is not registered", error.getDetail());
        }
    }

    @Nested
    @DisplayName("Sessions")
    class Sessions {

        @Test
        @DisplayName("should create sessions through the capability object")
        void shouldCreateSession() {
            var scopes = List.of("openid", "email");
            when(capabilities.createSession(scopes))
                    .thenReturn(Uni.createFrom().item(new Session("s1", "user@contoso.cn", List.of("email", "openid"))));

            var dto = resource.createSession("microsoft-sovereign-cloud", new CreateSessionRequest(scopes))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("s1", dto.id());
            assertEquals(List.of("email", "openid"), dto.scopes());
        }

        @Test
        @DisplayName("should list sessions with empty scopes when none given")
        void shouldListSessions() {
            when(capabilities.getSessions(List.of()))
                    .thenReturn(Uni.createFrom().item(List.of(new Session("s1", "user", List.of("openid")))));

            var sessions = resource.getSessions("microsoft-sovereign-cloud", null).await().atMost(TIMEOUT);

            assertEquals(1, sessions.size());
            assertEquals("user", sessions.get(0).accountLabel());
        }

        @Test
        @DisplayName("should remove sessions through the capability object")
        void shouldRemoveSession() {
            when(capabilities.removeSession("s1")).thenReturn(Uni.createFrom().voidItem());

            resource.removeSession("microsoft-sovereign-cloud", "s1").await().atMost(TIMEOUT);

            verify(capabilities).removeSession("s1");
        }

        @Test
        @DisplayName("should not reach any backend for unknown provider")
        void shouldRejectUnknownProvider() {
            assertThrows(
                    HttpProblem.class,
                    () -> resource.removeSession("github", "s1"));

            verify(capabilities, never()).removeSession(anyString());
        }
    }
}
