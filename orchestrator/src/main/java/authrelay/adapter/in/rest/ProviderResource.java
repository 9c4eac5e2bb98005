package authrelay.adapter.in.rest;

import java.util.List;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import authrelay.adapter.in.dto.CreateSessionRequest;
import authrelay.adapter.in.dto.ProviderDto;
import authrelay.adapter.in.dto.SessionDto;
import authrelay.adapter.in.problem.ProviderProblem;
import authrelay.core.port.in.ProviderLifecycle;
import authrelay.core.port.in.SessionCapabilities;

/**
 * REST endpoints exposing the registered providers and their sessions.
 *
 * <p>Every session call goes through the provider's capability object, so telemetry and
 * failure handling match what an in-process host would observe.
 */
@Path("/providers")
@Produces(MediaType.APPLICATION_JSON)
public class ProviderResource {

    private static final Logger LOG = Logger.getLogger(ProviderResource.class);

    @Inject
    ProviderLifecycle lifecycle;

    @GET
    public List<ProviderDto> listProviders() {
        return lifecycle.registrations().stream().map(ProviderDto::fromModel).toList();
    }

    @GET
    @Path("/{providerId}")
    public ProviderDto getProvider(@PathParam("providerId") String providerId) {
        return lifecycle
                .findRegistration(providerId)
                .map(ProviderDto::fromModel)
                .orElseThrow(() -> ProviderProblem.providerNotFound(providerId));
    }

    @GET
    @Path("/{providerId}/sessions")
    public Uni<List<SessionDto>> getSessions(
            @PathParam("providerId") String providerId, @QueryParam("scopes") List<String> scopes) {
        return capabilities(providerId)
                .getSessions(scopes != null ? scopes : List.of())
                .map(sessions -> sessions.stream().map(SessionDto::fromModel).toList());
    }

    @POST
    @Path("/{providerId}/sessions")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<SessionDto> createSession(@PathParam("providerId") String providerId, CreateSessionRequest request) {
        final var scopes = request != null ? request.scopes() : List.<String>of();
        return capabilities(providerId)
                .createSession(scopes)
                .invoke(session -> LOG.infof("Session created with provider %s", providerId))
                .map(SessionDto::fromModel);
    }

    @DELETE
    @Path("/{providerId}/sessions/{sessionId}")
    public Uni<Void> removeSession(
            @PathParam("providerId") String providerId, @PathParam("sessionId") String sessionId) {
        return capabilities(providerId).removeSession(sessionId);
    }

    private SessionCapabilities capabilities(String providerId) {
        return lifecycle
                .findRegistration(providerId)
                .orElseThrow(() -> ProviderProblem.providerNotFound(providerId))
                .capabilities();
    }
}
