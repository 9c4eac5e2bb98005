package authrelay.adapter.in.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import authrelay.adapter.in.dto.LifecycleStatusDto;
import authrelay.core.port.in.ProviderLifecycle;
import authrelay.core.port.out.SettingsSource;

/**
 * REST endpoints for changing settings at runtime.
 *
 * <p>Acts as the host's configuration-change callback: the new value is stored, the
 * lifecycle is told which key changed, and the response reports the resulting state.
 */
@Path("/settings")
@Produces(MediaType.APPLICATION_JSON)
public class SettingsResource {

    @Inject
    SettingsSource settings;

    @Inject
    ProviderLifecycle lifecycle;

    @PUT
    @Path("/{key}")
    @Consumes(MediaType.TEXT_PLAIN)
    public Uni<LifecycleStatusDto> updateSetting(@PathParam("key") String key, String value) {
        settings.update(key, value);
        return changed(key);
    }

    @DELETE
    @Path("/{key}")
    public Uni<LifecycleStatusDto> clearSetting(@PathParam("key") String key) {
        settings.update(key, null);
        return changed(key);
    }

    private Uni<LifecycleStatusDto> changed(String key) {
        return lifecycle.onConfigurationChanged(key).map(ignored -> LifecycleStatusDto.fromLifecycle(lifecycle));
    }
}
