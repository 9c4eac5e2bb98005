package authrelay.adapter.in.dto;

import java.util.List;

import authrelay.core.port.in.ProviderLifecycle;

/**
 * Lifecycle state and registered providers.
 */
public record LifecycleStatusDto(String state, List<ProviderDto> providers) {

    public static LifecycleStatusDto fromLifecycle(ProviderLifecycle lifecycle) {
        return new LifecycleStatusDto(
                lifecycle.state().name(),
                lifecycle.registrations().stream().map(ProviderDto::fromModel).toList());
    }
}
