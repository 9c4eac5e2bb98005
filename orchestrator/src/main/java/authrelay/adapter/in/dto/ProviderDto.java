package authrelay.adapter.in.dto;

import authrelay.core.model.ProviderRegistration;

/**
 * Registered provider as returned by the REST API.
 */
public record ProviderDto(String id, String displayName, String kind, String endpoint, boolean supportsMultipleAccounts) {

    public static ProviderDto fromModel(ProviderRegistration registration) {
        return new ProviderDto(
                registration.id(),
                registration.displayName(),
                registration.kind().name(),
                registration.endpoint().normalizedUrl(),
                registration.supportsMultipleAccounts());
    }
}
