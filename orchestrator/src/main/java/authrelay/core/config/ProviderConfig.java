package authrelay.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for the registered authentication providers.
 *
 * <p>Configuration prefix: {@code authrelay.providers}
 *
 * <p>The default provider is fixed for the lifetime of the process. The alternate
 * (sovereign cloud) provider is driven by the raw setting named by
 * {@code authrelay.providers.alternate.setting-key}, which can change at runtime.
 *
 * <p>Example configuration:
 * <pre>{@code
 * authrelay.providers.default.endpoint=https://login.microsoftonline.com/
 * authrelay.providers.backend.provider=memory
 * microsoft-sovereign-cloud.endpoint=Azure China
 * }</pre>
 */
@ConfigMapping(prefix = "authrelay.providers")
public interface ProviderConfig {

    /**
     * The fixed default provider.
     */
    @WithName("default")
    DefaultProviderConfig defaultProvider();

    /**
     * The configurable alternate provider.
     */
    AlternateProviderConfig alternate();

    /**
     * Identity backend selection.
     */
    BackendConfig backend();

    interface DefaultProviderConfig {

        /**
         * Provider id registered with the host.
         *
         * @return provider id (default: microsoft)
         */
        @WithDefault("microsoft")
        String id();

        /**
         * Name shown to users.
         *
         * @return display name (default: Microsoft)
         */
        @WithName("display-name")
        @WithDefault("Microsoft")
        String displayName();

        /**
         * Login endpoint of the default provider.
         *
         * @return endpoint URL
         */
        @WithDefault("https://login.microsoftonline.com/")
        String endpoint();
    }

    interface AlternateProviderConfig {

        /**
         * Provider id registered with the host. The display name comes from the endpoint.
         *
         * @return provider id (default: microsoft-sovereign-cloud)
         */
        @WithDefault("microsoft-sovereign-cloud")
        String id();

        /**
         * Name of the raw setting selecting the alternate endpoint. Its value is either a
         * sovereign cloud name ("Azure China", "Azure US Government") or a login URL.
         *
         * @return setting key (default: microsoft-sovereign-cloud.endpoint)
         */
        @WithName("setting-key")
        @WithDefault("microsoft-sovereign-cloud.endpoint")
        String settingKey();
    }

    interface BackendConfig {

        /**
         * Identity backend provider name.
         *
         * @return provider name (default: memory)
         */
        @WithDefault("memory")
        String provider();
    }
}
