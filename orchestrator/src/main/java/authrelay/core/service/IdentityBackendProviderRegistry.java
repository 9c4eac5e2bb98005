package authrelay.core.service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import authrelay.core.config.ProviderConfig;
import authrelay.core.model.EndpointDescriptor;
import authrelay.spi.IdentityBackend;
import authrelay.spi.IdentityBackendProvider;

/**
 * Registry for identity backend providers.
 *
 * <p>Discovers available providers via CDI and selects the appropriate one
 * based on configuration and availability.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (authrelay.providers.backend.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class IdentityBackendProviderRegistry {

    private static final Logger LOG = Logger.getLogger(IdentityBackendProviderRegistry.class);

    private final Instance<IdentityBackendProvider> providers;
    private final ProviderConfig config;

    private volatile IdentityBackendProvider selectedProvider;

    @Inject
    public IdentityBackendProviderRegistry(Instance<IdentityBackendProvider> providers, ProviderConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Create a new backend for an endpoint using the selected provider.
     *
     * @param endpoint the login endpoint
     * @return a new, uninitialized backend
     */
    public IdentityBackend createBackend(EndpointDescriptor endpoint) {
        final var provider = getProvider();
        LOG.debugf("Creating %s identity backend for %s", provider.name(), endpoint.normalizedUrl());
        return provider.create(endpoint);
    }

    /**
     * Get the selected identity backend provider.
     *
     * @return Selected provider
     * @throws IllegalStateException if no providers are available
     */
    public synchronized IdentityBackendProvider getProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private IdentityBackendProvider selectProvider() {
        final var configuredProvider = config.backend().provider();
        final var availableProviders = providers.stream()
                .filter(IdentityBackendProvider::isAvailable)
                .sorted(Comparator.comparingInt(IdentityBackendProvider::priority)
                        .reversed())
                .toList();

        LOG.debugf(
                "Available identity backend providers: %s",
                availableProviders.stream().map(IdentityBackendProvider::name).toList());

        Optional<IdentityBackendProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured identity backend provider: %s", configuredProvider);
            return configured.get();
        }

        if (!configuredProvider.equals("memory")) {
            LOG.warnf("Configured identity backend provider '%s' is not available, falling back", configuredProvider);
        }

        if (!availableProviders.isEmpty()) {
            final var provider = availableProviders.get(0);
            LOG.infof("Using identity backend provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No identity backend providers available");
    }

    /**
     * Get all available providers (for health checks).
     *
     * @return List of available providers
     */
    public List<IdentityBackendProvider> getAvailableProviders() {
        return providers.stream().filter(IdentityBackendProvider::isAvailable).toList();
    }
}
