package authrelay.core.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import authrelay.core.config.ProviderConfig;
import authrelay.core.model.ConfigurationChangedEvent;
import authrelay.core.model.EndpointDescriptor;
import authrelay.core.model.LifecycleState;
import authrelay.core.model.ProviderKind;
import authrelay.core.model.ProviderOptions;
import authrelay.core.model.ProviderRegistration;
import authrelay.core.port.in.ProviderLifecycle;
import authrelay.core.port.out.AuthenticationHost;
import authrelay.core.port.out.SettingsSource;
import authrelay.core.port.out.TelemetryGateway;

/**
 * Owns the default provider and the optional alternate (sovereign cloud) provider.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@code UNINITIALIZED} - nothing registered</li>
 *   <li>{@code DEFAULT_ACTIVE} - default provider registered, no alternate configured</li>
 *   <li>{@code DEFAULT_AND_ALTERNATE_ACTIVE} - both registered</li>
 *   <li>{@code STOPPED} - everything disposed</li>
 * </ol>
 *
 * <p>The default provider is registered once and never rebuilt. The alternate slot is
 * rebuilt on every change of the alternate endpoint setting: the current registration
 * and its backend are disposed first, then the new one is created.
 *
 * <p>Every slot mutation runs on a single reconfiguration thread, so the host never sees
 * two registrations for the same id. Each reconfiguration request takes a generation
 * number; a request overtaken by a later one still disposes the current alternate but
 * does not activate anything.
 */
@ApplicationScoped
public class ProviderLifecycleManager implements ProviderLifecycle {

    private static final Logger LOG = Logger.getLogger(ProviderLifecycleManager.class);

    private final ProviderConfig config;
    private final EndpointResolver endpointResolver;
    private final IdentityBackendProviderRegistry backendRegistry;
    private final AuthenticationHost host;
    private final SettingsSource settings;
    private final TelemetryGateway telemetry;
    private final ExecutorService reconfigurationExecutor;

    private final AtomicLong requestedGeneration = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile ProviderRegistration defaultRegistration;
    private volatile ProviderRegistration alternateRegistration;
    private volatile LifecycleState state = LifecycleState.UNINITIALIZED;

    @Inject
    public ProviderLifecycleManager(
            ProviderConfig config,
            EndpointResolver endpointResolver,
            IdentityBackendProviderRegistry backendRegistry,
            AuthenticationHost host,
            SettingsSource settings,
            TelemetryGateway telemetry) {
        this.config = config;
        this.endpointResolver = endpointResolver;
        this.backendRegistry = backendRegistry;
        this.host = host;
        this.settings = settings;
        this.telemetry = telemetry;
        this.reconfigurationExecutor = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "provider-reconfiguration");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start on boot. A failing default provider aborts startup; a failing alternate
     * provider is logged and the application keeps running with the default one.
     */
    void onStart(@Observes StartupEvent event) {
        try {
            start().await().indefinitely();
        } catch (RuntimeException e) {
            if (defaultRegistration == null) {
                throw e;
            }
            LOG.errorf(e, "Alternate provider could not be activated, continuing with default provider only");
        }
        LOG.infof("Provider lifecycle started: %s", state);
    }

    void onShutdown(@Observes ShutdownEvent event) {
        stop();
    }

    /**
     * Apply runtime setting changes fired by the host.
     */
    void onConfigurationChangedEvent(@Observes ConfigurationChangedEvent event) {
        onConfigurationChanged(event.key())
                .subscribe()
                .with(
                        ignored -> LOG.debugf("Configuration change for %s applied", event.key()),
                        failure -> LOG.errorf(
                                failure, "Failed to apply configuration change for %s", event.key()));
    }

    @Override
    public Uni<Void> start() {
        if (!started.compareAndSet(false, true)) {
            LOG.debug("Provider lifecycle already started");
            return Uni.createFrom().voidItem();
        }
        return serialized(this::registerDefault)
                .chain(this::applyConfiguration)
                .onFailure()
                .invoke(() -> {
                    if (defaultRegistration == null) {
                        started.set(false);
                    }
                });
    }

    @Override
    public Uni<Void> applyConfiguration() {
        return Uni.createFrom().deferred(() -> {
            if (stopped.get()) {
                LOG.debug("Lifecycle stopped, ignoring reconfiguration");
                return Uni.createFrom().voidItem();
            }
            final long generation = requestedGeneration.incrementAndGet();
            return serialized(() -> reconfigureAlternate(generation));
        });
    }

    @Override
    public Uni<Void> onConfigurationChanged(String key) {
        final var settingKey = config.alternate().settingKey();
        if (!affects(key, settingKey)) {
            LOG.tracef("Ignoring change of %s", key);
            return Uni.createFrom().voidItem();
        }
        LOG.infof("Setting %s changed, rebuilding alternate provider", settingKey);
        return applyConfiguration();
    }

    @Override
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        requestedGeneration.incrementAndGet();
        try {
            reconfigurationExecutor.submit(this::disposeAll).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while disposing providers");
        } catch (ExecutionException e) {
            LOG.errorf(e.getCause(), "Failed to dispose providers");
        } catch (RejectedExecutionException e) {
            LOG.warnf("Reconfiguration executor already shut down: %s", e.getMessage());
        } finally {
            reconfigurationExecutor.shutdown();
        }
    }

    @Override
    public LifecycleState state() {
        return state;
    }

    @Override
    public List<ProviderRegistration> registrations() {
        final var result = new ArrayList<ProviderRegistration>(2);
        final var defaultLeg = defaultRegistration;
        final var alternateLeg = alternateRegistration;
        if (defaultLeg != null) {
            result.add(defaultLeg);
        }
        if (alternateLeg != null) {
            result.add(alternateLeg);
        }
        return List.copyOf(result);
    }

    @Override
    public Optional<ProviderRegistration> findRegistration(String providerId) {
        return registrations().stream().filter(r -> r.id().equals(providerId)).findFirst();
    }

    private void registerDefault() {
        if (stopped.get()) {
            LOG.debug("Lifecycle stopped, not registering default provider");
            return;
        }
        final var defaults = config.defaultProvider();
        final var endpoint = EndpointDescriptor.fixed(defaults.endpoint(), defaults.displayName());
        defaultRegistration = register(ProviderKind.DEFAULT, defaults.id(), endpoint);
        state = LifecycleState.DEFAULT_ACTIVE;
    }

    private void reconfigureAlternate(long generation) {
        if (stopped.get()) {
            LOG.debug("Lifecycle stopped, ignoring reconfiguration");
            return;
        }
        if (defaultRegistration == null) {
            throw new IllegalStateException("Provider lifecycle has not been started");
        }

        disposeAlternate();

        if (generation != requestedGeneration.get()) {
            LOG.debugf("Reconfiguration %d superseded by %d", generation, requestedGeneration.get());
            return;
        }

        final var settingKey = config.alternate().settingKey();
        final var endpoint = endpointResolver.resolve(settings.get(settingKey));
        if (endpoint.isEmpty()) {
            LOG.debugf("No alternate provider configured by %s", settingKey);
            return;
        }

        activateAlternate(endpoint.get());
    }

    private void activateAlternate(EndpointDescriptor endpoint) {
        alternateRegistration = register(ProviderKind.ALTERNATE, config.alternate().id(), endpoint);
        state = LifecycleState.DEFAULT_AND_ALTERNATE_ACTIVE;
    }

    private ProviderRegistration register(ProviderKind kind, String providerId, EndpointDescriptor endpoint) {
        final var backend = backendRegistry.createBackend(endpoint);
        try {
            backend.initialize().await().indefinitely();
            final var broker = new SessionBroker(providerId, kind, backend, telemetry);
            final var handle =
                    host.register(providerId, endpoint.displayName(), broker, ProviderOptions.MULTIPLE_ACCOUNTS);
            LOG.infof(
                    "Registered %s provider %s (%s) for %s",
                    kind, providerId, endpoint.displayName(), endpoint.normalizedUrl());
            return new ProviderRegistration(
                    providerId,
                    endpoint.displayName(),
                    kind,
                    endpoint,
                    backend,
                    broker,
                    handle,
                    ProviderOptions.MULTIPLE_ACCOUNTS);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to register %s provider %s for %s", kind, providerId, endpoint.normalizedUrl());
            backend.close();
            throw e;
        }
    }

    private void disposeAlternate() {
        final var current = alternateRegistration;
        if (current == null) {
            return;
        }
        alternateRegistration = null;
        state = defaultRegistration != null ? LifecycleState.DEFAULT_ACTIVE : LifecycleState.UNINITIALIZED;
        dispose(current);
    }

    private void disposeAll() {
        disposeAlternate();
        final var current = defaultRegistration;
        defaultRegistration = null;
        if (current != null) {
            dispose(current);
        }
        state = LifecycleState.STOPPED;
    }

    private void dispose(ProviderRegistration registration) {
        try {
            registration.dispose();
            LOG.infof("Disposed %s provider %s", registration.kind(), registration.id());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to dispose provider %s cleanly", registration.id());
        }
    }

    private Uni<Void> serialized(Runnable task) {
        return Uni.createFrom()
                .<Void>item(() -> {
                    task.run();
                    return null;
                })
                .runSubscriptionOn(reconfigurationExecutor);
    }

    /**
     * A change of {@code changedKey} affects {@code settingKey} when they are equal or one
     * is a dotted section of the other.
     */
    static boolean affects(String changedKey, String settingKey) {
        if (changedKey == null || changedKey.isEmpty()) {
            return false;
        }
        return changedKey.equals(settingKey)
                || settingKey.startsWith(changedKey + ".")
                || changedKey.startsWith(settingKey + ".");
    }
}
