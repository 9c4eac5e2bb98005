package authrelay.adapter.out.telemetry;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import authrelay.config.TelemetryConfigMapping;
import authrelay.core.model.TelemetryEvent;
import authrelay.core.port.out.TelemetryGateway;
import authrelay.spi.TelemetryEventHandler;

/**
 * Dispatches telemetry events to registered handlers.
 *
 * <p>Handlers are discovered via {@link ServiceLoader} and invoked in priority order
 * (highest priority first). Events are dispatched asynchronously on a single daemon
 * thread so session operations never wait for a transport.
 *
 * <p>{@link #emit(TelemetryEvent)} never throws. When telemetry is disabled, or after
 * shutdown, events are dropped.
 */
@ApplicationScoped
public class TelemetryEventDispatcher implements TelemetryGateway {

    private static final Logger LOG = Logger.getLogger(TelemetryEventDispatcher.class);

    private final TelemetryConfigMapping config;
    private final MeterRegistry meterRegistry;
    private final boolean enabled;

    private List<TelemetryEventHandler> handlers;
    private ExecutorService executor;

    @Inject
    public TelemetryEventDispatcher(TelemetryConfigMapping config, MeterRegistry meterRegistry) {
        this.config = config;
        this.meterRegistry = meterRegistry;
        this.enabled = config != null && config.enabled();
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            LOG.debug("Telemetry is disabled - event dispatcher inactive");
            return;
        }

        final var loadedHandlers = ServiceLoader.load(TelemetryEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (var handler : loadedHandlers) {
            if (handler instanceof MetricsTelemetryEventHandler metricsHandler && config.metrics().enabled()) {
                metricsHandler.setMeterRegistry(meterRegistry);
            }
        }

        start(loadedHandlers);
    }

    /**
     * Select available handlers and start the dispatch thread.
     *
     * @param candidates handlers to choose from
     */
    void start(List<TelemetryEventHandler> candidates) {
        if (!enabled) {
            return;
        }

        handlers = candidates.stream()
                .filter(TelemetryEventHandler::isAvailable)
                .sorted(Comparator.comparingInt(TelemetryEventHandler::priority).reversed())
                .toList();

        if (handlers.isEmpty()) {
            LOG.warn("No telemetry event handlers found - events will not be processed");
        } else {
            LOG.infof(
                    "Loaded %d telemetry event handler(s): %s",
                    handlers.size(),
                    handlers.stream()
                            .map(h -> h.name() + "(priority=" + h.priority() + ")")
                            .toList());
        }

        executor = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "telemetry-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
        if (handlers != null) {
            handlers.forEach(handler -> {
                try {
                    handler.close();
                } catch (Exception e) {
                    LOG.warnf("Error closing handler %s: %s", handler.name(), e.getMessage());
                }
            });
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void emit(TelemetryEvent event) {
        if (!enabled || handlers == null || handlers.isEmpty() || event == null) {
            return;
        }

        try {
            executor.submit(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            LOG.debugf("Dropping telemetry event %s after shutdown", event.name());
        }
    }

    /**
     * Get the list of registered handlers.
     *
     * @return list of handlers (empty if disabled)
     */
    public List<TelemetryEventHandler> getHandlers() {
        return handlers != null ? handlers : List.of();
    }

    private void deliver(TelemetryEvent event) {
        for (var handler : handlers) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                LOG.warnf("Handler %s failed to process event %s: %s", handler.name(), event.name(), e.getMessage());
            }
        }
    }
}
