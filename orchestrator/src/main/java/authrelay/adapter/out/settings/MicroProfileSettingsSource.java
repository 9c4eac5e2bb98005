package authrelay.adapter.out.settings;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

import authrelay.core.port.out.SettingsSource;

/**
 * MicroProfile Config implementation of SettingsSource.
 *
 * <p>Values come from application properties, environment and system properties.
 * Runtime overrides take precedence; overriding with {@code null} clears the setting
 * even when a property is configured.
 */
@ApplicationScoped
public class MicroProfileSettingsSource implements SettingsSource {

    private static final Logger LOG = Logger.getLogger(MicroProfileSettingsSource.class);

    private final Config config;
    private final ConcurrentMap<String, Optional<String>> overrides = new ConcurrentHashMap<>();

    @Inject
    public MicroProfileSettingsSource(Config config) {
        this.config = config;
    }

    @Override
    public Optional<String> get(String key) {
        final var override = overrides.get(key);
        if (override != null) {
            return override;
        }
        return config.getOptionalValue(key, String.class);
    }

    @Override
    public void update(String key, String value) {
        overrides.put(key, Optional.ofNullable(value));
        LOG.infof("Setting %s %s", key, value == null ? "cleared" : "updated");
    }
}
