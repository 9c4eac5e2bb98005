package authrelay.core.port.out;

import java.util.Optional;

/**
 * Port for reading (and overriding at runtime) raw string settings.
 */
public interface SettingsSource {

    /**
     * Current value of a setting.
     *
     * @param key setting key
     * @return the value, or empty when unset
     */
    Optional<String> get(String key);

    /**
     * Override a setting at runtime. A {@code null} value clears the setting.
     *
     * <p>Callers are responsible for notifying the lifecycle of the change.
     *
     * @param key   setting key
     * @param value new value, or null to clear
     */
    void update(String key, String value);
}
