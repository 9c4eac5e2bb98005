package authrelay.core.model;

/**
 * CDI event fired when a configuration setting changes at runtime.
 *
 * @param key the changed setting key or section
 */
public record ConfigurationChangedEvent(String key) {}
