package authrelay.core.model;

/**
 * States of the provider lifecycle.
 */
public enum LifecycleState {
    UNINITIALIZED,
    DEFAULT_ACTIVE,
    DEFAULT_AND_ALTERNATE_ACTIVE,
    STOPPED
}
