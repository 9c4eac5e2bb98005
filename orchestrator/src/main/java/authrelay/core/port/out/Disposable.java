package authrelay.core.port.out;

/**
 * Handle returned by the host that undoes a registration.
 */
@FunctionalInterface
public interface Disposable {

    /**
     * Undo the registration. Calling it more than once has no further effect.
     */
    void dispose();
}
