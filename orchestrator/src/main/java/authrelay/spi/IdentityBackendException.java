package authrelay.spi;

/**
 * Exception thrown by identity backends when the login protocol or credential
 * persistence fails.
 *
 * <p>Backends may also fail with other runtime exceptions; this type exists so that
 * adapters can map protocol failures to a gateway-style error response.
 */
public class IdentityBackendException extends RuntimeException {

    public IdentityBackendException(String message) {
        super(message);
    }

    public IdentityBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
