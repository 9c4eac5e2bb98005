package authrelay.core.model;

/**
 * Options passed to the host along with a provider registration.
 *
 * @param supportsMultipleAccounts whether several accounts may be signed in at once
 */
public record ProviderOptions(boolean supportsMultipleAccounts) {

    public static final ProviderOptions MULTIPLE_ACCOUNTS = new ProviderOptions(true);
}
