package authrelay.core.port.out;

/**
 * Port for messages shown to the user of the host application.
 */
public interface UserNotifier {

    void showError(String message);
}
