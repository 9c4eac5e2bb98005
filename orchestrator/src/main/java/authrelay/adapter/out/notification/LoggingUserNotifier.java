package authrelay.adapter.out.notification;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import authrelay.core.port.out.UserNotifier;

/**
 * User notifier for headless hosts: messages go to the {@code authrelay.user} log category.
 */
@ApplicationScoped
public class LoggingUserNotifier implements UserNotifier {

    private static final Logger LOG = Logger.getLogger("authrelay.user");

    @Override
    public void showError(String message) {
        LOG.error(message);
    }
}
