package authrelay.core.model;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

/**
 * How a session operation's failure is reported to the caller.
 *
 * <p>Login uses {@link #PROPAGATE}; logout uses {@link #ABSORB}.
 */
public enum FailurePolicy {
    /** Re-raise the original failure unchanged. */
    PROPAGATE {
        @Override
        public <T> Uni<T> apply(Uni<T> operation, String description) {
            return operation;
        }
    },
    /** Log the failure and complete with {@code null}. */
    ABSORB {
        @Override
        public <T> Uni<T> apply(Uni<T> operation, String description) {
            return operation.onFailure().recoverWithItem(failure -> {
                LOG.warnf("%s failed, continuing: %s", description, failure.getMessage());
                return null;
            });
        }
    };

    private static final Logger LOG = Logger.getLogger(FailurePolicy.class);

    public abstract <T> Uni<T> apply(Uni<T> operation, String description);
}
