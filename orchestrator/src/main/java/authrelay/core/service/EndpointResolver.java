package authrelay.core.service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import authrelay.core.model.EndpointDescriptor;
import authrelay.core.model.SovereignCloud;
import authrelay.core.port.out.UserNotifier;

/**
 * Turns the alternate endpoint setting into a validated endpoint.
 *
 * <p>Resolution rules:
 * <ol>
 *   <li>An absent or blank value selects no alternate endpoint</li>
 *   <li>A sovereign cloud name is replaced by its login URL and keeps the name as display name</li>
 *   <li>The URL must be absolute with an authority; otherwise one error is shown to the user</li>
 *   <li>A trailing {@code /} is appended when missing</li>
 *   <li>Without a cloud name, the URI authority is the display name</li>
 * </ol>
 */
@ApplicationScoped
public class EndpointResolver {

    private static final Logger LOG = Logger.getLogger(EndpointResolver.class);

    private final UserNotifier notifier;

    @Inject
    public EndpointResolver(UserNotifier notifier) {
        this.notifier = notifier;
    }

    public Optional<EndpointDescriptor> resolve(Optional<String> settingValue) {
        return resolve(settingValue.orElse(null));
    }

    /**
     * Resolve a raw setting value.
     *
     * @param settingValue raw value, may be null
     * @return the endpoint, or empty when no alternate provider should be active
     */
    public Optional<EndpointDescriptor> resolve(String settingValue) {
        if (settingValue == null || settingValue.isBlank()) {
            return Optional.empty();
        }

        final var cloud = SovereignCloud.fromSettingValue(settingValue);
        final var url = cloud.map(SovereignCloud::loginUrl).orElse(settingValue);

        final URI uri;
        try {
            uri = parseStrict(url);
        } catch (URISyntaxException e) {
            LOG.warnf("Ignoring invalid sovereign cloud endpoint '%s': %s", settingValue, e.getMessage());
            notifier.showError("Sovereign cloud login URI is not a valid URI: " + e.getMessage());
            return Optional.empty();
        }

        final var normalizedUrl = url.endsWith("/") ? url : url + "/";
        final var displayName = cloud.map(SovereignCloud::displayName).orElse(uri.getRawAuthority());

        LOG.debugf("Resolved sovereign cloud endpoint %s (%s)", normalizedUrl, displayName);
        return Optional.of(new EndpointDescriptor(settingValue, normalizedUrl, displayName));
    }

    private static URI parseStrict(String value) throws URISyntaxException {
        final var uri = new URI(value);
        if (uri.getScheme() == null) {
            throw new URISyntaxException(value, "Scheme is missing");
        }
        if (uri.getRawAuthority() == null || uri.getRawAuthority().isEmpty()) {
            throw new URISyntaxException(value, "Authority is missing");
        }
        return uri;
    }
}
