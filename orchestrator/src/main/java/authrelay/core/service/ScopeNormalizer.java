package authrelay.core.service;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Canonical forms of requested scope lists.
 *
 * <p>Two independent transforms are applied to the same request:
 * <ul>
 *   <li>{@link #protocolForm(List)} - sorted scopes handed to the identity backend, whose
 *       session matching and caching is sensitive to scope order</li>
 *   <li>{@link #telemetryForm(List)} - GUIDs (tenant and client ids) replaced by a
 *       placeholder, serialized as one JSON array string</li>
 * </ul>
 * Neither transform modifies its input.
 */
public final class ScopeNormalizer {

    public static final String GUID_PLACEHOLDER = "{guid}";

    private static final Pattern GUID = Pattern.compile(
            "[0-9A-F]{8}-[0-9A-F]{4}-[0-9A-F]{4}-[0-9A-F]{4}-[0-9A-F]{12}", Pattern.CASE_INSENSITIVE);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ScopeNormalizer() {}

    /**
     * Scopes in ascending lexicographic order.
     *
     * @param scopes requested scopes, may be null
     * @return a new sorted list containing exactly the requested scopes
     */
    public static List<String> protocolForm(List<String> scopes) {
        if (scopes == null) {
            return List.of();
        }
        return scopes.stream().sorted().toList();
    }

    /**
     * Scopes with GUIDs redacted, in request order, as a JSON array string.
     *
     * @param scopes requested scopes, may be null
     * @return e.g. {@code ["api://{guid}/.default","openid"]}
     */
    public static String telemetryForm(List<String> scopes) {
        final var redacted = scopes == null
                ? List.<String>of()
                : scopes.stream().map(ScopeNormalizer::redact).toList();
        try {
            return MAPPER.writeValueAsString(redacted);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize scopes", e);
        }
    }

    /**
     * Replace every GUID-shaped substring of a scope.
     */
    public static String redact(String scope) {
        if (scope == null) {
            return null;
        }
        return GUID.matcher(scope).replaceAll(Matcher.quoteReplacement(GUID_PLACEHOLDER));
    }
}
