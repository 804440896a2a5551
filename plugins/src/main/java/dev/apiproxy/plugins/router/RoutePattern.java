package dev.apiproxy.plugins.router;

/**
 * Endpoint pattern of a custom route: an exact path, {@code /prefix/*} or {@code /prefix*}.
 *
 * @param pattern the pattern as configured
 * @param baseUrl base URL of the custom API
 */
public record RoutePattern(String pattern, String baseUrl) {

    public boolean matches(String endpoint) {
        if (pattern.equals(endpoint)) {
            return true;
        }
        if (pattern.endsWith("/*")) {
            return endpoint.startsWith(pattern.substring(0, pattern.length() - 2));
        }
        if (pattern.endsWith("*")) {
            return endpoint.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        return false;
    }

    /**
     * Full URL of the custom API call: the base URL followed by whatever the endpoint has
     * beyond the pattern's literal part.
     * @param endpoint a matching endpoint
     * @return the target URL
     */
    public String targetUrl(String endpoint) {
        String literal = pattern.endsWith("*") ? pattern.substring(0, pattern.length() - 1) : pattern;
        String rest = endpoint.startsWith(literal) ? endpoint.substring(literal.length()) : "";
        if (!rest.isEmpty() && !rest.startsWith("/") && !baseUrl.endsWith("/")) {
            rest = "/" + rest;
        }
        return baseUrl + rest;
    }
}
