package dev.apiproxy.protocol.model;

import java.util.Objects;

/**
 * Result of an {@code on_request} hook. When {@code proceed} is {@code false} the plugin has
 * short-circuited the exchange and {@code response} is the final outcome the host returns to its
 * client without contacting upstream.
 *
 * @param request the request to forward, possibly mutated
 * @param proceed the wire {@code continue} flag
 * @param response synthetic response, required exactly when {@code proceed} is {@code false}
 */
public record RequestOutcome(ProxyRequest request, boolean proceed, ProxyResponse response) {

    public RequestOutcome {
        Objects.requireNonNull(request, "request");
        if (!proceed && response == null) {
            throw new IllegalArgumentException("A short-circuited request must carry a response");
        }
        if (proceed) {
            response = null;
        }
    }

    public static RequestOutcome proceed(ProxyRequest request) {
        return new RequestOutcome(request, true, null);
    }

    public static RequestOutcome shortCircuit(ProxyRequest request, ProxyResponse response) {
        return new RequestOutcome(request, false, response);
    }
}
