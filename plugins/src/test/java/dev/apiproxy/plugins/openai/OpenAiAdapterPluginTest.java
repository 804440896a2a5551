package dev.apiproxy.plugins.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.apiproxy.plugin.PluginConfig;
import dev.apiproxy.protocol.model.Metadata;
import dev.apiproxy.protocol.model.Payload;
import dev.apiproxy.protocol.model.ProxyRequest;
import dev.apiproxy.protocol.model.ProxyResponse;
import dev.apiproxy.protocol.model.RequestOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OpenAiAdapterPlugin")
class OpenAiAdapterPluginTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T10:15:30Z"), ZoneOffset.UTC);

    private final ObjectMapper mapper = new ObjectMapper();
    private OpenAiAdapterPlugin plugin;
    private OpenAiAdapterPlugin.Settings settings;

    @BeforeEach
    void setUp() throws IOException {
        plugin = new OpenAiAdapterPlugin(CLOCK);
        settings = plugin.configure(PluginConfig.from(mapper.readTree("{\"openai_api_key\":\"K\"}")));
    }

    private ProxyRequest adapted(String body) {
        ProxyRequest request = ProxyRequest.of("POST", "/v1/openai/chat/completions");
        if (body != null) {
            request = request.withBody(Payload.text(body));
        }
        return plugin.onRequest(settings, request).request();
    }

    @Nested
    @DisplayName("on_request")
    class OnRequest {

        @Test
        @DisplayName("adds the bearer token and rewrites the endpoint")
        void rewritesOpenAiRequest() {
            RequestOutcome outcome = plugin.onRequest(settings, ProxyRequest.of("POST", "/v1/openai/chat/completions"));

            assertTrue(outcome.proceed());
            ProxyRequest request = outcome.request();
            assertEquals("Bearer K", request.headers().get("Authorization"));
            assertEquals("/v1/chat/completions", request.endpoint());
            assertEquals(Map.of(Metadata.ORIGINAL_ENDPOINT, "/v1/openai/chat/completions", Metadata.PROVIDER, "openai"),
                request.metadata());
        }

        @Test
        @DisplayName("leaves other endpoints untouched")
        void otherEndpoints() {
            ProxyRequest request = ProxyRequest.of("GET", "/v1/other/thing");

            assertEquals(request, plugin.onRequest(settings, request).request());
        }

        @Test
        @DisplayName("without an api key no authorization header is added")
        void withoutApiKey() {
            OpenAiAdapterPlugin.Settings keyless = plugin.configure(PluginConfig.empty());

            ProxyRequest request = plugin.onRequest(keyless, ProxyRequest.of("POST", "/v1/openai/models")).request();

            assertFalse(request.headers().containsKey("Authorization"));
            assertEquals("/v1/models", request.endpoint());
        }

        @Test
        @DisplayName("fills model and user in a JSON body")
        void fillsDefaults() throws IOException {
            JsonNode body = mapper.readTree(adapted("{\"messages\":[]}").body().asText());

            assertEquals("gpt-3.5-turbo", body.get("model").asText());
            assertEquals("apiproxyd-20240305", body.get("user").asText());
            assertTrue(body.get("messages").isArray());
        }

        @Test
        @DisplayName("keeps values the client already set")
        void keepsClientValues() throws IOException {
            JsonNode body = mapper.readTree(adapted("{\"model\":\"gpt-4\",\"user\":\"alice\"}").body().asText());

            assertEquals("gpt-4", body.get("model").asText());
            assertEquals("alice", body.get("user").asText());
        }

        @Test
        @DisplayName("non-JSON bodies are forwarded unchanged")
        void nonJsonBody() {
            assertEquals("plain text", adapted("plain text").body().asText());
        }

        @Test
        @DisplayName("binary bodies stay binary after the rewrite")
        void binaryBodyStaysBinary() {
            ProxyRequest request = ProxyRequest.of("POST", "/v1/openai/chat/completions")
                .withBody(Payload.binary("{}".getBytes(StandardCharsets.UTF_8)));

            Payload body = plugin.onRequest(settings, request).request().body();

            assertTrue(body.isBinary());
            assertTrue(body.asText().contains("\"model\""));
        }
    }

    @Nested
    @DisplayName("on_response")
    class OnResponse {

        private final ProxyRequest openAiRequest = ProxyRequest.of("POST", "/v1/chat/completions")
            .withMetadata(Metadata.PROVIDER, "openai");

        @Test
        @DisplayName("extracts token usage into metadata")
        void extractsUsage() {
            ProxyResponse response = ProxyResponse.of(200, Payload.text(
                "{\"model\":\"gpt-4\",\"usage\":{\"total_tokens\":42,\"prompt_tokens\":40,\"completion_tokens\":2}}"));

            ProxyResponse result = plugin.onResponse(settings, openAiRequest, response);

            assertEquals("42", result.metadata().get("tokens_used"));
            assertEquals("40", result.metadata().get("prompt_tokens"));
            assertEquals("2", result.metadata().get("completion_tokens"));
            assertEquals("gpt-4", result.metadata().get("model"));
            assertEquals(response.body(), result.body());
        }

        @Test
        @DisplayName("is the identity for requests of other providers")
        void identityForOtherProviders() {
            ProxyRequest other = ProxyRequest.of("GET", "/x").withMetadata(Metadata.PROVIDER, "anthropic");
            ProxyResponse response = ProxyResponse.of(200, Payload.text("{\"usage\":{\"total_tokens\":1}}"))
                .withMetadata("existing", "1");

            assertEquals(response, plugin.onResponse(settings, other, response));
        }

        @Test
        @DisplayName("unparseable bodies pass through")
        void unparseableBody() {
            ProxyResponse response = ProxyResponse.of(502, Payload.text("<html>bad gateway</html>"));

            assertEquals(response, plugin.onResponse(settings, openAiRequest, response));
        }

        @Test
        @DisplayName("existing metadata is kept and collisions take the new value")
        void metadataMerge() {
            ProxyResponse response = ProxyResponse.of(200, Payload.text("{\"usage\":{\"total_tokens\":7}}"))
                .withMetadata(Map.of("keep", "me", "tokens_used", "old"));

            ProxyResponse result = plugin.onResponse(settings, openAiRequest, response);

            assertEquals("me", result.metadata().get("keep"));
            assertEquals("7", result.metadata().get("tokens_used"));
        }

        @Test
        @DisplayName("cache hits are marked in metadata")
        void cacheHit() {
            ProxyResponse result = plugin.onCacheHit(settings, openAiRequest, ProxyResponse.of(200, Payload.empty()));

            assertEquals("true", result.metadata().get(Metadata.CACHED));
            assertEquals("2024-03-05T10:15:30Z", result.metadata().get("cache_hit_at"));
        }
    }
}
