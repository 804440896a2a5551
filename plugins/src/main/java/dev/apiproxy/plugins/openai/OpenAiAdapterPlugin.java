package dev.apiproxy.plugins.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.apiproxy.plugin.PluginConfig;
import dev.apiproxy.plugin.PluginInfo;
import dev.apiproxy.plugin.PluginServer;
import dev.apiproxy.plugin.ProxyPlugin;
import dev.apiproxy.protocol.model.Metadata;
import dev.apiproxy.protocol.model.Payload;
import dev.apiproxy.protocol.model.ProxyRequest;
import dev.apiproxy.protocol.model.ProxyResponse;
import dev.apiproxy.protocol.model.RequestOutcome;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adapts requests under {@code /v1/openai/} to the OpenAI API: adds the bearer token, rewrites
 * the endpoint to {@code /v1/...}, fills request defaults and extracts token usage from
 * responses into metadata.
 */
public final class OpenAiAdapterPlugin implements ProxyPlugin<OpenAiAdapterPlugin.Settings> {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiAdapterPlugin.class);

    public static final PluginInfo INFO = new PluginInfo("openai_adapter", "1.0.0");

    public static final String PROVIDER_OPENAI = "openai";

    static final String KEY_API_KEY = "openai_api_key";
    static final String KEY_DEFAULT_MODEL = "default_model";
    static final String KEY_USER_PREFIX = "user_prefix";
    static final String KEY_ENDPOINT_PREFIX = "endpoint_prefix";
    static final String KEY_UPSTREAM_PREFIX = "upstream_prefix";

    private static final Set<String> RECOGNIZED_KEYS = Set.of(KEY_API_KEY, KEY_DEFAULT_MODEL, KEY_USER_PREFIX,
        KEY_ENDPOINT_PREFIX, KEY_UPSTREAM_PREFIX);

    private static final DateTimeFormatter USER_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock;

    public OpenAiAdapterPlugin() {
        this(Clock.systemUTC());
    }

    public OpenAiAdapterPlugin(Clock clock) {
        this.clock = clock;
    }

    /**
     * Validated configuration.
     *
     * @param apiKey bearer token to inject, empty to leave authorization untouched
     * @param defaultModel model used when a request body names none
     * @param userPrefix prefix of the generated {@code user} field
     * @param endpointPrefix endpoints handled by this plugin
     * @param upstreamPrefix replacement for {@code endpointPrefix}
     */
    public record Settings(String apiKey, String defaultModel, String userPrefix, String endpointPrefix,
            String upstreamPrefix) {

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isEmpty();
        }
    }

    @Override
    public PluginInfo info() {
        return INFO;
    }

    @Override
    public Settings configure(PluginConfig config) {
        Settings settings = new Settings(
            config.getString(KEY_API_KEY, ""),
            config.getString(KEY_DEFAULT_MODEL, "gpt-3.5-turbo"),
            config.getString(KEY_USER_PREFIX, "apiproxyd"),
            config.getString(KEY_ENDPOINT_PREFIX, "/v1/openai/"),
            config.getString(KEY_UPSTREAM_PREFIX, "/v1/"));
        Map<String, JsonNode> extensions = config.extensions(RECOGNIZED_KEYS);
        if (!extensions.isEmpty()) {
            LOGGER.info("Ignoring unrecognized config keys {}", extensions.keySet());
        }
        LOGGER.info("Initialized OpenAI adapter (api key {})", settings.hasApiKey() ? "set" : "not set");
        return settings;
    }

    @Override
    public RequestOutcome onRequest(Settings settings, ProxyRequest request) {
        String endpoint = request.endpoint();
        if (!endpoint.startsWith(settings.endpointPrefix())) {
            return RequestOutcome.proceed(request);
        }
        LOGGER.info("Processing OpenAI request to {}", endpoint);

        ProxyRequest adapted = request;
        if (settings.hasApiKey()) {
            adapted = adapted.withHeader("Authorization", "Bearer " + settings.apiKey());
        }
        String upstream = settings.upstreamPrefix() + endpoint.substring(settings.endpointPrefix().length());
        adapted = adapted.rewriteEndpoint(upstream).withMetadata(Metadata.PROVIDER, PROVIDER_OPENAI);

        if (!adapted.body().isEmpty()) {
            adapted = adapted.withBody(fillRequestDefaults(settings, adapted.body()));
        }
        return RequestOutcome.proceed(adapted);
    }

    @Override
    public ProxyResponse onResponse(Settings settings, ProxyRequest request, ProxyResponse response) {
        if (!PROVIDER_OPENAI.equals(request.metadataValue(Metadata.PROVIDER))) {
            return response;
        }
        ObjectNode body = parseObject(response.body());
        if (body == null) {
            LOGGER.warn("Could not parse OpenAI response body as JSON");
            return response;
        }
        Map<String, String> updates = new LinkedHashMap<>();
        JsonNode usage = body.get("usage");
        if (usage != null && usage.isObject()) {
            updates.put("tokens_used", usage.path("total_tokens").asText("0"));
            updates.put("prompt_tokens", usage.path("prompt_tokens").asText("0"));
            updates.put("completion_tokens", usage.path("completion_tokens").asText("0"));
        }
        if (body.hasNonNull("model")) {
            updates.put("model", body.get("model").asText());
        }
        LOGGER.info("Response processed: tokens={}", updates.getOrDefault("tokens_used", "unknown"));
        return updates.isEmpty() ? response : response.withMetadata(updates);
    }

    @Override
    public ProxyResponse onCacheHit(Settings settings, ProxyRequest request, ProxyResponse response) {
        if (!PROVIDER_OPENAI.equals(request.metadataValue(Metadata.PROVIDER))) {
            return response;
        }
        LOGGER.info("Cache HIT for OpenAI request to {}", request.endpoint());
        Map<String, String> updates = new LinkedHashMap<>();
        updates.put(Metadata.CACHED, "true");
        updates.put("cache_hit_at", Instant.now(clock).toString());
        return response.withMetadata(updates);
    }

    @Override
    public void shutdown(Settings settings) {
        LOGGER.info("Shutting down OpenAI adapter");
    }

    private Payload fillRequestDefaults(Settings settings, Payload body) {
        ObjectNode json = parseObject(body);
        if (json == null) {
            LOGGER.warn("Could not parse request body as JSON, forwarding it unchanged");
            return body;
        }
        if (!json.has("model")) {
            json.put("model", settings.defaultModel());
        }
        if (!json.hasNonNull("user")) {
            json.put("user", settings.userPrefix() + "-" + LocalDate.now(clock).format(USER_DATE));
        }
        try {
            LOGGER.info("Transformed request for model: {}", json.path("model").asText());
            return body.withText(mapper.writeValueAsString(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to re-encode request body", e);
        }
    }

    private ObjectNode parseObject(Payload body) {
        if (body.isEmpty()) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(body.asText());
            return node != null && node.isObject() ? (ObjectNode) node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public static void main(String[] args) throws IOException {
        try (PluginServer<Settings> server = PluginServer.stdio(new OpenAiAdapterPlugin())) {
            server.run();
        }
    }
}
