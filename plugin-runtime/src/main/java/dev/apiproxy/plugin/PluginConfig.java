package dev.apiproxy.plugin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.apiproxy.protocol.ErrorKind;
import dev.apiproxy.protocol.PluginProtocolException;
import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration object received with {@code init}. Typed accessors validate recognised keys and
 * apply defaults; keys a plugin does not recognise stay available through {@link #extensions}.
 * A value of the wrong type fails with {@link ErrorKind#INVALID_PARAMS}.
 */
public final class PluginConfig {

    private static final PluginConfig EMPTY = new PluginConfig(JsonNodeFactory.instance.objectNode());

    private final ObjectNode values;

    private PluginConfig(ObjectNode values) {
        this.values = values;
    }

    public static PluginConfig empty() {
        return EMPTY;
    }

    /**
     * @param node the {@code init} parameter; JSON {@code null} is treated as empty
     * @return the configuration
     * @throws PluginProtocolException when the node is not an object
     */
    public static PluginConfig from(JsonNode node) {
        if (node == null || node.isNull()) {
            return EMPTY;
        }
        if (!node.isObject()) {
            throw new PluginProtocolException(ErrorKind.INVALID_PARAMS,
                "init expects a configuration object, got " + node.getNodeType());
        }
        return new PluginConfig(((ObjectNode) node).deepCopy());
    }

    public boolean has(String key) {
        return values.hasNonNull(key);
    }

    public String getString(String key, String defaultValue) {
        JsonNode value = values.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isTextual()) {
            throw invalid(key, "a string", value);
        }
        return value.asText();
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        JsonNode value = values.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isBoolean()) {
            throw invalid(key, "a boolean", value);
        }
        return value.booleanValue();
    }

    public long getLong(String key, long defaultValue) {
        JsonNode value = values.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw invalid(key, "an integer", value);
        }
        return value.longValue();
    }

    public Duration getMillis(String key, Duration defaultValue) {
        if (!has(key)) {
            return defaultValue;
        }
        long millis = getLong(key, defaultValue.toMillis());
        if (millis <= 0) {
            throw new PluginProtocolException(ErrorKind.INVALID_PARAMS, "Config key '" + key + "' must be positive");
        }
        return Duration.ofMillis(millis);
    }

    /**
     * Read an object of string values, preserving key order.
     * @param key configuration key
     * @return the entries, empty when the key is absent
     */
    public Map<String, String> getStringMap(String key) {
        JsonNode value = values.get(key);
        if (value == null || value.isNull()) {
            return Collections.emptyMap();
        }
        if (!value.isObject()) {
            throw invalid(key, "an object", value);
        }
        Map<String, String> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw invalid(key + "." + field.getKey(), "a string", field.getValue());
            }
            result.put(field.getKey(), field.getValue().asText());
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Entries whose keys are not in {@code recognized}, passed through untouched.
     * @param recognized keys the caller understands
     * @return the remaining entries
     */
    public Map<String, JsonNode> extensions(Set<String> recognized) {
        Map<String, JsonNode> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = values.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!recognized.contains(field.getKey())) {
                result.put(field.getKey(), field.getValue().deepCopy());
            }
        }
        return Collections.unmodifiableMap(result);
    }

    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        values.fieldNames().forEachRemaining(keys::add);
        return Collections.unmodifiableSet(keys);
    }

    public JsonNode asJson() {
        return values.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PluginConfig other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    /**
     * Keys only: configuration may contain credentials.
     */
    @Override
    public String toString() {
        return "PluginConfig" + keys();
    }

    private static PluginProtocolException invalid(String key, String expected, JsonNode actual) {
        return new PluginProtocolException(ErrorKind.INVALID_PARAMS,
            "Config key '" + key + "' must be " + expected + ", got " + actual.getNodeType());
    }
}
