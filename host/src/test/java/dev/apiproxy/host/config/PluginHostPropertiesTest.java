package dev.apiproxy.host.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginHostProperties binding")
class PluginHostPropertiesTest {

    private static PluginHostProperties bind(Map<String, String> source) {
        return new Binder(new MapConfigurationPropertySource(source))
            .bindOrCreate("apiproxy.plugins", PluginHostProperties.class);
    }

    @Test
    @DisplayName("defaults apply without configuration")
    void defaults() {
        PluginHostProperties properties = bind(Map.of());

        assertTrue(properties.isEnabled());
        assertEquals(Duration.ofSeconds(5), properties.getCallTimeout());
        assertEquals(Duration.ofSeconds(2), properties.getExitGrace());
        assertTrue(properties.getDefinitions().isEmpty());
    }

    @Test
    @DisplayName("binds definitions with per-plugin overrides")
    void definitions() {
        PluginHostProperties properties = bind(Map.of(
            "apiproxy.plugins.call-timeout", "3s",
            "apiproxy.plugins.definitions[0].name", "openai_adapter",
            "apiproxy.plugins.definitions[0].command[0]", "java",
            "apiproxy.plugins.definitions[0].command[1]", "-jar",
            "apiproxy.plugins.definitions[0].config[openai_api_key]", "K",
            "apiproxy.plugins.definitions[1].name", "custom_router",
            "apiproxy.plugins.definitions[1].enabled", "false",
            "apiproxy.plugins.definitions[1].call-timeout", "15s"));

        List<PluginHostProperties.Definition> definitions = properties.getDefinitions();
        assertEquals(2, definitions.size());

        PluginHostProperties.Definition openai = definitions.get(0);
        assertEquals(List.of("java", "-jar"), openai.getCommand());
        assertEquals("K", openai.getConfig().get("openai_api_key"));
        assertEquals(Duration.ofSeconds(3), openai.effectiveCallTimeout(properties.getCallTimeout()));

        PluginHostProperties.Definition router = definitions.get(1);
        assertFalse(router.isEnabled());
        assertEquals(Duration.ofSeconds(15), router.effectiveCallTimeout(properties.getCallTimeout()));
    }
}
