package dev.apiproxy.host;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.apiproxy.host.config.PluginHostProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(PluginHostProperties.class)
public class PluginHostApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginHostApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PluginHostApplication.class, args);
    }

    @Bean
    PluginLauncher pluginLauncher(PluginHostProperties properties) {
        return definition -> PluginProcess.launch(definition.getName(), definition.getCommand(),
                definition.getEnvironment(), properties.getExitGrace());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    PluginManager pluginManager(PluginHostProperties properties, PluginLauncher launcher) {
        LOGGER.info("{} plugin definition(s) configured", properties.getDefinitions().size());
        return new PluginManager(properties, launcher, new ObjectMapper());
    }
}
