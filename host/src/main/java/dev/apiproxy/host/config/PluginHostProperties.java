package dev.apiproxy.host.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration of the plugins the host loads. Plugins are started and chained in the order
 * they are listed.
 */
@ConfigurationProperties(prefix = "apiproxy.plugins")
public class PluginHostProperties {

	/**
	 * Master switch. When off no plugin is started and exchanges pass through unchanged.
	 */
	private boolean enabled = true;

	/**
	 * Default time a single plugin call may take.
	 */
	private Duration callTimeout = Duration.ofSeconds(5);

	/**
	 * Time a plugin process gets to exit after its input is closed.
	 */
	private Duration exitGrace = Duration.ofSeconds(2);

	private List<Definition> definitions = new ArrayList<>();

	public boolean isEnabled() {
		return enabled;
	}

	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

	public Duration getCallTimeout() {
		return callTimeout;
	}

	public void setCallTimeout(Duration callTimeout) {
		this.callTimeout = callTimeout;
	}

	public Duration getExitGrace() {
		return exitGrace;
	}

	public void setExitGrace(Duration exitGrace) {
		this.exitGrace = exitGrace;
	}

	public List<Definition> getDefinitions() {
		return definitions;
	}

	public void setDefinitions(List<Definition> definitions) {
		this.definitions = definitions;
	}

	/**
	 * One plugin entry.
	 */
	public static class Definition {

		private String name;

		/**
		 * Executable and arguments that start the plugin.
		 */
		private List<String> command = new ArrayList<>();

		private Map<String, String> environment = new LinkedHashMap<>();

		private boolean enabled = true;

		/**
		 * Overrides {@link PluginHostProperties#getCallTimeout()} for this plugin.
		 */
		private Duration callTimeout;

		/**
		 * Free-form settings passed to the plugin's {@code init} hook.
		 */
		private Map<String, Object> config = new LinkedHashMap<>();

		public String getName() {
			return name;
		}

		public void setName(String name) {
			this.name = name;
		}

		public List<String> getCommand() {
			return command;
		}

		public void setCommand(List<String> command) {
			this.command = command;
		}

		public Map<String, String> getEnvironment() {
			return environment;
		}

		public void setEnvironment(Map<String, String> environment) {
			this.environment = environment;
		}

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public Duration getCallTimeout() {
			return callTimeout;
		}

		public void setCallTimeout(Duration callTimeout) {
			this.callTimeout = callTimeout;
		}

		public Map<String, Object> getConfig() {
			return config;
		}

		public void setConfig(Map<String, Object> config) {
			this.config = config;
		}

		/**
		 * Resolve the call timeout for this plugin.
		 * @param fallback host-wide default
		 * @return the override when set, otherwise {@code fallback}
		 */
		public Duration effectiveCallTimeout(Duration fallback) {
			return callTimeout != null ? callTimeout : fallback;
		}

	}

}
