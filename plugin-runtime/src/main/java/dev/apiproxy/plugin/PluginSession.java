package dev.apiproxy.plugin;

import dev.apiproxy.protocol.ErrorKind;
import dev.apiproxy.protocol.PluginProtocolException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-process lifecycle state: identity, current configuration and settings, and where the
 * session stands in {@code UNINITIALIZED -> READY -> TERMINATED}. Exactly one call is in flight at
 * a time, so the session is not synchronized.
 *
 * @param <S> settings type of the owning plugin
 */
public final class PluginSession<S> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginSession.class);

    private final PluginInfo info;
    private SessionState state = SessionState.UNINITIALIZED;
    private PluginConfig config = PluginConfig.empty();
    private S settings;

    public PluginSession(PluginInfo info) {
        this.info = Objects.requireNonNull(info, "info");
    }

    public String name() {
        return info.name();
    }

    public String version() {
        return info.version();
    }

    public PluginInfo info() {
        return info;
    }

    public SessionState state() {
        return state;
    }

    public PluginConfig config() {
        return config;
    }

    /**
     * @return settings of the last successful {@code init}
     * @throws PluginProtocolException when the session is not ready
     */
    public S settings() {
        requireReady();
        return settings;
    }

    public void requireInitAllowed() {
        if (state == SessionState.TERMINATED) {
            throw new PluginProtocolException(ErrorKind.STATE_ERROR, "already shut down");
        }
    }

    /**
     * Enter {@code READY} with a new configuration. A repeated {@code init} replaces the
     * previous configuration and settings entirely.
     * @param newConfig configuration sent by the host
     * @param newSettings settings validated from it
     */
    public void initialize(PluginConfig newConfig, S newSettings) {
        requireInitAllowed();
        if (state == SessionState.READY) {
            LOGGER.info("Re-initializing plugin {}, replacing previous configuration", info.name());
        }
        this.config = Objects.requireNonNull(newConfig, "config");
        this.settings = newSettings;
        this.state = SessionState.READY;
    }

    public void requireReady() {
        switch (state) {
            case UNINITIALIZED -> throw new PluginProtocolException(ErrorKind.STATE_ERROR, "not initialized");
            case TERMINATED -> throw new PluginProtocolException(ErrorKind.STATE_ERROR, "already shut down");
            default -> {
            }
        }
    }

    public void terminate() {
        requireReady();
        state = SessionState.TERMINATED;
    }

    public boolean isReady() {
        return state == SessionState.READY;
    }
}
