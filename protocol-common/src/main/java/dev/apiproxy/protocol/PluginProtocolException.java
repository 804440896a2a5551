package dev.apiproxy.protocol;

/**
 * Raised inside the plugin runtime for any failure that must be reported to the host as an
 * error reply. The dispatch boundary converts it with {@link #toRpcError()}.
 */
public class PluginProtocolException extends RuntimeException {

    private final ErrorKind kind;

    public PluginProtocolException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PluginProtocolException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public RpcError toRpcError() {
        return RpcError.of(kind, getMessage());
    }
}
