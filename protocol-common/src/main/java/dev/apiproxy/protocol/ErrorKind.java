package dev.apiproxy.protocol;

/**
 * Failure kinds a plugin can report. Every kind travels on the wire with the same
 * {@link RpcError#PLUGIN_ERROR_CODE}; the kind itself is carried in {@code error.data.kind}.
 */
public enum ErrorKind {

    /** The line is not a well-formed call message. */
    PARSE_ERROR,

    /** The {@code jsonrpc} field is present but is not {@code "2.0"}. */
    VERSION_ERROR,

    METHOD_NOT_FOUND,

    /** Too few params, or a param of the wrong shape. */
    INVALID_PARAMS,

    /** A hook was called out of lifecycle order. */
    STATE_ERROR,

    /** Anything else raised while a hook body was executing. */
    HANDLER_ERROR
}
