package io.swarmhive.client;

import io.swarmhive.error.HiveException;

/**
 * A failed call to the relay. Whether it is worth retrying is decided by {@link ErrorClassifier}.
 */
public class RelayException extends HiveException {
    public enum Kind {
        IO,
        TIMEOUT,
        HTTP,
        RPC,
        TOOL,
        INTERRUPTED
    }

    private final String operation;
    private final Kind kind;
    private final int statusCode;

    public RelayException(String operation, Kind kind, int statusCode, String message) {
        this(operation, kind, statusCode, message, null);
    }

    public RelayException(String operation, Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public String operation() {
        return operation;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * HTTP status or JSON-RPC error code; 0 when the failure carried none.
     */
    public int statusCode() {
        return statusCode;
    }
}
