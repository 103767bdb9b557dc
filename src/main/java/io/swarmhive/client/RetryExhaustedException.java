package io.swarmhive.client;

import io.swarmhive.error.HiveException;

public final class RetryExhaustedException extends HiveException {
    private final String operation;
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, RelayException lastFailure) {
        super("Relay call " + operation + " failed after " + attempts + " attempts: " + lastFailure.getMessage(), lastFailure);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String operation() {
        return operation;
    }

    public int attempts() {
        return attempts;
    }
}
