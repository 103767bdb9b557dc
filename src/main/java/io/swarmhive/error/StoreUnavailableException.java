package io.swarmhive.error;

public final class StoreUnavailableException extends HiveException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
