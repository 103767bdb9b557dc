package io.swarmhive.error;

/**
 * Root of every failure raised by the hive. Unchecked, like the store wrappers it replaces.
 */
public class HiveException extends RuntimeException {
    public HiveException(String message) {
        super(message);
    }

    public HiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
