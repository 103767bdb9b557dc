package io.swarmhive.client;

import java.util.Locale;

public final class ErrorClassifier {
    private ErrorClassifier() {
    }

    /**
     * Connection problems, timeouts, gateway errors and the relay's generic "unexpected error" are
     * transient; validation errors and every other HTTP or RPC failure are not.
     */
    public static boolean isRetryable(RelayException e) {
        switch (e.kind()) {
            case IO, TIMEOUT:
                return true;
            case INTERRUPTED:
                return false;
            default:
                break;
        }
        int code = e.statusCode();
        if (code == 502 || code == 503 || code == 504) {
            return true;
        }
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("unexpected error");
    }
}
