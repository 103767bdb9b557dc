package io.swarmhive.client;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ErrorClassifierTest {

    @Test
    void transportFailuresAreRetryable() {
        Assertions.assertTrue(ErrorClassifier.isRetryable(error(RelayException.Kind.IO, 0, "connection refused")));
        Assertions.assertTrue(ErrorClassifier.isRetryable(error(RelayException.Kind.TIMEOUT, 0, "timed out")));
        Assertions.assertFalse(ErrorClassifier.isRetryable(error(RelayException.Kind.INTERRUPTED, 0, "interrupted")));
    }

    @Test
    void onlyGatewayStatusesAreRetryable() {
        Assertions.assertTrue(ErrorClassifier.isRetryable(error(RelayException.Kind.HTTP, 502, "bad gateway")));
        Assertions.assertTrue(ErrorClassifier.isRetryable(error(RelayException.Kind.HTTP, 503, "unavailable")));
        Assertions.assertTrue(ErrorClassifier.isRetryable(error(RelayException.Kind.HTTP, 504, "gateway timeout")));
        Assertions.assertFalse(ErrorClassifier.isRetryable(error(RelayException.Kind.HTTP, 500, "server error")));
        Assertions.assertFalse(ErrorClassifier.isRetryable(error(RelayException.Kind.HTTP, 404, "not found")));
    }

    @Test
    void genericRelayErrorIsRetryableButValidationIsNot() {
        Assertions.assertTrue(ErrorClassifier.isRetryable(
                error(RelayException.Kind.TOOL, 0, "Unexpected error while sending message")));
        Assertions.assertFalse(ErrorClassifier.isRetryable(
                error(RelayException.Kind.RPC, -32602, "Invalid params: agent_name is required")));
    }

    private static RelayException error(RelayException.Kind kind, int status, String message) {
        return new RelayException("send_message", kind, status, message);
    }
}
