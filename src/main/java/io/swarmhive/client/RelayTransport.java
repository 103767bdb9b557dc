package io.swarmhive.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One attempt at one relay operation, with no retry logic.
 */
public interface RelayTransport {
    JsonNode call(String operation, ObjectNode args);
}
