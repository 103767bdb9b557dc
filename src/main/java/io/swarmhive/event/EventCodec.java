package io.swarmhive.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import io.swarmhive.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Converts payloads to and from the snake_case JSON kept in the {@code events.data} column.
 */
public final class EventCodec {
    private static final Logger log = LoggerFactory.getLogger(EventCodec.class);
    private static final ObjectMapper MAPPER = Jsons.compact().copy()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private EventCodec() {
    }

    public static String encode(CellEventPayload payload) {
        if (payload instanceof CellEventPayload.Unrecognized unknown) {
            return unknown.data() == null ? "{}" : unknown.data().toString();
        }
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + payload.typeName() + " payload", e);
        }
    }

    /**
     * Decodes a stored payload. Unknown types, and known types whose body no longer parses, come
     * back as {@link CellEventPayload.Unrecognized} so readers never fail on newer data.
     */
    public static CellEventPayload decode(String typeName, String data) {
        JsonNode tree;
        try {
            tree = MAPPER.readTree(data == null || data.isBlank() ? "{}" : data);
        } catch (JsonProcessingException e) {
            log.warn("Stored {} event has malformed data: {}", typeName, e.getOriginalMessage());
            return new CellEventPayload.Unrecognized(typeName, null);
        }
        Optional<CellEventType> type = CellEventType.fromWire(typeName);
        if (type.isEmpty()) {
            return new CellEventPayload.Unrecognized(typeName, tree);
        }
        try {
            return MAPPER.treeToValue(tree, type.get().payloadClass());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Stored {} event could not be decoded: {}", typeName, e.getMessage());
            return new CellEventPayload.Unrecognized(typeName, tree);
        }
    }
}
