package io.swarmhive.event;

import io.swarmhive.error.EventValidationException;

import java.util.ArrayList;
import java.util.List;

public final class EventValidator {
    private EventValidator() {
    }

    public static List<String> problems(CellEvent event) {
        List<String> out = new ArrayList<>();
        if (event == null) {
            out.add("event is required");
            return out;
        }
        if (event.projectKey() == null || event.projectKey().isBlank()) {
            out.add("project_key is required");
        }
        if (event.cellId() == null || event.cellId().isBlank()) {
            out.add("cell_id is required");
        }
        if (event.timestampMs() <= 0L) {
            out.add("timestamp must be positive");
        }
        if (event.payload() == null) {
            out.add("payload is required");
        } else {
            out.addAll(event.payload().problems());
        }
        return out;
    }

    public static void validate(CellEvent event) {
        List<String> problems = problems(event);
        if (!problems.isEmpty()) {
            String type = event == null || event.typeName() == null ? "unknown" : event.typeName();
            throw new EventValidationException(type, problems);
        }
    }
}
