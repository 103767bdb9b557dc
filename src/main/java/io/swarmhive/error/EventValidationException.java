package io.swarmhive.error;

import java.util.List;

public final class EventValidationException extends HiveException {
    private final List<String> problems;

    public EventValidationException(String eventType, List<String> problems) {
        super("Invalid " + eventType + " event: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
