package io.swarmhive.export;

import java.util.List;

public record ImportResult(int created, int updated, int skipped, List<String> errors) {
    public ImportResult {
        errors = List.copyOf(errors);
    }
}
