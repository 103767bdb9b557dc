package io.swarmhive.reservation;

import java.util.List;

public record ReservationResult(List<Reservation> granted, List<Conflict> conflicts) {
    public ReservationResult {
        granted = List.copyOf(granted);
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
