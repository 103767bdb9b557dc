package io.swarmhive.reservation;

public record ReservationAuditRow(
        long id,
        String eventType,
        String agentName,
        String path,
        String pathPattern,
        Long reservationId,
        String holderAgent,
        long occurredAtMs
) {
}
