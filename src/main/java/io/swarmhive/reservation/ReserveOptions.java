package io.swarmhive.reservation;

import java.time.Duration;

/**
 * @param ttl       lease length; null means the configured default
 * @param exclusive exclusive leases conflict with every overlapping lease, shared ones only with exclusive leases
 * @param cellId    optional cell the lease belongs to; closing that cell releases it
 */
public record ReserveOptions(Duration ttl, boolean exclusive, String reason, String cellId) {
    public static ReserveOptions defaults() {
        return new ReserveOptions(null, true, null, null);
    }

    public static ReserveOptions exclusive(Duration ttl, String reason) {
        return new ReserveOptions(ttl, true, reason, null);
    }

    public static ReserveOptions shared(Duration ttl, String reason) {
        return new ReserveOptions(ttl, false, reason, null);
    }

    public ReserveOptions forCell(String value) {
        return new ReserveOptions(ttl, exclusive, reason, value);
    }
}
