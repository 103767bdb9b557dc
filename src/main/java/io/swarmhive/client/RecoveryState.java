package io.swarmhive.client;

/**
 * HEALTHY -> DEGRADED after the failure threshold, DEGRADED -> RESTARTING while a restart runs,
 * back to HEALTHY on a successful restart or call.
 */
public enum RecoveryState {
    HEALTHY,
    DEGRADED,
    RESTARTING
}
