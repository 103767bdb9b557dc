package io.swarmhive.client;

import io.swarmhive.config.HiveSettings;

public record RelayPolicy(
        int maxRetries,
        long baseDelayMs,
        long maxDelayMs,
        int failureThreshold,
        long restartCooldownMs,
        boolean autoRestart
) {
    public static RelayPolicy fromSettings(HiveSettings settings) {
        return new RelayPolicy(
                settings.relayMaxRetries(),
                settings.relayBaseDelayMs(),
                settings.relayMaxDelayMs(),
                settings.relayFailureThreshold(),
                settings.relayRestartCooldownMs(),
                settings.relayAutoRestart()
        );
    }
}
