package io.swarmhive.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swarmhive.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Tunables read from {@code hive-settings.json}. Missing or out-of-range values fall back to defaults.
 */
public record HiveSettings(
        int storeMaxAttempts,
        long storeBaseBackoffMs,
        long storeMaxBackoffMs,
        long busyTimeoutMs,
        long reservationTtlSeconds,
        int staleDays,
        String relayUrl,
        int relayMaxRetries,
        long relayBaseDelayMs,
        long relayMaxDelayMs,
        long relayTimeoutMs,
        int relayFailureThreshold,
        long relayRestartCooldownMs,
        boolean relayAutoRestart,
        List<String> relayRestartCommand
) {
    private static final Logger log = LoggerFactory.getLogger(HiveSettings.class);

    public static final int DEFAULT_STORE_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_STORE_BASE_BACKOFF_MS = 50L;
    public static final long DEFAULT_STORE_MAX_BACKOFF_MS = 2_000L;
    public static final long DEFAULT_BUSY_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_RESERVATION_TTL_SECONDS = 3_600L;
    public static final int DEFAULT_STALE_DAYS = 7;
    public static final String DEFAULT_RELAY_URL = "http://127.0.0.1:8765";
    public static final int DEFAULT_RELAY_MAX_RETRIES = 3;
    public static final long DEFAULT_RELAY_BASE_DELAY_MS = 100L;
    public static final long DEFAULT_RELAY_MAX_DELAY_MS = 5_000L;
    public static final long DEFAULT_RELAY_TIMEOUT_MS = 10_000L;
    public static final int DEFAULT_RELAY_FAILURE_THRESHOLD = 1;
    public static final long DEFAULT_RELAY_RESTART_COOLDOWN_MS = 10_000L;

    public HiveSettings {
        relayRestartCommand = relayRestartCommand == null ? List.of() : List.copyOf(relayRestartCommand);
    }

    public static HiveSettings defaults() {
        return new HiveSettings(
                DEFAULT_STORE_MAX_ATTEMPTS,
                DEFAULT_STORE_BASE_BACKOFF_MS,
                DEFAULT_STORE_MAX_BACKOFF_MS,
                DEFAULT_BUSY_TIMEOUT_MS,
                DEFAULT_RESERVATION_TTL_SECONDS,
                DEFAULT_STALE_DAYS,
                DEFAULT_RELAY_URL,
                DEFAULT_RELAY_MAX_RETRIES,
                DEFAULT_RELAY_BASE_DELAY_MS,
                DEFAULT_RELAY_MAX_DELAY_MS,
                DEFAULT_RELAY_TIMEOUT_MS,
                DEFAULT_RELAY_FAILURE_THRESHOLD,
                DEFAULT_RELAY_RESTART_COOLDOWN_MS,
                true,
                List.of()
        );
    }

    public static HiveSettings load(Path file) {
        HiveSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    static HiveSettings fromFile(SettingsFile file, HiveSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long baseBackoff = sanitizeLong(file.storeBaseBackoffMs(), defaults.storeBaseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.storeMaxBackoffMs(), defaults.storeMaxBackoffMs(), baseBackoff);
        long relayBase = sanitizeLong(file.relayBaseDelayMs(), defaults.relayBaseDelayMs(), 1L);
        long relayMax = sanitizeLong(file.relayMaxDelayMs(), defaults.relayMaxDelayMs(), relayBase);
        String url = file.relayUrl() == null || file.relayUrl().isBlank()
                ? defaults.relayUrl()
                : file.relayUrl().trim();
        HiveSettings resolved = new HiveSettings(
                sanitizeInt(file.storeMaxAttempts(), defaults.storeMaxAttempts(), 1),
                baseBackoff,
                maxBackoff,
                sanitizeLong(file.busyTimeoutMs(), defaults.busyTimeoutMs(), 0L),
                sanitizeLong(file.reservationTtlSeconds(), defaults.reservationTtlSeconds(), 1L),
                sanitizeInt(file.staleDays(), defaults.staleDays(), 1),
                url,
                sanitizeInt(file.relayMaxRetries(), defaults.relayMaxRetries(), 0),
                relayBase,
                relayMax,
                sanitizeLong(file.relayTimeoutMs(), defaults.relayTimeoutMs(), 1L),
                sanitizeInt(file.relayFailureThreshold(), defaults.relayFailureThreshold(), 1),
                sanitizeLong(file.relayRestartCooldownMs(), defaults.relayRestartCooldownMs(), 0L),
                file.relayAutoRestart() == null ? defaults.relayAutoRestart() : file.relayAutoRestart(),
                file.relayRestartCommand() == null ? defaults.relayRestartCommand() : file.relayRestartCommand()
        );
        log.debug("Loaded hive settings: {}", resolved);
        return resolved;
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            @JsonProperty("storeMaxAttempts") Integer storeMaxAttempts,
            @JsonProperty("storeBaseBackoffMs") Long storeBaseBackoffMs,
            @JsonProperty("storeMaxBackoffMs") Long storeMaxBackoffMs,
            @JsonProperty("busyTimeoutMs") Long busyTimeoutMs,
            @JsonProperty("reservationTtlSeconds") Long reservationTtlSeconds,
            @JsonProperty("staleDays") Integer staleDays,
            @JsonProperty("relayUrl") String relayUrl,
            @JsonProperty("relayMaxRetries") Integer relayMaxRetries,
            @JsonProperty("relayBaseDelayMs") Long relayBaseDelayMs,
            @JsonProperty("relayMaxDelayMs") Long relayMaxDelayMs,
            @JsonProperty("relayTimeoutMs") Long relayTimeoutMs,
            @JsonProperty("relayFailureThreshold") Integer relayFailureThreshold,
            @JsonProperty("relayRestartCooldownMs") Long relayRestartCooldownMs,
            @JsonProperty("relayAutoRestart") Boolean relayAutoRestart,
            @JsonProperty("relayRestartCommand") List<String> relayRestartCommand
    ) {
    }
}
