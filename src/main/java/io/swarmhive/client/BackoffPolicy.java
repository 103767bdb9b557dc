package io.swarmhive.client;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * {@code min(base * 2^(attempt-1), max)} with up to ±20% jitter.
 */
public final class BackoffPolicy {
    static final double JITTER_RATIO = 0.2d;

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final DoubleSupplier random;

    public BackoffPolicy(long baseDelayMs, long maxDelayMs) {
        this(baseDelayMs, maxDelayMs, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0, 1); 0.5 means no jitter
     */
    public BackoffPolicy(long baseDelayMs, long maxDelayMs, DoubleSupplier random) {
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("invalid backoff bounds: base=" + baseDelayMs + ", max=" + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.random = random;
    }

    public long rawDelayMs(int attempt) {
        long delay = baseDelayMs;
        for (int i = 1; i < attempt; i++) {
            if (delay >= maxDelayMs / 2L) {
                return maxDelayMs;
            }
            delay *= 2L;
        }
        return Math.min(delay, maxDelayMs);
    }

    public long delayMs(int attempt) {
        long raw = rawDelayMs(Math.max(1, attempt));
        double factor = 1.0d + (random.getAsDouble() * 2.0d - 1.0d) * JITTER_RATIO;
        return Math.max(0L, Math.round(raw * factor));
    }
}
