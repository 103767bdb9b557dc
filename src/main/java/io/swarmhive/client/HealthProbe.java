package io.swarmhive.client;

@FunctionalInterface
public interface HealthProbe {
    boolean isHealthy();
}
