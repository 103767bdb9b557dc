/**
 * Entry point for callers: {@link io.swarmhive.runtime.HiveRuntime} wires storage, projections,
 * blocking, export and reservations for one project, and {@link io.swarmhive.runtime.HiveSession}
 * scopes reservations to one agent.
 */
package io.swarmhive.runtime;
