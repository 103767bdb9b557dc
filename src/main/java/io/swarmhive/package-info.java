/**
 * SwarmHive: an event-sourced work tracker shared by cooperating agent processes.
 *
 * <p>Cell events are appended to a per-project SQLite log and folded into read tables in the same
 * transaction. Dependencies drive a blocked-cell cache, dirty cells are merged into a portable JSONL
 * file, agents lease files through advisory reservations, and calls to the coordination relay go
 * through a retrying client that can restart the relay.
 */
package io.swarmhive;
