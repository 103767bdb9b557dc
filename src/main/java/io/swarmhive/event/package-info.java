/**
 * Append-only cell event log. Events are validated before anything is written and projected in the
 * same transaction that stores them.
 */
package io.swarmhive.event;
