/**
 * Exception hierarchy. Everything extends {@link io.swarmhive.error.HiveException}; reservation
 * conflicts and partial flushes are reported as data instead.
 */
package io.swarmhive.error;
