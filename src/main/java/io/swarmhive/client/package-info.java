/**
 * Relay client with retry, backoff and collaborator restart.
 */
package io.swarmhive.client;
