/**
 * Sync server package.
 *
 * <p>{@link io.gearledger.server.SyncServer} owns the HTTP control plane, the sync
 * version, the in-memory catalog blob and the fan-out of events to open
 * {@code /api/events} streams.
 */
package io.gearledger.server;
