package io.gearledger.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Callbacks of an {@link SseClient}. All methods run on the client's stream thread.
 */
public interface SyncEventListener {
    /** Every event received, including the initial {@code connected} one. */
    default void onEvent(JsonNode event) {
    }

    default void onConnected(long version) {
    }

    default void onResultsChanged(long version) {
    }

    default void onCatalogUploaded(String filename, long size, long version) {
    }

    default void onDisconnected() {
    }

    default void onError(String error) {
    }
}
