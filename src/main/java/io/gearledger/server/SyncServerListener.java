package io.gearledger.server;

/**
 * Host-side observer of a {@link SyncServer}. Callbacks run on server worker
 * threads and must not block.
 */
public interface SyncServerListener {
    /** A result or the catalog changed, including point edits that do not bump the version. */
    default void onDataChanged() {
    }

    default void onClientCountChanged(int count) {
    }
}
