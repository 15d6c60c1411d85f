package io.gearledger.server;

import java.time.Instant;
import java.util.Optional;

/**
 * Version counter and catalog blob. Every read-modify-write of either goes through
 * this object's monitor, so a catalog and the version it was published under are
 * always observed together.
 */
final class SyncState {
    private long version;
    private CatalogBlob catalog;

    synchronized long version() {
        return version;
    }

    synchronized long bumpVersion() {
        version++;
        return version;
    }

    synchronized CatalogBlob replaceCatalog(String filename, byte[] bytes) {
        version++;
        catalog = new CatalogBlob(filename, bytes.clone(), Instant.now(), version);
        return catalog;
    }

    synchronized Optional<CatalogBlob> catalog() {
        return Optional.ofNullable(catalog);
    }

    synchronized Snapshot snapshot() {
        return new Snapshot(version, catalog);
    }

    record Snapshot(long version, CatalogBlob catalog) {
    }
}
