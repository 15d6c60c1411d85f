package io.gearledger.server;

import java.time.Instant;

/** The uploaded catalog file, held in memory only. Callers only ever see copies of the bytes. */
public record CatalogBlob(String filename, byte[] bytes, Instant uploadedAt, long version) {
    public CatalogBlob {
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public long size() {
        return bytes.length;
    }
}
