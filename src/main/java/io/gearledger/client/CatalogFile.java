package io.gearledger.client;

/** A downloaded catalog blob. */
public record CatalogFile(String filename, String contentType, byte[] bytes) {
    public long size() {
        return bytes.length;
    }
}
