package io.gearledger.model;

import java.util.LinkedHashMap;
import java.util.Map;

/** Payloads pushed on the {@code /api/events} stream. */
public final class SyncEvents {
    public static final String CONNECTED = "connected";
    public static final String RESULTS_CHANGED = "results_changed";
    public static final String CATALOG_UPLOADED = "catalog_uploaded";

    private SyncEvents() {
    }

    public static Map<String, Object> connected(long version, CatalogRef catalog) {
        LinkedHashMap<String, Object> out = new LinkedHashMap<>();
        out.put("type", CONNECTED);
        out.put("version", version);
        if (catalog != null) {
            LinkedHashMap<String, Object> ref = new LinkedHashMap<>();
            ref.put("filename", catalog.filename());
            ref.put("size", catalog.size());
            ref.put("version", catalog.version());
            out.put("catalog", ref);
        }
        return out;
    }

    public static Map<String, Object> resultsChanged(long version) {
        LinkedHashMap<String, Object> out = new LinkedHashMap<>();
        out.put("type", RESULTS_CHANGED);
        out.put("version", version);
        return out;
    }

    public static Map<String, Object> catalogUploaded(String filename, long size, long version) {
        LinkedHashMap<String, Object> out = new LinkedHashMap<>();
        out.put("type", CATALOG_UPLOADED);
        out.put("filename", filename);
        out.put("size", size);
        out.put("version", version);
        return out;
    }

    public record CatalogRef(String filename, long size, long version) {
    }
}
