package io.gearledger.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Metadata of the uploaded catalog blob as reported by {@code /api/catalog/info}.
 * Fields other than {@code exists} are null when no catalog has been uploaded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CatalogInfo(
        boolean ok,
        boolean exists,
        String filename,
        Long size,
        String uploadedAt,
        Long version
) {
    public static CatalogInfo absent() {
        return new CatalogInfo(true, false, null, null, null, null);
    }
}
