package io.gearledger.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UpsertAction {
    INSERTED,
    UPDATED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
