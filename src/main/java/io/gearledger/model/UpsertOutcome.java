package io.gearledger.model;

public record UpsertOutcome(boolean ok, UpsertAction action, long id) {
    public static UpsertOutcome inserted(long id) {
        return new UpsertOutcome(true, UpsertAction.INSERTED, id);
    }

    public static UpsertOutcome updated(long id) {
        return new UpsertOutcome(true, UpsertAction.UPDATED, id);
    }
}
