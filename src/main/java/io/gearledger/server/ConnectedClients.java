package io.gearledger.server;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Liveness heuristic keyed by peer address: an address counts as connected while
 * it has made a request within the stale window. Several clients behind one
 * address count once.
 */
final class ConnectedClients {
    private final long staleAfterMs;
    private final LongSupplier clock;
    private final Map<String, Long> lastSeenMs = new LinkedHashMap<>();
    private int reportedCount;

    ConnectedClients(long staleAfterMs, LongSupplier clock) {
        this.staleAfterMs = staleAfterMs;
        this.clock = clock;
    }

    /**
     * Records activity. Returns the new count when the address was not tracked
     * yet, or -1 for a refresh of a known address.
     */
    synchronized int touch(String address) {
        if (lastSeenMs.put(address, clock.getAsLong()) != null) {
            return -1;
        }
        reportedCount = lastSeenMs.size();
        return reportedCount;
    }

    synchronized int count() {
        return lastSeenMs.size();
    }

    synchronized Map<String, Long> snapshot() {
        return Map.copyOf(lastSeenMs);
    }

    /**
     * Drops stale addresses. Returns the new count when it differs from the
     * last reported count, or -1 when it is unchanged.
     */
    synchronized int sweep() {
        long cutoff = clock.getAsLong() - staleAfterMs;
        lastSeenMs.values().removeIf(seen -> seen < cutoff);
        int count = lastSeenMs.size();
        if (count == reportedCount) {
            return -1;
        }
        reportedCount = count;
        return count;
    }
}
