package io.gearledger.config;

import io.gearledger.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public record SyncSettings(
        int httpPort,
        String serverName,
        int discoveryPort,
        long broadcastIntervalMs,
        long discoveryStaleMs,
        int discoveryReceiveTimeoutMs,
        List<String> broadcastTargets,
        long clientStaleMs,
        long clientSweepIntervalMs,
        long sseKeepaliveMs,
        int sseQueueCapacity,
        long catalogMaxBytes,
        int busyTimeoutMs,
        long requestTimeoutMs,
        long sseReadTimeoutMs,
        long sseReconnectDelayMs
) {
    public static final int DEFAULT_HTTP_PORT = 8080;
    public static final String DEFAULT_SERVER_NAME = "Gear Ledger Server";
    public static final int DEFAULT_DISCOVERY_PORT = 8888;
    public static final long DEFAULT_BROADCAST_INTERVAL_MS = 3_000L;
    public static final long DEFAULT_DISCOVERY_STALE_MS = 5_000L;
    public static final int DEFAULT_DISCOVERY_RECEIVE_TIMEOUT_MS = 1_000;
    public static final long DEFAULT_CLIENT_STALE_MS = 10_000L;
    public static final long DEFAULT_CLIENT_SWEEP_INTERVAL_MS = 2_000L;
    public static final long DEFAULT_SSE_KEEPALIVE_MS = 30_000L;
    public static final int DEFAULT_SSE_QUEUE_CAPACITY = 256;
    public static final long DEFAULT_CATALOG_MAX_BYTES = 50L * 1024L * 1024L;
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 30_000;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_SSE_READ_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_SSE_RECONNECT_DELAY_MS = 5_000L;

    public SyncSettings {
        broadcastTargets = broadcastTargets == null ? List.of() : List.copyOf(broadcastTargets);
        if (sseReadTimeoutMs <= sseKeepaliveMs) {
            throw new IllegalArgumentException(
                    "sseReadTimeoutMs must exceed sseKeepaliveMs, got read=" + sseReadTimeoutMs
                            + ", keepalive=" + sseKeepaliveMs
            );
        }
    }

    public static SyncSettings defaults() {
        return new SyncSettings(
                DEFAULT_HTTP_PORT,
                DEFAULT_SERVER_NAME,
                DEFAULT_DISCOVERY_PORT,
                DEFAULT_BROADCAST_INTERVAL_MS,
                DEFAULT_DISCOVERY_STALE_MS,
                DEFAULT_DISCOVERY_RECEIVE_TIMEOUT_MS,
                List.of(),
                DEFAULT_CLIENT_STALE_MS,
                DEFAULT_CLIENT_SWEEP_INTERVAL_MS,
                DEFAULT_SSE_KEEPALIVE_MS,
                DEFAULT_SSE_QUEUE_CAPACITY,
                DEFAULT_CATALOG_MAX_BYTES,
                DEFAULT_BUSY_TIMEOUT_MS,
                DEFAULT_REQUEST_TIMEOUT_MS,
                DEFAULT_SSE_READ_TIMEOUT_MS,
                DEFAULT_SSE_RECONNECT_DELAY_MS
        );
    }

    /**
     * Loads settings from the config's settings file. Missing file means defaults;
     * every field in the file is optional.
     */
    public static SyncSettings load(SyncConfig config) {
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(parsed, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
    }

    static SyncSettings fromFile(SettingsFile f, SyncSettings d) {
        return new SyncSettings(
                positiveOr(f.httpPort(), d.httpPort()),
                f.serverName() == null || f.serverName().isBlank() ? d.serverName() : f.serverName().trim(),
                positiveOr(f.discoveryPort(), d.discoveryPort()),
                positiveOr(f.broadcastIntervalMs(), d.broadcastIntervalMs()),
                positiveOr(f.discoveryStaleMs(), d.discoveryStaleMs()),
                positiveOr(f.discoveryReceiveTimeoutMs(), d.discoveryReceiveTimeoutMs()),
                f.broadcastTargets() == null ? d.broadcastTargets() : f.broadcastTargets(),
                positiveOr(f.clientStaleMs(), d.clientStaleMs()),
                positiveOr(f.clientSweepIntervalMs(), d.clientSweepIntervalMs()),
                positiveOr(f.sseKeepaliveMs(), d.sseKeepaliveMs()),
                positiveOr(f.sseQueueCapacity(), d.sseQueueCapacity()),
                positiveOr(f.catalogMaxBytes(), d.catalogMaxBytes()),
                positiveOr(f.busyTimeoutMs(), d.busyTimeoutMs()),
                positiveOr(f.requestTimeoutMs(), d.requestTimeoutMs()),
                positiveOr(f.sseReadTimeoutMs(), d.sseReadTimeoutMs()),
                positiveOr(f.sseReconnectDelayMs(), d.sseReconnectDelayMs())
        );
    }

    public SyncSettings withHttpPort(int port) {
        return new SyncSettings(port, serverName, discoveryPort, broadcastIntervalMs, discoveryStaleMs,
                discoveryReceiveTimeoutMs, broadcastTargets, clientStaleMs, clientSweepIntervalMs, sseKeepaliveMs,
                sseQueueCapacity, catalogMaxBytes, busyTimeoutMs, requestTimeoutMs, sseReadTimeoutMs,
                sseReconnectDelayMs);
    }

    public SyncSettings withServerName(String name) {
        return new SyncSettings(httpPort, name, discoveryPort, broadcastIntervalMs, discoveryStaleMs,
                discoveryReceiveTimeoutMs, broadcastTargets, clientStaleMs, clientSweepIntervalMs, sseKeepaliveMs,
                sseQueueCapacity, catalogMaxBytes, busyTimeoutMs, requestTimeoutMs, sseReadTimeoutMs,
                sseReconnectDelayMs);
    }

    public SyncSettings withDiscovery(int port, long intervalMs, long staleMs, int receiveTimeoutMs, List<String> targets) {
        return new SyncSettings(httpPort, serverName, port, intervalMs, staleMs,
                receiveTimeoutMs, targets, clientStaleMs, clientSweepIntervalMs, sseKeepaliveMs,
                sseQueueCapacity, catalogMaxBytes, busyTimeoutMs, requestTimeoutMs, sseReadTimeoutMs,
                sseReconnectDelayMs);
    }

    public SyncSettings withClientLiveness(long staleMs, long sweepIntervalMs) {
        return new SyncSettings(httpPort, serverName, discoveryPort, broadcastIntervalMs, discoveryStaleMs,
                discoveryReceiveTimeoutMs, broadcastTargets, staleMs, sweepIntervalMs, sseKeepaliveMs,
                sseQueueCapacity, catalogMaxBytes, busyTimeoutMs, requestTimeoutMs, sseReadTimeoutMs,
                sseReconnectDelayMs);
    }

    public SyncSettings withSse(long keepaliveMs, long readTimeoutMs, long reconnectDelayMs) {
        return new SyncSettings(httpPort, serverName, discoveryPort, broadcastIntervalMs, discoveryStaleMs,
                discoveryReceiveTimeoutMs, broadcastTargets, clientStaleMs, clientSweepIntervalMs, keepaliveMs,
                sseQueueCapacity, catalogMaxBytes, busyTimeoutMs, requestTimeoutMs, readTimeoutMs,
                reconnectDelayMs);
    }

    public SyncSettings withCatalogMaxBytes(long maxBytes) {
        return new SyncSettings(httpPort, serverName, discoveryPort, broadcastIntervalMs, discoveryStaleMs,
                discoveryReceiveTimeoutMs, broadcastTargets, clientStaleMs, clientSweepIntervalMs, sseKeepaliveMs,
                sseQueueCapacity, maxBytes, busyTimeoutMs, requestTimeoutMs, sseReadTimeoutMs,
                sseReconnectDelayMs);
    }

    private static int positiveOr(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }

    private static long positiveOr(Long value, long fallback) {
        return value == null || value <= 0L ? fallback : value;
    }

    record SettingsFile(
            Integer httpPort,
            String serverName,
            Integer discoveryPort,
            Long broadcastIntervalMs,
            Long discoveryStaleMs,
            Integer discoveryReceiveTimeoutMs,
            List<String> broadcastTargets,
            Long clientStaleMs,
            Long clientSweepIntervalMs,
            Long sseKeepaliveMs,
            Integer sseQueueCapacity,
            Long catalogMaxBytes,
            Integer busyTimeoutMs,
            Long requestTimeoutMs,
            Long sseReadTimeoutMs,
            Long sseReconnectDelayMs
    ) {
    }
}
