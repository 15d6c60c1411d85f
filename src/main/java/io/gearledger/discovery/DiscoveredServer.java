package io.gearledger.discovery;

public record DiscoveredServer(String ip, int port, String name, long lastSeenMs) {
    public String key() {
        return ip + ":" + port;
    }

    public String url() {
        return "http://" + ip + ":" + port;
    }

    public boolean isStale(long nowMs, long staleAfterMs) {
        return nowMs - lastSeenMs > staleAfterMs;
    }
}
