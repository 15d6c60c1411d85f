package io.gearledger.discovery;

import java.util.List;

public record DiscoveryPacket(String type, String ip, List<String> ips, int port, String name) {
    public static final String TYPE = "gearledger_server";

    public static DiscoveryPacket announce(List<String> ips, int port, String name) {
        String primary = ips.isEmpty() ? "127.0.0.1" : ips.get(0);
        return new DiscoveryPacket(TYPE, primary, List.copyOf(ips), port, name);
    }
}
