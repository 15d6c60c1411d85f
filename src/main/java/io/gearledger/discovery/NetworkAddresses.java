package io.gearledger.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.DatagramSocket;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.InterfaceAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

public final class NetworkAddresses {
    private static final Logger log = LoggerFactory.getLogger(NetworkAddresses.class);
    public static final String LOOPBACK = "127.0.0.1";
    public static final String GLOBAL_BROADCAST = "255.255.255.255";

    private NetworkAddresses() {
    }

    /** IPv4 address of every up, non-loopback interface with the subnet broadcast it can reach. */
    public static List<LocalInterface> localInterfaces() {
        List<LocalInterface> out = new ArrayList<>();
        try {
            for (NetworkInterface nic : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (!nic.isUp() || nic.isLoopback()) {
                    continue;
                }
                for (InterfaceAddress address : nic.getInterfaceAddresses()) {
                    if (!(address.getAddress() instanceof Inet4Address v4) || v4.isLinkLocalAddress()) {
                        continue;
                    }
                    InetAddress broadcast = address.getBroadcast();
                    out.add(new LocalInterface(
                            nic.getName(),
                            v4.getHostAddress(),
                            broadcast == null ? GLOBAL_BROADCAST : broadcast.getHostAddress()
                    ));
                }
            }
        } catch (SocketException e) {
            log.warn("Failed to enumerate network interfaces: {}", e.getMessage());
        }
        return out;
    }

    /** Sorted local IPv4 addresses, or just the loopback address when none is configured. */
    public static List<String> localIps() {
        TreeSet<String> ips = new TreeSet<>();
        for (LocalInterface nic : localInterfaces()) {
            ips.add(nic.ip());
        }
        if (ips.isEmpty()) {
            return List.of(LOOPBACK);
        }
        return List.copyOf(ips);
    }

    /**
     * Address other LAN hosts should use to reach this one: the source address the
     * kernel picks for an outbound route, falling back to the first interface address.
     */
    public static String primaryLocalIp() {
        try (DatagramSocket probe = new DatagramSocket()) {
            // connect() on UDP only selects a route; nothing is sent.
            probe.connect(new InetSocketAddress("8.8.8.8", 80));
            InetAddress local = probe.getLocalAddress();
            if (local != null && !local.isAnyLocalAddress() && !local.isLoopbackAddress()) {
                return local.getHostAddress();
            }
        } catch (Exception e) {
            log.debug("Route probe for primary address failed: {}", e.getMessage());
        }
        return localIps().get(0);
    }

    public record LocalInterface(String name, String ip, String broadcast) {
    }
}
