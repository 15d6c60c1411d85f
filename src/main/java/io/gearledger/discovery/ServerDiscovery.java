package io.gearledger.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import io.gearledger.config.SyncSettings;
import io.gearledger.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Listens for {@link DiscoveryPacket} broadcasts and keeps the set of servers heard
 * from recently. Entries expire when no packet refreshed them within the staleness
 * window; {@link #servers()} only ever returns live entries.
 */
public final class ServerDiscovery {
    private static final Logger log = LoggerFactory.getLogger(ServerDiscovery.class);
    private static final int MAX_PACKET_BYTES = 2048;
    private static final long STOP_JOIN_MS = 1_000L;

    private final ServerFoundListener listener;
    private final SyncSettings settings;
    private final LongSupplier clock;
    private final Map<String, DiscoveredServer> servers = new LinkedHashMap<>();
    private volatile boolean running;
    private volatile DatagramSocket socket;
    private Thread thread;

    public ServerDiscovery(ServerFoundListener listener, SyncSettings settings) {
        this(listener, settings, System::currentTimeMillis);
    }

    public ServerDiscovery(ServerFoundListener listener, SyncSettings settings, LongSupplier clock) {
        this.listener = listener;
        this.settings = settings;
        this.clock = clock;
    }

    /** Binds the discovery port and starts the listener thread. */
    public synchronized void start() {
        if (running) {
            return;
        }
        try {
            DatagramSocket s = new DatagramSocket(null);
            s.setReuseAddress(true);
            s.setBroadcast(true);
            s.bind(new InetSocketAddress(settings.discoveryPort()));
            s.setSoTimeout(Math.max(100, settings.discoveryReceiveTimeoutMs()));
            socket = s;
        } catch (IOException e) {
            throw new RuntimeException("Failed to bind discovery port " + settings.discoveryPort(), e);
        }
        running = true;
        thread = new Thread(this::listenLoop, "gearledger-discovery-listen");
        thread.setDaemon(true);
        thread.start();
        log.info("Listening for servers on UDP port {}", settings.discoveryPort());
    }

    public synchronized void stop() {
        running = false;
        DatagramSocket s = socket;
        if (s != null) {
            s.close();
        }
        if (thread != null) {
            try {
                thread.join(STOP_JOIN_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            thread = null;
        }
    }

    public boolean isRunning() {
        return running;
    }

    /** Live servers ordered by {@code ip:port}; stale entries are pruned first. */
    public List<DiscoveredServer> servers() {
        long now = clock.getAsLong();
        synchronized (servers) {
            servers.values().removeIf(s -> s.isStale(now, settings.discoveryStaleMs()));
            List<DiscoveredServer> out = new ArrayList<>(servers.values());
            out.sort(Comparator.comparing(DiscoveredServer::key));
            return out;
        }
    }

    private void listenLoop() {
        DatagramSocket s = socket;
        try {
            while (running) {
                byte[] buf = new byte[MAX_PACKET_BYTES];
                DatagramPacket incoming = new DatagramPacket(buf, buf.length);
                try {
                    s.receive(incoming);
                } catch (SocketTimeoutException timeout) {
                    continue;
                }
                String body = new String(incoming.getData(), incoming.getOffset(), incoming.getLength(), StandardCharsets.UTF_8);
                accept(body, incoming.getAddress().getHostAddress());
            }
        } catch (IOException e) {
            if (running) {
                log.warn("Discovery listener stopped: {}", e.getMessage());
            }
        } finally {
            running = false;
            s.close();
            socket = null;
        }
    }

    /**
     * Applies one datagram. Returns the number of entries created or refreshed;
     * malformed and foreign packets yield 0.
     */
    int accept(String body, String sourceIp) {
        JsonNode packet;
        try {
            packet = Jsons.mapper().readTree(body);
        } catch (IOException e) {
            log.debug("Ignoring malformed discovery packet from {}", sourceIp);
            return 0;
        }
        if (packet == null || !packet.isObject() || !DiscoveryPacket.TYPE.equals(packet.path("type").asText())) {
            log.debug("Ignoring foreign discovery packet from {}", sourceIp);
            return 0;
        }
        List<String> ips = new ArrayList<>();
        for (JsonNode ip : packet.path("ips")) {
            if (ip.isTextual() && !ip.asText().isBlank()) {
                ips.add(ip.asText().trim());
            }
        }
        if (ips.isEmpty()) {
            String single = packet.path("ip").asText("");
            ips.add(single.isBlank() ? sourceIp : single.trim());
        }
        int port = packet.path("port").asInt(SyncSettings.DEFAULT_HTTP_PORT);
        String name = packet.path("name").asText(SyncSettings.DEFAULT_SERVER_NAME);

        long now = clock.getAsLong();
        List<DiscoveredServer> found = new ArrayList<>();
        synchronized (servers) {
            for (String ip : ips) {
                DiscoveredServer fresh = new DiscoveredServer(ip, port, name, now);
                DiscoveredServer previous = servers.put(fresh.key(), fresh);
                if (previous == null || previous.isStale(now, settings.discoveryStaleMs())) {
                    found.add(fresh);
                }
            }
        }
        for (DiscoveredServer server : found) {
            log.info("Discovered server {} at {}", server.name(), server.url());
            if (listener != null) {
                try {
                    listener.onServerFound(server);
                } catch (RuntimeException e) {
                    log.warn("Server-found callback failed for {}", server.key(), e);
                }
            }
        }
        return ips.size();
    }
}
