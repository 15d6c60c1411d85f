package io.gearledger.discovery;

import io.gearledger.config.SyncSettings;
import io.gearledger.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Announces a sync server on the LAN by sending a {@link DiscoveryPacket} to the
 * discovery port at a fixed interval. A send failure ends the loop; the HTTP
 * server it advertises is not affected.
 */
public final class ServerBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(ServerBroadcaster.class);
    private static final long STOP_JOIN_MS = 2_000L;

    private final int httpPort;
    private final String serverName;
    private final SyncSettings settings;
    private final AtomicLong sent = new AtomicLong();
    private volatile boolean running;
    private volatile DatagramSocket socket;
    private Thread thread;

    public ServerBroadcaster(int httpPort, String serverName, SyncSettings settings) {
        this.httpPort = httpPort;
        this.serverName = serverName;
        this.settings = settings;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this::broadcastLoop, "gearledger-discovery-broadcast");
        thread.setDaemon(true);
        thread.start();
    }

    public synchronized void stop() {
        running = false;
        DatagramSocket s = socket;
        if (s != null) {
            s.close();
        }
        if (thread != null) {
            thread.interrupt();
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

    public long packetsSent() {
        return sent.get();
    }

    private void broadcastLoop() {
        try (DatagramSocket s = new DatagramSocket()) {
            s.setBroadcast(true);
            socket = s;
            boolean announced = false;
            while (running) {
                List<String> ips = NetworkAddresses.localIps();
                byte[] payload = Jsons.toJson(DiscoveryPacket.announce(ips, httpPort, serverName))
                        .getBytes(StandardCharsets.UTF_8);
                for (String target : targets()) {
                    s.send(new DatagramPacket(payload, payload.length, InetAddress.getByName(target), settings.discoveryPort()));
                    sent.incrementAndGet();
                    if (!announced) {
                        log.info("Broadcasting {} on {}:{} (ips={}, port={})",
                                serverName, target, settings.discoveryPort(), ips, httpPort);
                    }
                }
                announced = true;
                Thread.sleep(settings.broadcastIntervalMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (running) {
                log.error("Discovery broadcast failed, broadcaster stopped", e);
            }
        } finally {
            running = false;
            socket = null;
        }
    }

    private Set<String> targets() {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        if (!settings.broadcastTargets().isEmpty()) {
            out.addAll(settings.broadcastTargets());
            return out;
        }
        for (NetworkAddresses.LocalInterface nic : NetworkAddresses.localInterfaces()) {
            out.add(nic.broadcast());
        }
        if (out.isEmpty()) {
            out.add(NetworkAddresses.GLOBAL_BROADCAST);
        }
        return out;
    }
}
