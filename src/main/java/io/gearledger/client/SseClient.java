package io.gearledger.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.gearledger.config.SyncSettings;
import io.gearledger.model.SyncEvents;
import io.gearledger.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Subscribes to a sync server's {@code /api/events} stream on a dedicated thread and
 * reconnects after a fixed delay until stopped.
 *
 * <p>A watchdog aborts the stream when nothing, not even a keepalive comment, has
 * arrived within the read timeout.
 */
public final class SseClient {
    private static final Logger log = LoggerFactory.getLogger(SseClient.class);
    private static final long STOP_JOIN_MS = 2_000L;

    private final String eventsUrl;
    private final SyncEventListener listener;
    private final SyncSettings settings;
    private final HttpClient http;
    private volatile boolean running;
    private volatile boolean timedOut;
    private volatile long lastDataMs;
    private volatile InputStream currentBody;
    private volatile Thread thread;
    private ScheduledExecutorService watchdog;

    public SseClient(String serverUrl, SyncEventListener listener, SyncSettings settings) {
        String base = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
        this.eventsUrl = base + "/api/events";
        this.listener = listener;
        this.settings = settings;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(settings.requestTimeoutMs()))
                .build();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this::runLoop, "gearledger-sse");
        thread.setDaemon(true);
        thread.start();
        watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gearledger-sse-watchdog");
            t.setDaemon(true);
            return t;
        });
        long checkEvery = Math.max(50L, Math.min(1_000L, settings.sseReadTimeoutMs() / 4));
        watchdog.scheduleAtFixedRate(this::checkReadTimeout, checkEvery, checkEvery, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        watchdog.shutdownNow();
        closeBody();
        thread.interrupt();
        try {
            thread.join(STOP_JOIN_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        thread = null;
    }

    public boolean isRunning() {
        return running;
    }

    private void runLoop() {
        while (running) {
            streamOnce();
            if (!running) {
                break;
            }
            // Clears an interrupt raised by the watchdog.
            Thread.interrupted();
            try {
                Thread.sleep(settings.sseReconnectDelayMs());
            } catch (InterruptedException e) {
                if (!running) {
                    break;
                }
            }
        }
    }

    private void streamOnce() {
        boolean disconnected = false;
        boolean established = false;
        timedOut = false;
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(eventsUrl))
                    .timeout(Duration.ofMillis(settings.requestTimeoutMs()))
                    .header("Accept", "text/event-stream")
                    .GET()
                    .build();
            HttpResponse<InputStream> response = http.send(request, HttpResponse.BodyHandlers.ofInputStream());
            InputStream body = response.body();
            currentBody = body;
            lastDataMs = System.currentTimeMillis();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
                if (response.statusCode() != 200) {
                    fireError("event stream returned HTTP " + response.statusCode());
                    return;
                }
                disconnected = true;
                established = true;
                log.info("Event stream connected to {}", eventsUrl);
                readEvents(reader);
            }
        } catch (IOException e) {
            disconnected = true;
            if (running) {
                log.warn("Event stream to {} lost: {}", eventsUrl,
                        timedOut ? "no data within " + settings.sseReadTimeoutMs() + " ms" : String.valueOf(e.getMessage()));
            }
        } catch (InterruptedException e) {
            disconnected = true;
        } catch (RuntimeException e) {
            disconnected = true;
            if (running) {
                fireError("unexpected event stream error: " + e);
            }
        } finally {
            closeBody();
            currentBody = null;
            // A stream closed by stop() still reports the disconnect; failed connects after stop() do not.
            if (disconnected && (running || established)) {
                log.info("Event stream to {} disconnected", eventsUrl);
                try {
                    listener.onDisconnected();
                } catch (RuntimeException e) {
                    log.warn("Disconnect callback failed", e);
                }
            }
        }
    }

    private void readEvents(BufferedReader reader) throws IOException {
        StringBuilder data = new StringBuilder();
        String line;
        while (running && (line = reader.readLine()) != null) {
            lastDataMs = System.currentTimeMillis();
            if (line.isEmpty()) {
                if (data.length() > 0) {
                    dispatch(data.toString());
                    data.setLength(0);
                }
                continue;
            }
            if (line.startsWith(":")) {
                continue;
            }
            if (line.startsWith("data:")) {
                String value = line.substring("data:".length());
                if (value.startsWith(" ")) {
                    value = value.substring(1);
                }
                if (data.length() > 0) {
                    data.append('\n');
                }
                data.append(value);
            }
        }
    }

    void dispatch(String data) {
        JsonNode event;
        try {
            event = Jsons.mapper().readTree(data);
        } catch (IOException e) {
            log.warn("Ignoring malformed event: {}", data);
            return;
        }
        if (event == null || !event.isObject()) {
            log.warn("Ignoring non-object event: {}", data);
            return;
        }
        try {
            listener.onEvent(event);
            String type = event.path("type").asText("");
            switch (type) {
                case SyncEvents.CONNECTED -> {
                    listener.onConnected(event.path("version").asLong());
                    JsonNode catalog = event.path("catalog");
                    if (catalog.isObject()) {
                        listener.onCatalogUploaded(
                                catalog.path("filename").asText(),
                                catalog.path("size").asLong(),
                                catalog.path("version").asLong()
                        );
                    }
                }
                case SyncEvents.RESULTS_CHANGED -> listener.onResultsChanged(event.path("version").asLong());
                case SyncEvents.CATALOG_UPLOADED -> listener.onCatalogUploaded(
                        event.path("filename").asText(),
                        event.path("size").asLong(),
                        event.path("version").asLong()
                );
                default -> log.debug("Unhandled event type {}", type);
            }
        } catch (RuntimeException e) {
            log.warn("Event callback failed for {}", data, e);
        }
    }

    private void checkReadTimeout() {
        InputStream body = currentBody;
        if (body == null || System.currentTimeMillis() - lastDataMs <= settings.sseReadTimeoutMs()) {
            return;
        }
        log.warn("No event-stream data from {} within {} ms, reconnecting", eventsUrl, settings.sseReadTimeoutMs());
        timedOut = true;
        closeBody();
        // A blocked read of the response body only wakes up on interrupt.
        Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
    }

    private void closeBody() {
        InputStream body = currentBody;
        if (body == null) {
            return;
        }
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Closing event stream failed: {}", e.getMessage());
        }
    }

    private void fireError(String error) {
        log.warn("Event stream error: {}", error);
        try {
            listener.onError(error);
        } catch (RuntimeException e) {
            log.warn("Error callback failed", e);
        }
    }
}
