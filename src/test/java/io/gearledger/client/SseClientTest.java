package io.gearledger.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpServer;
import io.gearledger.config.SyncConfig;
import io.gearledger.config.SyncSettings;
import io.gearledger.server.SyncServer;
import io.gearledger.storage.Database;
import io.gearledger.storage.ResultStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

final class SseClientTest {

    @Test
    void catalogUploadReachesSubscriberAndLateSubscriberGetsItFromConnected() throws Exception {
        Path root = Files.createTempDirectory("gearledger-test-sse-");
        SyncSettings settings = SyncSettings.defaults().withHttpPort(0).withSse(200L, 2_000L, 100L);
        Database db = new Database(SyncConfig.fromRoot(root.toString()), settings.busyTimeoutMs());
        db.init();
        SyncServer server = new SyncServer(new ResultStore(db), settings);
        server.start();
        String url = "http://127.0.0.1:" + server.port();
        RecordingListener early = new RecordingListener();
        SseClient earlyClient = new SseClient(url, early, settings);
        RecordingListener late = new RecordingListener();
        SseClient lateClient = new SseClient(url, late, settings);
        try {
            earlyClient.start();
            awaitTrue(() -> !early.connectedVersions.isEmpty());
            Assertions.assertEquals(List.of(0L), early.connectedVersions);
            Assertions.assertTrue(early.catalogs.isEmpty());

            new SyncApiClient(url, settings).addOrUpdateResult(
                    new ResultStore.ResultWrite("P-1", "Acme", 1, 0, "", "", 0));
            awaitTrue(() -> !early.resultVersions.isEmpty());
            Assertions.assertEquals(List.of(1L), early.resultVersions);

            server.uploadCatalog("parts.xlsx", new byte[]{1, 2, 3});
            awaitTrue(() -> !early.catalogs.isEmpty());
            Assertions.assertEquals("parts.xlsx:3:2", early.catalogs.get(0));

            lateClient.start();
            awaitTrue(() -> !late.catalogs.isEmpty());
            Assertions.assertEquals(List.of(2L), late.connectedVersions);
            Assertions.assertEquals("parts.xlsx:3:2", late.catalogs.get(0));
            Assertions.assertTrue(late.resultVersions.isEmpty());
            Assertions.assertEquals("connected", late.events.get(0).path("type").asText());
        } finally {
            earlyClient.stop();
            lateClient.stop();
            server.stop();
            deleteRecursively(root);
        }
        Assertions.assertFalse(earlyClient.isRunning());
        Assertions.assertTrue(early.errors.isEmpty());
    }

    @Test
    void silentStreamIsAbortedAndRetried() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        HttpServer silent = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        silent.createContext("/api/events", exchange -> {
            attempts.incrementAndGet();
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
            exchange.sendResponseHeaders(200, 0);
            try {
                Thread.sleep(3_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                exchange.close();
            }
        });
        silent.setExecutor(Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "silent-sse");
            t.setDaemon(true);
            return t;
        }));
        silent.start();
        SyncSettings settings = SyncSettings.defaults().withSse(100L, 300L, 100L);
        RecordingListener listener = new RecordingListener();
        SseClient client = new SseClient("http://127.0.0.1:" + silent.getAddress().getPort(), listener, settings);
        try {
            client.start();
            awaitTrue(() -> attempts.get() >= 2);
            awaitTrue(() -> listener.disconnects.get() >= 1);
            Assertions.assertTrue(listener.errors.isEmpty());
        } finally {
            client.stop();
            silent.stop(0);
        }
    }

    @Test
    void nonOkResponseIsReportedAsError() throws Exception {
        HttpServer missing = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        missing.createContext("/api/events", exchange -> {
            byte[] body = "{\"ok\":false}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(503, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        missing.start();
        RecordingListener listener = new RecordingListener();
        SseClient client = new SseClient("http://127.0.0.1:" + missing.getAddress().getPort(), listener,
                SyncSettings.defaults().withSse(100L, 1_000L, 100L));
        try {
            client.start();
            awaitTrue(() -> !listener.errors.isEmpty());
            Assertions.assertEquals("event stream returned HTTP 503", listener.errors.get(0));
            Assertions.assertEquals(0, listener.disconnects.get());
        } finally {
            client.stop();
            missing.stop(0);
        }
    }

    @Test
    void refusedConnectionSignalsDisconnectedAndKeepsRetrying() throws Exception {
        int port;
        try (ServerSocket closed = new ServerSocket(0)) {
            port = closed.getLocalPort();
        }
        RecordingListener listener = new RecordingListener();
        SseClient client = new SseClient("http://127.0.0.1:" + port, listener,
                SyncSettings.defaults().withSse(100L, 1_000L, 50L));
        try {
            client.start();
            awaitTrue(() -> listener.disconnects.get() >= 3);
            Assertions.assertTrue(client.isRunning());
            Assertions.assertTrue(listener.errors.isEmpty());
            Assertions.assertTrue(listener.connectedVersions.isEmpty());
        } finally {
            client.stop();
        }
        Assertions.assertFalse(client.isRunning());
    }

    @Test
    void serverUrlWithoutSchemeIsReportedAndRetried() throws Exception {
        RecordingListener listener = new RecordingListener();
        SseClient client = new SseClient("localhost:1", listener, SyncSettings.defaults().withSse(100L, 1_000L, 50L));
        try {
            client.start();
            awaitTrue(() -> listener.errors.size() >= 2);
            Assertions.assertTrue(client.isRunning());
            Assertions.assertTrue(listener.errors.get(0).startsWith("unexpected event stream error"));
            Assertions.assertTrue(listener.disconnects.get() >= 2);
        } finally {
            client.stop();
        }
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000L;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20L);
        }
        Assertions.assertTrue(condition.getAsBoolean(), "condition not met within 10s");
    }

    private static final class RecordingListener implements SyncEventListener {
        final List<JsonNode> events = new CopyOnWriteArrayList<>();
        final List<Long> connectedVersions = new CopyOnWriteArrayList<>();
        final List<Long> resultVersions = new CopyOnWriteArrayList<>();
        final List<String> catalogs = new CopyOnWriteArrayList<>();
        final List<String> errors = new CopyOnWriteArrayList<>();
        final AtomicInteger disconnects = new AtomicInteger();

        @Override
        public void onEvent(JsonNode event) {
            events.add(event);
        }

        @Override
        public void onConnected(long version) {
            connectedVersions.add(version);
        }

        @Override
        public void onResultsChanged(long version) {
            resultVersions.add(version);
        }

        @Override
        public void onCatalogUploaded(String filename, long size, long version) {
            catalogs.add(filename + ":" + size + ":" + version);
        }

        @Override
        public void onDisconnected() {
            disconnects.incrementAndGet();
        }

        @Override
        public void onError(String error) {
            errors.add(error);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
