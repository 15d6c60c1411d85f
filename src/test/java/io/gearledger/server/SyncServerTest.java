package io.gearledger.server;

import com.fasterxml.jackson.databind.JsonNode;
import io.gearledger.config.SyncConfig;
import io.gearledger.config.SyncSettings;
import io.gearledger.storage.Database;
import io.gearledger.storage.ResultStore;
import io.gearledger.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

final class SyncServerTest {
    private Path root;
    private SyncServer server;
    private HttpClient http;
    private String base;
    private final List<Integer> countChanges = new CopyOnWriteArrayList<>();
    private final List<String> dataChanges = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("gearledger-test-server-");
        SyncSettings settings = SyncSettings.defaults()
                .withHttpPort(0)
                .withClientLiveness(400L, 50L)
                .withSse(200L, 2_000L, 100L)
                .withCatalogMaxBytes(1024L);
        Database db = new Database(SyncConfig.fromRoot(root.toString()), settings.busyTimeoutMs());
        db.init();
        server = new SyncServer(new ResultStore(db), settings);
        server.addListener(new SyncServerListener() {
            @Override
            public void onDataChanged() {
                dataChanges.add("changed");
            }

            @Override
            public void onClientCountChanged(int count) {
                countChanges.add(count);
            }
        });
        server.start();
        base = "http://127.0.0.1:" + server.port();
        http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.stop();
        deleteRecursively(root);
    }

    @Test
    void statusIdentifiesServerWithoutCountingClient() throws Exception {
        HttpResponse<String> response = get("/api/status");
        Assertions.assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        Assertions.assertEquals("ok", body.path("status").asText());
        Assertions.assertEquals(SyncServer.SERVER_IDENTITY, body.path("server").asText());
        Assertions.assertEquals(SyncServer.API_VERSION, body.path("version").asText());
        Assertions.assertTrue(response.headers().firstValue("Access-Control-Allow-Origin").isPresent());
        Assertions.assertEquals(0, server.connectedClientCount());
    }

    @Test
    void resultLifecycleBumpsVersionOnlyForUpsertAndClear() throws Exception {
        Assertions.assertEquals(0L, json(get("/api/sync/version")).path("version").asLong());

        JsonNode added = json(post("/api/results",
                "{\"artikul\":\"ABC-123\",\"client\":\"Acme\",\"quantity\":2,\"weight\":1.5,\"sale_price\":4}"));
        Assertions.assertTrue(added.path("ok").asBoolean());
        Assertions.assertEquals("inserted", added.path("action").asText());
        Assertions.assertEquals(1L, added.path("version").asLong());
        long id = added.path("id").asLong();

        JsonNode merged = json(post("/api/results", "{\"artikul\":\"abc123\",\"client\":\"ACME\",\"quantity\":3}"));
        Assertions.assertEquals("updated", merged.path("action").asText());
        Assertions.assertEquals(id, merged.path("id").asLong());
        Assertions.assertEquals(2L, merged.path("version").asLong());

        JsonNode listed = json(get("/api/results?client=acme"));
        Assertions.assertEquals(1, listed.path("results").size());
        JsonNode row = listed.path("results").get(0);
        Assertions.assertEquals(5, row.path("quantity").asInt());
        Assertions.assertEquals(20.0, row.path("total_price").asDouble(), 0.0001);
        Assertions.assertTrue(row.hasNonNull("last_updated"));

        HttpResponse<String> put = send("PUT", "/api/results/" + id, "{\"brand\":\"Bosch\",\"bogus\":1}");
        Assertions.assertEquals(200, put.statusCode());
        Assertions.assertEquals("Bosch", json(get("/api/results/" + id)).path("result").path("brand").asText());
        Assertions.assertEquals(400, send("PUT", "/api/results/" + id, "{\"bogus\":1}").statusCode());
        Assertions.assertEquals(404, send("PUT", "/api/results/999", "{\"brand\":\"x\"}").statusCode());
        Assertions.assertEquals(2L, server.version());

        Assertions.assertEquals(200, send("DELETE", "/api/results/" + id, null).statusCode());
        Assertions.assertEquals(404, get("/api/results/" + id).statusCode());
        Assertions.assertEquals(404, send("DELETE", "/api/results/" + id, null).statusCode());
        Assertions.assertEquals(2L, server.version());

        post("/api/results", "{\"artikul\":\"P-1\",\"client\":\"Acme\"}");
        post("/api/results", "{\"artikul\":\"P-1\",\"client\":\"Globex\"}");
        Assertions.assertEquals(List.of("Acme", "Globex"),
                Jsons.mapper().convertValue(json(get("/api/clients")).path("clients"), List.class));
        JsonNode cleared = json(post("/api/results/clear", "{\"client\":\"globex\"}"));
        Assertions.assertEquals(1, cleared.path("deleted").asInt());
        Assertions.assertEquals(5L, cleared.path("version").asLong());
        JsonNode clearedAll = json(post("/api/results/clear", ""));
        Assertions.assertEquals(1, clearedAll.path("deleted").asInt());
        Assertions.assertEquals(6L, json(get("/api/sync/version")).path("version").asLong());
        Assertions.assertTrue(dataChanges.size() >= 8);
    }

    @Test
    void invalidRequestsGetErrorStatuses() throws Exception {
        HttpResponse<String> missing = post("/api/results", "{\"artikul\":\"P-1\"}");
        Assertions.assertEquals(400, missing.statusCode());
        Assertions.assertFalse(json(missing).path("ok").asBoolean(true));
        Assertions.assertEquals("artikul and client required", json(missing).path("error").asText());

        Assertions.assertEquals(400, post("/api/results", "{not json").statusCode());
        Assertions.assertEquals(400, post("/api/results", "[1]").statusCode());
        Assertions.assertEquals(400, post("/api/results", "").statusCode());
        Assertions.assertEquals(405, send("DELETE", "/api/results", null).statusCode());
        Assertions.assertEquals(404, get("/api/results/abc").statusCode());
        Assertions.assertEquals(404, get("/api/status-nope").statusCode());
        Assertions.assertEquals(204, send("OPTIONS", "/api/results", null).statusCode());
        Assertions.assertEquals(0L, server.version());
    }

    @Test
    void negativeOrNonIntegerQuantityIsRejected() throws Exception {
        HttpResponse<String> negative = post("/api/results", "{\"artikul\":\"PK-1\",\"client\":\"Acme\",\"quantity\":-5}");
        Assertions.assertEquals(400, negative.statusCode());
        Assertions.assertEquals("quantity must be a non-negative integer", json(negative).path("error").asText());
        Assertions.assertEquals(400, post("/api/results",
                "{\"artikul\":\"PK-1\",\"client\":\"Acme\",\"quantity\":3000000000}").statusCode());
        Assertions.assertEquals(400, post("/api/results",
                "{\"artikul\":\"PK-1\",\"client\":\"Acme\",\"quantity\":1.5}").statusCode());
        Assertions.assertEquals(400, post("/api/results",
                "{\"artikul\":\"PK-1\",\"client\":\"Acme\",\"quantity\":\"lots\"}").statusCode());
        Assertions.assertEquals(0, json(get("/api/results")).path("results").size());
        Assertions.assertEquals(0L, server.version());

        JsonNode added = json(post("/api/results", "{\"artikul\":\"PK-1\",\"client\":\"Acme\",\"quantity\":\"3\"}"));
        Assertions.assertTrue(added.path("ok").asBoolean());
        long id = added.path("id").asLong();
        Assertions.assertEquals(400, send("PUT", "/api/results/" + id, "{\"quantity\":-1}").statusCode());
        Assertions.assertEquals(3, json(get("/api/results/" + id)).path("result").path("quantity").asInt());
    }

    @Test
    void clearReportsTheVersionItProduced() {
        server.recordResult(new ResultStore.ResultWrite("P-1", "Acme", 1, 0, "", "", 0));
        SyncServer.ClearedResults cleared = server.clearResults(null);
        Assertions.assertEquals(1, cleared.deleted());
        Assertions.assertEquals(2L, cleared.version());
        Assertions.assertEquals(0, server.clearResults("Nobody").deleted());
        Assertions.assertEquals(3L, server.version());
    }

    @Test
    void catalogBytesAreCopiedInAndOut() throws Exception {
        byte[] content = {1, 2, 3};
        server.uploadCatalog("parts.bin", content);
        content[0] = 9;
        server.catalog().orElseThrow().bytes()[1] = 9;

        HttpResponse<byte[]> download = http.send(
                HttpRequest.newBuilder(URI.create(base + "/api/catalog")).GET().build(),
                HttpResponse.BodyHandlers.ofByteArray()
        );
        Assertions.assertArrayEquals(new byte[]{1, 2, 3}, download.body());
    }

    @Test
    void nonAsciiCatalogNameIsSentAsExtendedFilename() throws Exception {
        server.uploadCatalog("\u041f\u0440\u0430\u0439\u0441 2024.xlsx", new byte[]{1});
        HttpResponse<byte[]> download = http.send(
                HttpRequest.newBuilder(URI.create(base + "/api/catalog")).GET().build(),
                HttpResponse.BodyHandlers.ofByteArray()
        );
        Assertions.assertEquals(200, download.statusCode());
        String disposition = download.headers().firstValue("Content-Disposition").orElseThrow();
        Assertions.assertEquals(
                "attachment; filename=\"_____ 2024.xlsx\"; filename*=UTF-8''%D0%9F%D1%80%D0%B0%D0%B9%D1%81%202024.xlsx",
                disposition
        );
    }

    @Test
    void catalogUploadReplacesBlobAndBumpsVersion() throws Exception {
        JsonNode absent = json(get("/api/catalog/info"));
        Assertions.assertTrue(absent.path("ok").asBoolean());
        Assertions.assertFalse(absent.path("exists").asBoolean(true));
        Assertions.assertFalse(absent.has("filename"));
        Assertions.assertEquals(404, get("/api/catalog").statusCode());

        byte[] content = "artikul;price\nABC;1\n".getBytes(StandardCharsets.UTF_8);
        JsonNode uploaded = json(upload("catalog.csv", content));
        Assertions.assertEquals("catalog.csv", uploaded.path("filename").asText());
        Assertions.assertEquals(content.length, uploaded.path("size").asLong());
        Assertions.assertEquals(1L, uploaded.path("version").asLong());

        JsonNode info = json(get("/api/catalog/info"));
        Assertions.assertTrue(info.path("exists").asBoolean());
        Assertions.assertEquals(1L, info.path("version").asLong());
        Assertions.assertTrue(info.hasNonNull("uploaded_at"));

        HttpResponse<byte[]> download = http.send(
                HttpRequest.newBuilder(URI.create(base + "/api/catalog")).GET().build(),
                HttpResponse.BodyHandlers.ofByteArray()
        );
        Assertions.assertEquals(200, download.statusCode());
        Assertions.assertArrayEquals(content, download.body());
        Assertions.assertTrue(download.headers().firstValue("Content-Disposition").orElse("").contains("catalog.csv"));

        Assertions.assertEquals(413, upload("big.bin", new byte[2048]).statusCode());
        Assertions.assertEquals(400, post("/api/catalog", "{}").statusCode());
        Assertions.assertEquals(1L, server.version());
    }

    @Test
    void requestingAddressCountsAsConnectedUntilStale() throws Exception {
        get("/api/sync/version");
        Assertions.assertEquals(1, server.connectedClientCount());
        Assertions.assertEquals(1, json(get("/api/clients/count")).path("count").asInt());

        long deadline = System.currentTimeMillis() + 5_000L;
        while (server.connectedClientCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50L);
        }
        Assertions.assertEquals(0, server.connectedClientCount());
        Assertions.assertEquals(List.of(1, 0), countChanges);
    }

    @Test
    void eventStreamStartsWithConnectedAndDeliversLaterChangesOnly() throws Exception {
        post("/api/results", "{\"artikul\":\"OLD\",\"client\":\"Acme\"}");
        upload("catalog.csv", "a".getBytes(StandardCharsets.UTF_8));

        HttpResponse<InputStream> stream = http.send(
                HttpRequest.newBuilder(URI.create(base + "/api/events")).GET().build(),
                HttpResponse.BodyHandlers.ofInputStream()
        );
        Assertions.assertEquals(200, stream.statusCode());
        Assertions.assertTrue(stream.headers().firstValue("Content-Type").orElse("").startsWith("text/event-stream"));
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream.body(), StandardCharsets.UTF_8))) {
            JsonNode connected = Assertions.assertTimeoutPreemptively(Duration.ofSeconds(5), () -> nextEvent(reader));
            Assertions.assertEquals("connected", connected.path("type").asText());
            Assertions.assertEquals(2L, connected.path("version").asLong());
            Assertions.assertEquals("catalog.csv", connected.path("catalog").path("filename").asText());

            long deadline = System.currentTimeMillis() + 5_000L;
            while (server.subscriberCount() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20L);
            }
            post("/api/results", "{\"artikul\":\"NEW\",\"client\":\"Acme\"}");
            JsonNode changed = Assertions.assertTimeoutPreemptively(Duration.ofSeconds(5), () -> nextEvent(reader));
            Assertions.assertEquals("results_changed", changed.path("type").asText());
            Assertions.assertEquals(3L, changed.path("version").asLong());

            String keepalive = Assertions.assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.startsWith(":")) {
                        return line;
                    }
                }
                return null;
            });
            Assertions.assertEquals(": keepalive", keepalive);
        }
    }

    private static JsonNode nextEvent(BufferedReader reader) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.startsWith("data: ")) {
                return Jsons.mapper().readTree(line.substring("data: ".length()));
            }
        }
        throw new IOException("event stream ended");
    }

    private HttpResponse<String> get(String path) throws Exception {
        return send("GET", path, null);
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return send("POST", path, body);
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder(URI.create(base + path))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .method(method, publisher)
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private HttpResponse<String> upload(String filename, byte[] content) throws Exception {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.writeBytes(("--bnd\r\nContent-Disposition: form-data; name=\"file\"; filename=\"" + filename + "\"\r\n"
                + "Content-Type: application/octet-stream\r\n\r\n").getBytes(StandardCharsets.UTF_8));
        body.writeBytes(content);
        body.writeBytes("\r\n--bnd--\r\n".getBytes(StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder(URI.create(base + "/api/catalog"))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "multipart/form-data; boundary=bnd")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body.toByteArray()))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private static JsonNode json(HttpResponse<String> response) throws IOException {
        return Jsons.mapper().readTree(response.body());
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
