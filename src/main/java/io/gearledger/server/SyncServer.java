package io.gearledger.server;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.gearledger.config.SyncSettings;
import io.gearledger.discovery.NetworkAddresses;
import io.gearledger.model.CatalogInfo;
import io.gearledger.model.ResultRecord;
import io.gearledger.model.SyncEvents;
import io.gearledger.model.UpsertOutcome;
import io.gearledger.storage.ResultStore;
import io.gearledger.util.ContentDisposition;
import io.gearledger.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Authoritative sync server: REST control plane over the results ledger and the
 * catalog blob, plus the {@code /api/events} push stream.
 *
 * <p>Every accepted upsert, clear and catalog upload bumps the sync version and is
 * published to all open event streams. Point edits and deletes by id only notify
 * local {@link SyncServerListener}s.
 */
public final class SyncServer {
    private static final Logger log = LoggerFactory.getLogger(SyncServer.class);
    public static final String SERVER_IDENTITY = "Gear Ledger Server";
    public static final String API_VERSION = "1.0.0";
    private static final long JSON_BODY_MAX_BYTES = 1024L * 1024L;
    private static final long MULTIPART_OVERHEAD_BYTES = 64L * 1024L;
    private static final int STOP_DELAY_SECONDS = 1;
    private static final TypeReference<LinkedHashMap<String, Object>> FIELD_MAP = new TypeReference<>() {
    };

    private final ResultStore store;
    private final SyncSettings settings;
    private final SyncState state = new SyncState();
    private final ConnectedClients clients;
    private final EventHub hub;
    private final List<SyncServerListener> listeners = new CopyOnWriteArrayList<>();
    private HttpServer server;
    private ExecutorService workers;
    private ScheduledExecutorService sweeper;
    private volatile boolean running;

    public SyncServer(ResultStore store, SyncSettings settings) {
        this.store = store;
        this.settings = settings;
        this.clients = new ConnectedClients(settings.clientStaleMs(), System::currentTimeMillis);
        this.hub = new EventHub(settings.sseQueueCapacity());
    }

    public void addListener(SyncServerListener listener) {
        listeners.add(listener);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        try {
            server = HttpServer.create(new InetSocketAddress(settings.httpPort()), 0);
        } catch (IOException e) {
            throw new RuntimeException("Failed to start sync server on port " + settings.httpPort(), e);
        }
        server.createContext("/api/status", guarded(this::handleStatus));
        server.createContext("/api/sync/version", guarded(this::handleVersion));
        server.createContext("/api/events", guarded(this::handleEvents));
        server.createContext("/api/results", guarded(this::handleResults));
        server.createContext("/api/clients", guarded(this::handleClients));
        server.createContext("/api/clients/count", guarded(this::handleClientCount));
        server.createContext("/api/catalog", guarded(this::handleCatalog));
        server.createContext("/api/catalog/info", guarded(this::handleCatalogInfo));

        AtomicInteger workerSeq = new AtomicInteger();
        workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "gearledger-http-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(workers);
        server.start();
        running = true;

        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gearledger-client-sweep");
            t.setDaemon(true);
            return t;
        });
        sweeper.scheduleAtFixedRate(
                this::sweepClients,
                settings.clientSweepIntervalMs(),
                settings.clientSweepIntervalMs(),
                TimeUnit.MILLISECONDS
        );
        log.info("Sync server listening on {}", serverUrl());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        hub.closeAll();
        sweeper.shutdownNow();
        server.stop(STOP_DELAY_SECONDS);
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("HTTP workers did not terminate within 2s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Sync server stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        HttpServer s = server;
        return s == null ? settings.httpPort() : s.getAddress().getPort();
    }

    public String serverUrl() {
        return "http://" + NetworkAddresses.primaryLocalIp() + ":" + port();
    }

    public long version() {
        return state.version();
    }

    public int connectedClientCount() {
        return clients.count();
    }

    public int subscriberCount() {
        return hub.subscriberCount();
    }

    public Optional<CatalogBlob> catalog() {
        return state.catalog();
    }

    public record RecordedResult(UpsertOutcome outcome, long version) {
    }

    public RecordedResult recordResult(ResultStore.ResultWrite write) {
        UpsertOutcome outcome = store.upsert(write);
        long version = publishResultsChanged();
        fireDataChanged();
        log.info("Result {} {} / {} (version {})", outcome.action().wireName(), write.artikul(), write.client(), version);
        return new RecordedResult(outcome, version);
    }

    public record ClearedResults(int deleted, long version) {
    }

    public ClearedResults clearResults(String client) {
        int deleted = store.clear(client);
        long version = publishResultsChanged();
        fireDataChanged();
        log.info("Cleared {} result(s){} (version {})", deleted,
                client == null || client.isBlank() ? "" : " for " + client, version);
        return new ClearedResults(deleted, version);
    }

    public CatalogBlob uploadCatalog(String filename, byte[] bytes) {
        CatalogBlob blob;
        synchronized (state) {
            blob = state.replaceCatalog(filename, bytes);
            hub.publish(SyncEvents.catalogUploaded(blob.filename(), blob.size(), blob.version()));
        }
        fireDataChanged();
        log.info("Catalog {} uploaded ({} bytes, version {})", blob.filename(), blob.size(), blob.version());
        return blob;
    }

    // Holding the state monitor keeps events queued in version order.
    private long publishResultsChanged() {
        synchronized (state) {
            long version = state.bumpVersion();
            hub.publish(SyncEvents.resultsChanged(version));
            return version;
        }
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        if (!exactPath(exchange, "/api/status")) return;
        if (!HttpExchanges.allowMethods(exchange, "GET")) return;
        LinkedHashMap<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("server", SERVER_IDENTITY);
        body.put("name", settings.serverName());
        body.put("version", API_VERSION);
        HttpExchanges.writeJson(exchange, body, 200);
    }

    private void handleVersion(HttpExchange exchange) throws IOException {
        if (!exactPath(exchange, "/api/sync/version")) return;
        if (!HttpExchanges.allowMethods(exchange, "GET")) return;
        touchClient(exchange);
        HttpExchanges.writeJson(exchange, Map.of("ok", true, "version", state.version()), 200);
    }

    private void handleResults(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String tail = path.length() > "/api/results".length() ? path.substring("/api/results".length()) : "";
        if (tail.equals("/")) {
            tail = "";
        }
        touchClient(exchange);
        if (tail.isEmpty()) {
            if (!HttpExchanges.allowMethods(exchange, "GET", "POST")) return;
            if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                listResults(exchange);
            } else {
                addResult(exchange);
            }
            return;
        }
        if (tail.equals("/clear")) {
            if (!HttpExchanges.allowMethods(exchange, "POST")) return;
            clearResults(exchange);
            return;
        }
        long id;
        try {
            id = Long.parseLong(tail.substring(1));
        } catch (NumberFormatException e) {
            HttpExchanges.writeError(exchange, "Not found", 404);
            return;
        }
        if (!HttpExchanges.allowMethods(exchange, "GET", "PUT", "DELETE")) return;
        switch (exchange.getRequestMethod().toUpperCase()) {
            case "GET" -> getResult(exchange, id);
            case "PUT" -> updateResult(exchange, id);
            default -> deleteResult(exchange, id);
        }
    }

    private void listResults(HttpExchange exchange) throws IOException {
        String client = HttpExchanges.parseQuery(exchange.getRequestURI()).get("client");
        List<ResultRecord> results = store.list(client);
        HttpExchanges.writeJson(exchange, Map.of("ok", true, "results", results), 200);
    }

    private void addResult(HttpExchange exchange) throws IOException {
        JsonNode body = HttpExchanges.readJsonObject(exchange, JSON_BODY_MAX_BYTES);
        if (body == null) {
            HttpExchanges.writeError(exchange, "No data provided", 400);
            return;
        }
        String artikul = body.path("artikul").asText("").trim();
        String client = body.path("client").asText("").trim();
        if (artikul.isEmpty() || client.isEmpty()) {
            HttpExchanges.writeError(exchange, "artikul and client required", 400);
            return;
        }
        int quantity = quantityOf(body.path("quantity"));
        if (quantity < 0) {
            HttpExchanges.writeError(exchange, "quantity must be a non-negative integer", 400);
            return;
        }
        ResultStore.ResultWrite write = new ResultStore.ResultWrite(
                artikul,
                client,
                quantity,
                body.path("weight").asDouble(0),
                body.path("brand").asText(""),
                body.path("description").asText(""),
                body.path("sale_price").asDouble(0)
        );
        RecordedResult recorded = recordResult(write);
        LinkedHashMap<String, Object> out = new LinkedHashMap<>();
        out.put("ok", true);
        out.put("action", recorded.outcome().action());
        out.put("id", recorded.outcome().id());
        out.put("version", recorded.version());
        HttpExchanges.writeJson(exchange, out, 200);
    }

    /** Quantity of an added result, 1 when absent, -1 when not a non-negative int. */
    private static int quantityOf(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return 1;
        }
        if (node.isTextual()) {
            try {
                return Math.max(-1, Integer.parseInt(node.asText().trim()));
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        if (!node.canConvertToExactIntegral() || !node.canConvertToInt()) {
            return -1;
        }
        return Math.max(-1, node.asInt());
    }

    private void clearResults(HttpExchange exchange) throws IOException {
        JsonNode body = HttpExchanges.readJsonObject(exchange, JSON_BODY_MAX_BYTES);
        String client = body == null ? null : body.path("client").asText(null);
        if (client == null) {
            client = HttpExchanges.parseQuery(exchange.getRequestURI()).get("client");
        }
        ClearedResults cleared = clearResults(client);
        LinkedHashMap<String, Object> out = new LinkedHashMap<>();
        out.put("ok", true);
        out.put("deleted", cleared.deleted());
        out.put("version", cleared.version());
        HttpExchanges.writeJson(exchange, out, 200);
    }

    private void getResult(HttpExchange exchange, long id) throws IOException {
        Optional<ResultRecord> result = store.get(id);
        if (result.isEmpty()) {
            HttpExchanges.writeError(exchange, "Not found", 404);
            return;
        }
        HttpExchanges.writeJson(exchange, Map.of("ok", true, "result", result.get()), 200);
    }

    private void updateResult(HttpExchange exchange, long id) throws IOException {
        JsonNode body = HttpExchanges.readJsonObject(exchange, JSON_BODY_MAX_BYTES);
        if (body == null) {
            HttpExchanges.writeError(exchange, "No data provided", 400);
            return;
        }
        Map<String, Object> fields = Jsons.mapper().convertValue(body, FIELD_MAP);
        switch (store.update(id, fields)) {
            case NOT_FOUND -> HttpExchanges.writeError(exchange, "Not found", 404);
            case NO_FIELDS -> HttpExchanges.writeError(exchange, "No updatable fields provided", 400);
            case UPDATED -> {
                fireDataChanged();
                HttpExchanges.writeJson(exchange, Map.of("ok", true), 200);
            }
        }
    }

    private void deleteResult(HttpExchange exchange, long id) throws IOException {
        if (!store.delete(id)) {
            HttpExchanges.writeError(exchange, "Not found", 404);
            return;
        }
        fireDataChanged();
        HttpExchanges.writeJson(exchange, Map.of("ok", true), 200);
    }

    private void handleClients(HttpExchange exchange) throws IOException {
        if (!exactPath(exchange, "/api/clients")) return;
        if (!HttpExchanges.allowMethods(exchange, "GET")) return;
        HttpExchanges.writeJson(exchange, Map.of("ok", true, "clients", store.clients()), 200);
    }

    private void handleClientCount(HttpExchange exchange) throws IOException {
        if (!exactPath(exchange, "/api/clients/count")) return;
        if (!HttpExchanges.allowMethods(exchange, "GET")) return;
        HttpExchanges.writeJson(exchange, Map.of("ok", true, "count", clients.count()), 200);
    }

    private void handleCatalogInfo(HttpExchange exchange) throws IOException {
        if (!exactPath(exchange, "/api/catalog/info")) return;
        if (!HttpExchanges.allowMethods(exchange, "GET")) return;
        CatalogInfo info = state.catalog()
                .map(c -> new CatalogInfo(true, true, c.filename(), c.size(), c.uploadedAt().toString(), c.version()))
                .orElseGet(CatalogInfo::absent);
        HttpExchanges.writeJson(exchange, info, 200);
    }

    private void handleCatalog(HttpExchange exchange) throws IOException {
        if (!exactPath(exchange, "/api/catalog")) return;
        if (!HttpExchanges.allowMethods(exchange, "GET", "POST")) return;
        if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            downloadCatalog(exchange);
        } else {
            receiveCatalog(exchange);
        }
    }

    private void downloadCatalog(HttpExchange exchange) throws IOException {
        Optional<CatalogBlob> catalog = state.catalog();
        if (catalog.isEmpty()) {
            HttpExchanges.writeError(exchange, "No catalog uploaded", 404);
            return;
        }
        CatalogBlob blob = catalog.get();
        String contentType = URLConnection.guessContentTypeFromName(blob.filename());
        exchange.getResponseHeaders().set("Content-Disposition", ContentDisposition.attachment(blob.filename()));
        HttpExchanges.writeBytes(exchange, blob.bytes(), contentType == null ? "application/octet-stream" : contentType, 200);
    }

    private void receiveCatalog(HttpExchange exchange) throws IOException {
        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        if (!MultipartForm.isMultipart(contentType)) {
            HttpExchanges.writeError(exchange, "No file provided", 400);
            return;
        }
        byte[] raw = HttpExchanges.readBody(exchange, settings.catalogMaxBytes() + MULTIPART_OVERHEAD_BYTES);
        Optional<MultipartForm.Part> file = MultipartForm.parse(contentType, raw).part("file");
        if (file.isEmpty()) {
            HttpExchanges.writeError(exchange, "No file provided", 400);
            return;
        }
        String filename = baseName(file.get().filename());
        if (filename.isEmpty()) {
            HttpExchanges.writeError(exchange, "No file selected", 400);
            return;
        }
        if (file.get().bytes().length > settings.catalogMaxBytes()) {
            HttpExchanges.writeError(exchange, "Catalog exceeds " + settings.catalogMaxBytes() + " bytes", 413);
            return;
        }
        CatalogBlob blob = uploadCatalog(filename, file.get().bytes());
        LinkedHashMap<String, Object> out = new LinkedHashMap<>();
        out.put("ok", true);
        out.put("filename", blob.filename());
        out.put("size", blob.size());
        out.put("version", blob.version());
        HttpExchanges.writeJson(exchange, out, 200);
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!exactPath(exchange, "/api/events")) return;
        if (!HttpExchanges.allowMethods(exchange, "GET")) return;
        // Subscribe before reading the version so nothing published in between is lost.
        EventSubscriber subscriber = hub.subscribe();
        log.info("Event stream opened by {} ({} open)", HttpExchanges.remoteIp(exchange), hub.subscriberCount());
        try {
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream; charset=utf-8");
            exchange.getResponseHeaders().set("Cache-Control", "no-cache");
            exchange.getResponseHeaders().set("Connection", "keep-alive");
            exchange.sendResponseHeaders(200, 0);
            OutputStream os = exchange.getResponseBody();
            SyncState.Snapshot snapshot = state.snapshot();
            SyncEvents.CatalogRef catalogRef = snapshot.catalog() == null
                    ? null
                    : new SyncEvents.CatalogRef(snapshot.catalog().filename(), snapshot.catalog().size(), snapshot.catalog().version());
            writeFrame(os, "data: " + Jsons.toJson(SyncEvents.connected(snapshot.version(), catalogRef)) + "\n\n");
            while (running) {
                EventSubscriber.Frame frame = subscriber.poll(settings.sseKeepaliveMs());
                if (frame == null) {
                    writeFrame(os, ": keepalive\n\n");
                    continue;
                }
                if (frame.isClose()) {
                    break;
                }
                writeFrame(os, "data: " + frame.data() + "\n\n");
            }
        } catch (IOException e) {
            log.debug("Event stream to {} closed: {}", HttpExchanges.remoteIp(exchange), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            hub.unsubscribe(subscriber);
            log.info("Event stream closed for {} ({} open)", HttpExchanges.remoteIp(exchange), hub.subscriberCount());
        }
    }

    private static void writeFrame(OutputStream os, String frame) throws IOException {
        os.write(frame.getBytes(StandardCharsets.UTF_8));
        os.flush();
    }

    private void touchClient(HttpExchange exchange) {
        int count = clients.touch(HttpExchanges.remoteIp(exchange));
        if (count >= 0) {
            log.info("Client {} connected ({} connected)", HttpExchanges.remoteIp(exchange), count);
            fireClientCountChanged(count);
        }
    }

    private void sweepClients() {
        try {
            int count = clients.sweep();
            if (count >= 0) {
                log.info("Connected clients now {}", count);
                fireClientCountChanged(count);
            }
        } catch (RuntimeException e) {
            log.error("Connected-client sweep failed", e);
        }
    }

    private void fireDataChanged() {
        for (SyncServerListener listener : listeners) {
            try {
                listener.onDataChanged();
            } catch (RuntimeException e) {
                log.warn("Data-changed listener failed", e);
            }
        }
    }

    private void fireClientCountChanged(int count) {
        for (SyncServerListener listener : listeners) {
            try {
                listener.onClientCountChanged(count);
            } catch (RuntimeException e) {
                log.warn("Client-count listener failed", e);
            }
        }
    }

    private static boolean exactPath(HttpExchange exchange, String path) throws IOException {
        String actual = exchange.getRequestURI().getPath();
        if (path.equals(actual) || (path + "/").equals(actual)) {
            return true;
        }
        HttpExchanges.writeError(exchange, "Not found", 404);
        return false;
    }

    private static String baseName(String filename) {
        if (filename == null) {
            return "";
        }
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        return filename.substring(slash + 1).trim();
    }

    @FunctionalInterface
    private interface Route {
        void handle(HttpExchange exchange) throws IOException;
    }

    /** Isolates one request: any failure becomes an error response for that request only. */
    private HttpHandler guarded(Route route) {
        return exchange -> {
            try {
                exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
                if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET,POST,PUT,DELETE,OPTIONS");
                    exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
                    exchange.sendResponseHeaders(204, -1);
                    return;
                }
                route.handle(exchange);
            } catch (HttpExchanges.PayloadTooLargeException e) {
                respondError(exchange, e.getMessage(), 413);
            } catch (IllegalArgumentException e) {
                respondError(exchange, e.getMessage(), 400);
            } catch (Exception e) {
                log.error("{} {} failed", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), e);
                respondError(exchange, "internal_error", 500);
            } finally {
                exchange.close();
            }
        };
    }

    private static void respondError(HttpExchange exchange, String error, int status) {
        if (exchange.getResponseCode() != -1) {
            return;
        }
        try {
            HttpExchanges.writeError(exchange, error == null ? "bad_request" : error, status);
        } catch (IOException e) {
            log.debug("Could not send {} response: {}", status, e.getMessage());
        }
    }
}
