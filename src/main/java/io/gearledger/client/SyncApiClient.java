package io.gearledger.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.gearledger.config.SyncSettings;
import io.gearledger.model.ResultRecord;
import io.gearledger.server.SyncServer;
import io.gearledger.storage.ResultStore;
import io.gearledger.util.ContentDisposition;
import io.gearledger.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Blocking HTTP client of a sync server. No method throws on transport failure:
 * failures come back as {@code ok=false} results or the documented fallback value.
 */
public final class SyncApiClient {
    private static final Logger log = LoggerFactory.getLogger(SyncApiClient.class);

    private final String serverUrl;
    private final Duration requestTimeout;
    private final HttpClient http;
    private volatile boolean connected;

    public SyncApiClient(String serverUrl, SyncSettings settings) {
        this.serverUrl = stripTrailingSlash(serverUrl);
        this.requestTimeout = Duration.ofMillis(settings.requestTimeoutMs());
        this.http = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
    }

    public String serverUrl() {
        return serverUrl;
    }

    public boolean isConnected() {
        return connected;
    }

    /**
     * Probes {@code /api/status}. On success also reads the sync version so the
     * server counts this client as connected.
     */
    public boolean checkConnection() {
        ApiResult status = get("/api/status");
        boolean ok = status.ok()
                && "ok".equals(status.body().path("status").asText())
                && SyncServer.SERVER_IDENTITY.equals(status.body().path("server").asText());
        connected = ok;
        if (ok) {
            getSyncVersion();
        } else {
            log.debug("Server {} not reachable: {}", serverUrl, status.error());
        }
        return ok;
    }

    public ApiResult addOrUpdateResult(ResultStore.ResultWrite write) {
        LinkedHashMap<String, Object> body = new LinkedHashMap<>();
        body.put("artikul", write.artikul());
        body.put("client", write.client());
        body.put("quantity", write.quantity());
        body.put("weight", write.weight());
        body.put("brand", write.brand() == null ? "" : write.brand());
        body.put("description", write.description() == null ? "" : write.description());
        body.put("sale_price", write.salePrice());
        return sendJson("POST", "/api/results", body);
    }

    /** All results, or only those of {@code client} when non-blank. Empty on failure. */
    public List<ResultRecord> getAllResults(String client) {
        String path = "/api/results";
        if (client != null && !client.isBlank()) {
            path += "?client=" + URLEncoder.encode(client, StandardCharsets.UTF_8);
        }
        ApiResult result = get(path);
        List<ResultRecord> out = new ArrayList<>();
        if (!result.ok()) {
            return out;
        }
        for (JsonNode node : result.body().path("results")) {
            out.add(Jsons.mapper().convertValue(node, ResultRecord.class));
        }
        return out;
    }

    public Optional<ResultRecord> getResultById(long id) {
        ApiResult result = get("/api/results/" + id);
        if (!result.ok() || !result.body().has("result")) {
            return Optional.empty();
        }
        return Optional.of(Jsons.mapper().convertValue(result.body().get("result"), ResultRecord.class));
    }

    public boolean updateResult(long id, Map<String, ?> fields) {
        return sendJson("PUT", "/api/results/" + id, fields).ok();
    }

    public boolean deleteResult(long id) {
        return send("DELETE", "/api/results/" + id, null, HttpRequest.BodyPublishers.noBody()).ok();
    }

    /** Clears all results, or one client's. Returns the number deleted, 0 on failure. */
    public int clearAllResults(String client) {
        LinkedHashMap<String, Object> body = new LinkedHashMap<>();
        if (client != null && !client.isBlank()) {
            body.put("client", client);
        }
        ApiResult result = sendJson("POST", "/api/results/clear", body);
        return result.ok() ? result.body().path("deleted").asInt(0) : 0;
    }

    public long getSyncVersion() {
        ApiResult result = get("/api/sync/version");
        return result.ok() ? result.body().path("version").asLong(-1L) : -1L;
    }

    public List<String> getClients() {
        ApiResult result = get("/api/clients");
        List<String> out = new ArrayList<>();
        if (result.ok()) {
            for (JsonNode node : result.body().path("clients")) {
                out.add(node.asText());
            }
        }
        return out;
    }

    public int getConnectedClientCount() {
        ApiResult result = get("/api/clients/count");
        return result.ok() ? result.body().path("count").asInt(-1) : -1;
    }

    public ApiResult getCatalogInfo() {
        return get("/api/catalog/info");
    }

    public Optional<CatalogFile> downloadCatalog() {
        try {
            HttpRequest request = request("GET", "/api/catalog", null, HttpRequest.BodyPublishers.noBody());
            HttpResponse<byte[]> response = http.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() != 200) {
                return Optional.empty();
            }
            String filename = ContentDisposition.filename(response.headers().firstValue("Content-Disposition").orElse(""));
            if (filename == null || filename.isBlank()) {
                filename = "catalog";
            }
            String contentType = response.headers().firstValue("Content-Type").orElse("application/octet-stream");
            return Optional.of(new CatalogFile(filename, contentType, response.body()));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Catalog download from {} failed: {}", serverUrl, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    /** Uploads {@code bytes} as the {@code file} field of a multipart form. */
    public ApiResult uploadCatalog(String filename, byte[] bytes) {
        String boundary = "gearledger-" + UUID.randomUUID();
        ByteArrayOutputStream body = new ByteArrayOutputStream(bytes.length + 512);
        String head = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\"" + quote(filename) + "\"\r\n"
                + "Content-Type: application/octet-stream\r\n\r\n";
        body.writeBytes(head.getBytes(StandardCharsets.UTF_8));
        body.writeBytes(bytes);
        body.writeBytes(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
        return send("POST", "/api/catalog", "multipart/form-data; boundary=" + boundary,
                HttpRequest.BodyPublishers.ofByteArray(body.toByteArray()));
    }

    private ApiResult get(String path) {
        return send("GET", path, null, HttpRequest.BodyPublishers.noBody());
    }

    private ApiResult sendJson(String method, String path, Object body) {
        return send(method, path, "application/json", HttpRequest.BodyPublishers.ofString(Jsons.toJson(body), StandardCharsets.UTF_8));
    }

    private ApiResult send(String method, String path, String contentType, HttpRequest.BodyPublisher body) {
        try {
            HttpRequest request = request(method, path, contentType, body);
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            JsonNode parsed = parse(response.body());
            if (response.statusCode() / 100 != 2) {
                String error = parsed.path("error").asText("HTTP " + response.statusCode());
                return ApiResult.failure(response.statusCode(), parsed, error);
            }
            return ApiResult.success(response.statusCode(), parsed);
        } catch (IOException e) {
            connected = false;
            log.debug("{} {}{} failed: {}", method, serverUrl, path, e.toString());
            return ApiResult.transportFailure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } catch (IllegalArgumentException e) {
            // Raised for a server URL without an http(s) scheme or with illegal characters.
            connected = false;
            log.debug("{} {}{} rejected: {}", method, serverUrl, path, e.getMessage());
            return ApiResult.transportFailure("invalid server URL " + serverUrl + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ApiResult.transportFailure("interrupted");
        }
    }

    private HttpRequest request(String method, String path, String contentType, HttpRequest.BodyPublisher body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(serverUrl + path))
                .timeout(requestTimeout)
                .method(method, body);
        if (contentType != null) {
            builder.header("Content-Type", contentType);
        }
        return builder.build();
    }

    private static JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return Jsons.mapper().createObjectNode();
        }
        try {
            return Jsons.mapper().readTree(body);
        } catch (IOException e) {
            log.debug("Response body is not JSON: {}", e.getMessage());
            return Jsons.mapper().createObjectNode();
        }
    }

    private static String quote(String filename) {
        return filename.replace("\\", "\\\\").replace("\"", "\\\"").replace("\r", "").replace("\n", "");
    }

    private static String stripTrailingSlash(String url) {
        String out = url == null ? "" : url.trim();
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
