package io.gearledger.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import io.gearledger.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

final class HttpExchanges {
    private HttpExchanges() {
    }

    static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static void writeError(HttpExchange exchange, String error, int status) throws IOException {
        LinkedHashMap<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("error", error);
        writeJson(exchange, body, status);
    }

    static void writeBytes(HttpExchange exchange, byte[] bytes, String contentType, int status) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeError(exchange, "method_not_allowed", 405);
        return false;
    }

    /** Host address of the peer, without the port. */
    static String remoteIp(HttpExchange exchange) {
        InetSocketAddress remote = exchange.getRemoteAddress();
        if (remote == null) {
            return "unknown";
        }
        return remote.getAddress() == null ? remote.getHostString() : remote.getAddress().getHostAddress();
    }

    static byte[] readBody(HttpExchange exchange, long maxBytes) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            byte[] raw = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8, maxBytes + 1));
            if (raw.length > maxBytes) {
                throw new PayloadTooLargeException("request body exceeds " + maxBytes + " bytes");
            }
            return raw;
        }
    }

    /** Parses the body as a JSON object; an empty body yields null. */
    static JsonNode readJsonObject(HttpExchange exchange, long maxBytes) throws IOException {
        byte[] raw = readBody(exchange, maxBytes);
        String body = new String(raw, StandardCharsets.UTF_8).trim();
        if (body.isEmpty()) {
            return null;
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(body);
        } catch (IOException e) {
            throw new IllegalArgumentException("request body is not valid JSON", e);
        }
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("request body must be a JSON object");
        }
        return node;
    }

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                String key = URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8);
                String value = URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8);
                out.put(key, value);
            }
        }
        return out;
    }

    static final class PayloadTooLargeException extends IllegalArgumentException {
        PayloadTooLargeException(String message) {
            super(message);
        }
    }
}
