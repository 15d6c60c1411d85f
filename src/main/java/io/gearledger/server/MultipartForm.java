package io.gearledger.server;

import io.gearledger.util.ContentDisposition;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Minimal {@code multipart/form-data} reader for buffered request bodies. */
final class MultipartForm {
    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] HEADER_END = {'\r', '\n', '\r', '\n'};

    private final List<Part> parts;

    private MultipartForm(List<Part> parts) {
        this.parts = parts;
    }

    List<Part> parts() {
        return parts;
    }

    Optional<Part> part(String name) {
        for (Part part : parts) {
            if (name.equals(part.name())) {
                return Optional.of(part);
            }
        }
        return Optional.empty();
    }

    static boolean isMultipart(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith("multipart/form-data");
    }

    static MultipartForm parse(String contentType, byte[] body) {
        String boundary = boundary(contentType);
        if (boundary == null) {
            throw new IllegalArgumentException("multipart boundary missing");
        }
        byte[] delimiter = ("--" + boundary).getBytes(StandardCharsets.ISO_8859_1);
        byte[] innerDelimiter = ("\r\n--" + boundary).getBytes(StandardCharsets.ISO_8859_1);
        List<Part> out = new ArrayList<>();
        int pos = indexOf(body, delimiter, 0);
        if (pos < 0) {
            throw new IllegalArgumentException("multipart body has no parts");
        }
        pos += delimiter.length;
        while (true) {
            if (startsWith(body, pos, new byte[]{'-', '-'})) {
                break;
            }
            if (!startsWith(body, pos, CRLF)) {
                throw new IllegalArgumentException("malformed multipart delimiter");
            }
            pos += CRLF.length;
            int headerEnd = indexOf(body, HEADER_END, pos);
            if (headerEnd < 0) {
                throw new IllegalArgumentException("malformed multipart headers");
            }
            Map<String, String> headers = parseHeaders(new String(body, pos, headerEnd - pos, StandardCharsets.UTF_8));
            int contentStart = headerEnd + HEADER_END.length;
            int contentEnd = indexOf(body, innerDelimiter, contentStart);
            if (contentEnd < 0) {
                throw new IllegalArgumentException("unterminated multipart part");
            }
            String disposition = headers.getOrDefault("content-disposition", "");
            out.add(new Part(
                    ContentDisposition.parameters(disposition).get("name"),
                    ContentDisposition.filename(disposition),
                    headers.get("content-type"),
                    Arrays.copyOfRange(body, contentStart, contentEnd)
            ));
            pos = contentEnd + innerDelimiter.length;
        }
        return new MultipartForm(out);
    }

    private static String boundary(String contentType) {
        if (contentType == null) {
            return null;
        }
        for (String param : contentType.split(";")) {
            String trimmed = param.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("boundary=")) {
                String value = trimmed.substring("boundary=".length()).trim();
                if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                    value = value.substring(1, value.length() - 1);
                }
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    private static Map<String, String> parseHeaders(String block) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String line : block.split("\r\n")) {
            int colon = line.indexOf(':');
            if (colon > 0) {
                out.put(line.substring(0, colon).trim().toLowerCase(Locale.ROOT), line.substring(colon + 1).trim());
            }
        }
        return out;
    }

    private static boolean startsWith(byte[] data, int offset, byte[] prefix) {
        if (offset + prefix.length > data.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[offset + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static int indexOf(byte[] data, byte[] pattern, int from) {
        for (int i = Math.max(0, from); i <= data.length - pattern.length; i++) {
            if (startsWith(data, i, pattern)) {
                return i;
            }
        }
        return -1;
    }

    record Part(String name, String filename, String contentType, byte[] bytes) {
    }
}
