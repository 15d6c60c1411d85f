package io.gearledger.util;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes {@code Content-Disposition} header values. Parameter values may be
 * quoted strings (with backslash escapes) or RFC 5987 extended values such as
 * {@code filename*=UTF-8''%D0%9F.xlsx}.
 */
public final class ContentDisposition {
    private static final String ATTR_CHARS = "!#$&+-.^_`|~";

    private ContentDisposition() {
    }

    /** Header value for an attachment: an ASCII {@code filename} plus the UTF-8 {@code filename*}. */
    public static String attachment(String filename) {
        return "attachment; filename=\"" + asciiFallback(filename) + "\"; filename*=UTF-8''" + encodeExtended(filename);
    }

    /** Filename from {@code disposition}, preferring {@code filename*}; null when neither is present. */
    public static String filename(String disposition) {
        Map<String, String> params = parameters(disposition);
        String extended = params.get("filename*");
        if (extended != null) {
            String decoded = decodeExtended(extended);
            if (decoded != null) {
                return decoded;
            }
        }
        return params.get("filename");
    }

    /**
     * Parameters after the disposition type, keyed by lower-cased name. Semicolons
     * inside quoted strings do not split parameters.
     */
    public static Map<String, String> parameters(String disposition) {
        Map<String, String> out = new LinkedHashMap<>();
        if (disposition == null) {
            return out;
        }
        int i = disposition.indexOf(';');
        int n = disposition.length();
        while (i >= 0 && i < n) {
            i++;
            while (i < n && Character.isWhitespace(disposition.charAt(i))) {
                i++;
            }
            int nameStart = i;
            while (i < n && disposition.charAt(i) != '=' && disposition.charAt(i) != ';') {
                i++;
            }
            String name = disposition.substring(nameStart, i).trim().toLowerCase(Locale.ROOT);
            if (i >= n || disposition.charAt(i) == ';') {
                continue;
            }
            i++;
            while (i < n && Character.isWhitespace(disposition.charAt(i))) {
                i++;
            }
            StringBuilder value = new StringBuilder();
            if (i < n && disposition.charAt(i) == '"') {
                i++;
                while (i < n && disposition.charAt(i) != '"') {
                    char ch = disposition.charAt(i);
                    if (ch == '\\' && i + 1 < n) {
                        ch = disposition.charAt(++i);
                    }
                    value.append(ch);
                    i++;
                }
                i++;
                while (i < n && disposition.charAt(i) != ';') {
                    i++;
                }
            } else {
                while (i < n && disposition.charAt(i) != ';') {
                    value.append(disposition.charAt(i));
                    i++;
                }
            }
            if (!name.isEmpty() && !out.containsKey(name)) {
                out.put(name, name.endsWith("*") ? value.toString().trim() : value.toString());
            }
        }
        return out;
    }

    static String asciiFallback(String filename) {
        StringBuilder out = new StringBuilder(filename.length());
        for (int i = 0; i < filename.length(); i++) {
            char ch = filename.charAt(i);
            if (ch == '"' || ch == '\\' || ch < 0x20 || ch > 0x7e) {
                out.append('_');
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }

    static String encodeExtended(String value) {
        StringBuilder out = new StringBuilder();
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xff;
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || ATTR_CHARS.indexOf(c) >= 0) {
                out.append((char) c);
            } else {
                out.append('%').append(Character.toUpperCase(Character.forDigit(c >> 4, 16)))
                        .append(Character.toUpperCase(Character.forDigit(c & 0xf, 16)));
            }
        }
        return out.toString();
    }

    /** Decodes {@code charset'language'percent-encoded}; null when malformed. */
    static String decodeExtended(String value) {
        int first = value.indexOf('\'');
        int second = first < 0 ? -1 : value.indexOf('\'', first + 1);
        if (second < 0) {
            return null;
        }
        Charset charset;
        try {
            charset = Charset.forName(value.substring(0, first).trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
        String encoded = value.substring(second + 1);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(encoded.length());
        for (int i = 0; i < encoded.length(); i++) {
            char ch = encoded.charAt(i);
            if (ch == '%') {
                if (i + 2 >= encoded.length()) {
                    return null;
                }
                int hi = Character.digit(encoded.charAt(i + 1), 16);
                int lo = Character.digit(encoded.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) {
                    return null;
                }
                bytes.write((hi << 4) | lo);
                i += 2;
            } else {
                bytes.write(ch);
            }
        }
        return bytes.toString(charset);
    }
}
