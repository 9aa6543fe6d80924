package io.ledgerpoller.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat string objects.
 *
 * <p>Accessible via {@link JsonCodec#getDefault()}.
 */
public final class DefaultJsonCodec implements JsonCodec {
    static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

    DefaultJsonCodec() {
    }

    @Override
    public String toJson(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return "{}";
        }
        StringBuilder out = new StringBuilder(values.size() * 32);
        out.append('{');
        String separator = "";
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("JSON object cannot contain null keys");
            }
            out.append(separator);
            separator = ",";
            appendQuoted(out, entry.getKey());
            out.append(':');
            if (entry.getValue() == null) {
                out.append("null");
            } else {
                appendQuoted(out, entry.getValue());
            }
        }
        return out.append('}').toString();
    }

    @Override
    public Map<String, String> parseObject(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        return new ObjectReader(json).readObject();
    }

    private static void appendQuoted(StringBuilder out, String value) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    /** Single-use cursor over one JSON document. */
    private static final class ObjectReader {
        private final String input;
        private int pos;

        ObjectReader(String input) {
            this.input = input;
        }

        Map<String, String> readObject() {
            skipWhitespace();
            expect('{');
            Map<String, String> result = new LinkedHashMap<>();
            skipWhitespace();
            if (peek() == '}') {
                pos++;
                return finish(result);
            }
            while (true) {
                skipWhitespace();
                if (peek() != '"') {
                    throw new IllegalArgumentException("Expected string key at offset " + pos);
                }
                String key = readString();
                skipWhitespace();
                expect(':');
                skipWhitespace();
                if (input.startsWith("null", pos)) {
                    pos += 4;
                } else if (peek() == '"') {
                    result.put(key, readString());
                } else {
                    throw new IllegalArgumentException("Expected string value or null for key " + key);
                }
                skipWhitespace();
                char next = peek();
                pos++;
                if (next == '}') {
                    return finish(result);
                }
                if (next != ',') {
                    throw new IllegalArgumentException("Expected ',' or '}' at offset " + (pos - 1));
                }
            }
        }

        private Map<String, String> finish(Map<String, String> result) {
            skipWhitespace();
            if (pos < input.length()) {
                throw new IllegalArgumentException("Unexpected trailing content at offset " + pos);
            }
            return result;
        }

        private String readString() {
            expect('"');
            StringBuilder sb = new StringBuilder();
            while (pos < input.length()) {
                char c = input.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (pos >= input.length()) {
                    break;
                }
                char escaped = input.charAt(pos++);
                switch (escaped) {
                    case '"', '\\', '/' -> sb.append(escaped);
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> sb.append(readUnicodeEscape());
                    default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
                }
            }
            throw new IllegalArgumentException("Unterminated string");
        }

        private char readUnicodeEscape() {
            if (pos + 4 > input.length()) {
                throw new IllegalArgumentException("Invalid unicode escape");
            }
            String hex = input.substring(pos, pos + 4);
            int value = 0;
            for (int i = 0; i < hex.length(); i++) {
                int digit = hexDigit(hex.charAt(i));
                if (digit < 0) {
                    throw new IllegalArgumentException("Invalid unicode escape: \\u" + hex);
                }
                value = (value << 4) | digit;
            }
            pos += 4;
            return (char) value;
        }

        private static int hexDigit(char c) {
            if (c >= '0' && c <= '9') return c - '0';
            if (c >= 'a' && c <= 'f') return c - 'a' + 10;
            if (c >= 'A' && c <= 'F') return c - 'A' + 10;
            return -1;
        }

        private void expect(char expected) {
            if (peek() != expected) {
                throw new IllegalArgumentException("Expected '" + expected + "' at offset " + pos);
            }
            pos++;
        }

        private char peek() {
            if (pos >= input.length()) {
                throw new IllegalArgumentException("Unexpected end of JSON input");
            }
            return input.charAt(pos);
        }

        private void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }
    }
}
