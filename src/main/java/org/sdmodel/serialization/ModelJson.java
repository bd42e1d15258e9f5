package org.sdmodel.serialization;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Zero-dependency JSON reader and writer for the documents exchanged with collaborators
 * (connections, loops, edit-operation lists).
 *
 * Objects read as {@link LinkedHashMap} (key order kept), arrays as {@link List},
 * integral numbers as {@link Long}, others as {@link Double}.
 */
public final class ModelJson {

    private ModelJson() {
    }

    // ========== READING ==========

    /**
     * Parse a JSON document into maps, lists, strings, numbers, booleans and nulls.
     *
     * @throws JsonFormatException when the text is not well-formed JSON
     */
    public static Object parse(String json) {
        if (json == null || json.isBlank()) {
            throw new JsonFormatException("Empty JSON document", 0);
        }
        Reader reader = new Reader(json);
        Object value = reader.readValue();
        reader.skipWhitespace();
        if (!reader.atEnd()) {
            throw new JsonFormatException("Unexpected trailing content", reader.pos);
        }
        return value;
    }

    // ========== WRITING ==========

    /**
     * Compact JSON.
     */
    public static String write(Object value) {
        StringBuilder sb = new StringBuilder();
        writeValue(sb, value, -1, 0);
        return sb.toString();
    }

    /**
     * JSON indented by two spaces per level.
     */
    public static String writePretty(Object value) {
        StringBuilder sb = new StringBuilder();
        writeValue(sb, value, 2, 0);
        return sb.toString();
    }

    private static void writeValue(StringBuilder sb, Object value, int indent, int depth) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            writeString(sb, s);
        } else if (value instanceof Number n) {
            sb.append(n);
        } else if (value instanceof Boolean b) {
            sb.append(b ? "true" : "false");
        } else if (value instanceof Map<?, ?> m) {
            writeObject(sb, m, indent, depth);
        } else if (value instanceof List<?> l) {
            writeArray(sb, l, indent, depth);
        } else {
            writeString(sb, value.toString());
        }
    }

    private static void writeObject(StringBuilder sb, Map<?, ?> map, int indent, int depth) {
        if (map.isEmpty()) {
            sb.append("{}");
            return;
        }
        sb.append('{');
        boolean first = true;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            newline(sb, indent, depth + 1);
            writeString(sb, String.valueOf(entry.getKey()));
            sb.append(indent < 0 ? ":" : ": ");
            writeValue(sb, entry.getValue(), indent, depth + 1);
        }
        newline(sb, indent, depth);
        sb.append('}');
    }

    private static void writeArray(StringBuilder sb, List<?> list, int indent, int depth) {
        if (list.isEmpty()) {
            sb.append("[]");
            return;
        }
        sb.append('[');
        boolean first = true;
        for (Object item : list) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            newline(sb, indent, depth + 1);
            writeValue(sb, item, indent, depth + 1);
        }
        newline(sb, indent, depth);
        sb.append(']');
    }

    private static void newline(StringBuilder sb, int indent, int depth) {
        if (indent >= 0) {
            sb.append('\n').append(" ".repeat(indent * depth));
        }
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    // ========== ACCESSORS ==========

    public static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof String s ? s : null;
    }

    public static Integer getInt(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof Number n ? n.intValue() : null;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> getObject(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof List ? (List<Object>) value : null;
    }

    // ========== READER ==========

    private static final class Reader {
        private final String json;
        private int pos;

        Reader(String json) {
            this.json = json;
        }

        boolean atEnd() {
            return pos >= json.length();
        }

        Object readValue() {
            skipWhitespace();
            if (atEnd()) {
                throw new JsonFormatException("Unexpected end of document", pos);
            }
            char c = json.charAt(pos);
            return switch (c) {
                case '{' -> readObject();
                case '[' -> readArray();
                case '"' -> readString();
                case 't' -> readLiteral("true", Boolean.TRUE);
                case 'f' -> readLiteral("false", Boolean.FALSE);
                case 'n' -> readLiteral("null", null);
                default -> readNumber();
            };
        }

        private Map<String, Object> readObject() {
            Map<String, Object> map = new LinkedHashMap<>();
            pos++; // '{'
            skipWhitespace();
            if (peek('}')) {
                pos++;
                return map;
            }
            while (true) {
                skipWhitespace();
                if (!peek('"')) {
                    throw new JsonFormatException("Expected object key", pos);
                }
                String key = readString();
                skipWhitespace();
                expect(':');
                map.put(key, readValue());
                skipWhitespace();
                if (peek(',')) {
                    pos++;
                } else {
                    expect('}');
                    return map;
                }
            }
        }

        private List<Object> readArray() {
            List<Object> list = new ArrayList<>();
            pos++; // '['
            skipWhitespace();
            if (peek(']')) {
                pos++;
                return list;
            }
            while (true) {
                list.add(readValue());
                skipWhitespace();
                if (peek(',')) {
                    pos++;
                } else {
                    expect(']');
                    return list;
                }
            }
        }

        private String readString() {
            pos++; // opening quote
            StringBuilder sb = new StringBuilder();
            while (!atEnd()) {
                char c = json.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (atEnd()) {
                    break;
                }
                char escaped = json.charAt(pos++);
                switch (escaped) {
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> {
                        if (pos + 4 > json.length()) {
                            throw new JsonFormatException("Truncated unicode escape", pos);
                        }
                        sb.append((char) Integer.parseInt(json.substring(pos, pos + 4), 16));
                        pos += 4;
                    }
                    default -> sb.append(escaped);
                }
            }
            throw new JsonFormatException("Unterminated string", pos);
        }

        private Number readNumber() {
            int start = pos;
            if (peek('-')) {
                pos++;
            }
            boolean fractional = false;
            while (!atEnd()) {
                char c = json.charAt(pos);
                if (c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-') {
                    fractional = true;
                } else if (!Character.isDigit(c)) {
                    break;
                }
                pos++;
            }
            String text = json.substring(start, pos);
            try {
                if (fractional) {
                    return Double.parseDouble(text);
                }
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new JsonFormatException("Invalid value '" + text + "'", start);
            }
        }

        private Object readLiteral(String literal, Object value) {
            if (!json.startsWith(literal, pos)) {
                throw new JsonFormatException("Invalid literal", pos);
            }
            pos += literal.length();
            return value;
        }

        private boolean peek(char c) {
            return !atEnd() && json.charAt(pos) == c;
        }

        private void expect(char c) {
            if (!peek(c)) {
                throw new JsonFormatException("Expected '" + c + "'", pos);
            }
            pos++;
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(json.charAt(pos))) {
                pos++;
            }
        }
    }
}
