package org.sdmodel.mdl;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one sketch or equation line into comma-separated fields.
 *
 * Double-quoted spans are atomic: commas inside them do not split, and a doubled
 * quote ({@code ""}) inside a quoted span stands for one literal quote.
 * Never throws; a short or empty result means the line is malformed and the caller
 * decides what to do with it.
 */
public final class FieldSplitter {

    private FieldSplitter() {
    }

    /**
     * Split a line into decoded fields (quote delimiters stripped, {@code ""} resolved).
     */
    public static List<String> split(String line) {
        List<String> fields = new ArrayList<>();
        if (line == null || line.isEmpty()) {
            return fields;
        }

        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        int pos = 0;
        int len = line.length();

        while (pos < len) {
            char ch = line.charAt(pos);
            if (inQuotes) {
                if (ch == '"') {
                    if (pos + 1 < len && line.charAt(pos + 1) == '"') {
                        current.append('"'); // escaped quote
                        pos += 2;
                        continue;
                    }
                    inQuotes = false;
                } else {
                    current.append(ch);
                }
            } else if (ch == '"') {
                inQuotes = true;
            } else if (ch == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(ch);
            }
            pos++;
        }
        fields.add(current.toString());
        return fields;
    }

    /**
     * Split a line into raw segments, quotes and escapes left intact.
     * {@code String.join(",", splitRaw(line))} reproduces the line exactly.
     */
    public static List<String> splitRaw(String line) {
        List<String> segments = new ArrayList<>();
        if (line == null) {
            return segments;
        }

        boolean inQuotes = false;
        int start = 0;
        for (int pos = 0; pos < line.length(); pos++) {
            char ch = line.charAt(pos);
            if (ch == '"') {
                // "" inside quotes toggles twice, which leaves the state unchanged
                inQuotes = !inQuotes;
            } else if (ch == ',' && !inQuotes) {
                segments.add(line.substring(start, pos));
                start = pos + 1;
            }
        }
        segments.add(line.substring(start));
        return segments;
    }

    /**
     * Index of the first {@code target} character that is not inside a quoted span, or -1.
     */
    public static int indexOfUnquoted(String line, char target) {
        boolean inQuotes = false;
        for (int pos = 0; pos < line.length(); pos++) {
            char ch = line.charAt(pos);
            if (ch == '"') {
                inQuotes = !inQuotes;
            } else if (ch == target && !inQuotes) {
                return pos;
            }
        }
        return -1;
    }

    /**
     * Strip one layer of surrounding quotes and resolve {@code ""} escapes.
     */
    public static String unquote(String text) {
        String s = text.strip();
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
            return s.substring(1, s.length() - 1).replace("\"\"", "\"");
        }
        return s;
    }

    /**
     * Quote a variable name when it would otherwise not survive field splitting.
     */
    public static String quoteIfNeeded(String name) {
        boolean needsQuotes = !name.equals(name.strip());
        for (int i = 0; i < name.length() && !needsQuotes; i++) {
            char c = name.charAt(i);
            needsQuotes = c == ',' || c == '(' || c == ')' || c == '|' || c == '"';
        }
        if (needsQuotes) {
            return '"' + name.replace("\"", "\"\"") + '"';
        }
        return name;
    }
}
