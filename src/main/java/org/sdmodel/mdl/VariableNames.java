package org.sdmodel.mdl;

import java.util.Locale;

/**
 * Vensim compares variable names ignoring case, treating underscores as spaces and
 * collapsing runs of whitespace. Lookups by name go through {@link #canonical(String)}.
 */
public final class VariableNames {

    private VariableNames() {
    }

    public static String canonical(String name) {
        if (name == null) {
            return "";
        }
        return name.replace('_', ' ')
                .strip()
                .replaceAll("\\s+", " ")
                .toLowerCase(Locale.ROOT);
    }

    public static boolean same(String a, String b) {
        return canonical(a).equals(canonical(b));
    }
}
