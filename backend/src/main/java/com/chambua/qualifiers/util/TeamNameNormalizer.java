package com.chambua.qualifiers.util;

import java.util.Locale;

public class TeamNameNormalizer {

    // Display form: trimmed, inner whitespace collapsed, case preserved
    public static String clean(String name) {
        if (name == null) return null;
        return name.trim().replaceAll("\\s+", " ");
    }

    // Comparison form used for natural keys and content hashes
    public static String key(String name) {
        if (name == null) return "";
        return clean(name).toLowerCase(Locale.ROOT);
    }
}
