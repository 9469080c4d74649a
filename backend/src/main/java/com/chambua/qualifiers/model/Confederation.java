package com.chambua.qualifiers.model;

import java.util.Locale;

public enum Confederation {
    UEFA, CAF, AFC, CONMEBOL, CONCACAF, OFC;

    /**
     * Resolves a confederation from a loosely formatted label ("uefa", " CONCACAF ").
     *
     * @throws IllegalArgumentException when the label is blank or not one of the six confederations
     */
    public static Confederation fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Confederation is required");
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (Confederation c : values()) {
            if (c.name().equals(normalized)) return c;
        }
        throw new IllegalArgumentException("Unknown confederation: " + label);
    }
}
