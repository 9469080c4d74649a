package com.chambua.qualifiers.model;

public record MaterializationCounts(int inserted, int updated) {

    public static MaterializationCounts none() {
        return new MaterializationCounts(0, 0);
    }

    public int total() {
        return inserted + updated;
    }
}
