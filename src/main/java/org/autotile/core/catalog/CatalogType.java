package org.autotile.core.catalog;

public enum CatalogType {
    CORNER(1, 3, 5, 7),
    EDGE(0, 2, 4, 6),
    MIXED(0, 1, 2, 3, 4, 5, 6, 7);

    private final int[] activeSlots;

    CatalogType(int... activeSlots) {
        this.activeSlots = activeSlots;
    }

    /** Slots that carry color for this catalog type (a fresh copy). */
    public int[] activeSlots() {
        return activeSlots.clone();
    }

    public static CatalogType parse(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("Catalog type is blank");
        }
        return valueOf(s.trim().toUpperCase());
    }
}
