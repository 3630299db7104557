package org.autotile.core.model.config;

public class PaintSettings {

    public static final int DEFAULT_MAX_FILL_CELLS = 65_536;

    /** Seed of the tie-break RNG; same seed + same map = same result. */
    public long seed;

    /** Count seam mismatches in the painted footprint after resolving (diagnostic only). */
    public boolean validateSeams = false;

    /** Upper bound on cells collected by a flood fill. */
    public int maxFillCells = DEFAULT_MAX_FILL_CELLS;

    public PaintSettings(long seed) {
        this.seed = seed;
    }

    public void applyOverridesFromSystem() {
        String seedProp = pick(
                System.getProperty("autotile.seed"),
                System.getenv("AUTOTILE_SEED")
        );
        if (seedProp != null) {
            try {
                seed = Long.parseLong(seedProp);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("autotile.seed is not a number: " + seedProp, e);
            }
        }
    }

    private static String pick(String... values) {
        if (values == null) return null;
        for (String value : values) {
            if (value != null) {
                String trimmed = value.trim();
                if (!trimmed.isEmpty()) {
                    return trimmed;
                }
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "PaintSettings{seed=" + seed
                + ", validateSeams=" + validateSeams
                + ", maxFillCells=" + maxFillCells + "}";
    }
}
