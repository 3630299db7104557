package org.autotile.core.matching;

import org.autotile.core.catalog.TileCatalog;
import org.autotile.core.model.ColorVector;
import org.autotile.core.model.Direction;
import org.autotile.core.model.TileVariant;

import java.util.Objects;
import java.util.Random;

/**
 * Constrained nearest-match search over a catalog's variants.
 *
 * <ul>
 *   <li>Slots set in the mask must match the desired colors exactly.</li>
 *   <li>Unmasked slots where the desired color is nonzero and differs cost
 *       distance(desired, candidate); an unreachable pair rejects the candidate.</li>
 *   <li>Among the lowest-cost candidates one is drawn by variant probability.</li>
 * </ul>
 */
public class TileMatcher {

    private final TileCatalog catalog;
    private final Random rng;

    public TileMatcher(TileCatalog catalog, Random rng) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.rng = Objects.requireNonNull(rng, "rng");
    }

    /** Best variant for the desired colors, or null when nothing is eligible. */
    public TileVariant bestMatch(ColorVector desired, ColorVector mask) {
        long m = mask.value();
        long want = desired.value() & m;

        int lowestPenalty = Integer.MAX_VALUE;
        WeightedPicker<TileVariant> candidates = new WeightedPicker<>();

        for (TileVariant v : catalog.variants()) {
            if ((v.colors.value() & m) != want) continue;

            int penalty = penalty(desired, mask, v.colors);
            if (penalty < 0) continue;

            if (penalty < lowestPenalty) {
                candidates.clear();
                lowestPenalty = penalty;
            }
            if (penalty == lowestPenalty) {
                candidates.add(v, catalog.probability(v));
            }
        }

        return candidates.pick(rng);
    }

    /** Soft cost over the unmasked slots, -1 if any of them needs an unreachable transition. */
    int penalty(ColorVector desired, ColorVector mask, ColorVector candidate) {
        int total = 0;
        for (int i = 0; i < Direction.COUNT; i++) {
            if (mask.isMasked(i)) continue;
            int d = desired.colorAt(i);
            int c = candidate.colorAt(i);
            if (d == 0 || d == c) continue;

            int dist = catalog.distance(d, c);
            if (dist == TileCatalog.UNREACHABLE) return -1;
            total += dist;
        }
        return total;
    }
}
