package org.autotile.core.matching;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Weighted random choice among equally good candidates (cumulative-weight sampling).
 * Zero-weight entries are kept so a set with no positive weight still yields a result.
 */
public class WeightedPicker<T> {

    private final List<T> values = new ArrayList<>();
    private final List<Double> weights = new ArrayList<>();
    private final List<Double> cumulative = new ArrayList<>();
    private double total;

    public void add(T value, double weight) {
        double w = (weight > 0 && !Double.isNaN(weight)) ? weight : 0.0;
        total += w;
        values.add(value);
        weights.add(w);
        cumulative.add(total);
    }

    /**
     * Draws r uniformly in [0, total) and returns the first positive-weight entry whose cumulative
     * weight reaches r. If the total weight is not positive, the last added entry is returned.
     * Null when empty.
     */
    public T pick(Random rng) {
        if (values.isEmpty()) return null;
        if (values.size() == 1) return values.get(0);
        if (total <= 0) return values.get(values.size() - 1);

        double r = rng.nextDouble() * total;
        int lastPositive = -1;
        for (int i = 0; i < values.size(); i++) {
            if (weights.get(i) <= 0) continue;
            lastPositive = i;
            if (r <= cumulative.get(i)) {
                return values.get(i);
            }
        }
        // rounding past the end of the cumulative sums
        return values.get(lastPositive);
    }

    public void clear() {
        values.clear();
        weights.clear();
        cumulative.clear();
        total = 0;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public double totalWeight() {
        return total;
    }
}
