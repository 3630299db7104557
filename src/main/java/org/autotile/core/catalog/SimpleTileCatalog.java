package org.autotile.core.catalog;

import org.autotile.core.model.ColorVector;
import org.autotile.core.model.Direction;
import org.autotile.core.model.TileRef;
import org.autotile.core.model.TileVariant;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory catalog over pre-baked data.
 *
 * distances: (colorCount + 1) x (colorCount + 1), index 0 unused, -1 = unreachable.
 * Variant weight = product of the color probabilities of its nonzero slots x tile probability.
 */
public class SimpleTileCatalog implements TileCatalog {

    private final CatalogType type;
    private final int[][] distances;
    private final double[] colorProbability;
    private final List<TileVariant> variants = new ArrayList<>();
    private final Map<TileRef, ColorVector> byTile = new HashMap<>();
    private final Map<Integer, Double> tileProbability = new HashMap<>();

    public SimpleTileCatalog(CatalogType type, int[][] distances) {
        this.type = type;
        this.distances = copy(distances);
        this.colorProbability = new double[this.distances.length];
        Arrays.fill(colorProbability, 1.0);
    }

    public SimpleTileCatalog addVariant(ColorVector colors, TileRef tile) {
        TileVariant v = new TileVariant(colors, tile);
        variants.add(v);
        byTile.put(tile, colors);
        return this;
    }

    public SimpleTileCatalog setColorProbability(int color, double probability) {
        if (color < 1 || color >= colorProbability.length) {
            throw new IllegalArgumentException("Unknown color: " + color);
        }
        colorProbability[color] = probability;
        return this;
    }

    public SimpleTileCatalog setTileProbability(int tileId, double probability) {
        tileProbability.put(tileId, probability);
        return this;
    }

    @Override
    public List<TileVariant> variants() {
        return Collections.unmodifiableList(variants);
    }

    @Override
    public ColorVector colorVectorOf(TileRef tile) {
        if (tile == null) return null;
        return byTile.get(tile);
    }

    @Override
    public int distance(int a, int b) {
        if (a == b) return 0;
        if (a <= 0 || b <= 0) return 0;
        if (a >= distances.length || b >= distances.length) return UNREACHABLE;
        int d = distances[a][b];
        return d < 0 ? UNREACHABLE : d;
    }

    @Override
    public int colorCount() {
        return distances.length - 1;
    }

    @Override
    public double probability(TileVariant variant) {
        double p = 1.0;
        for (int i = 0; i < Direction.COUNT; i++) {
            int c = variant.colors.colorAt(i);
            if (c > 0 && c < colorProbability.length) {
                p *= colorProbability[c];
            }
        }
        return p * tileProbability.getOrDefault(variant.tile.tileId, 1.0);
    }

    @Override
    public CatalogType type() {
        return type;
    }

    private static int[][] copy(int[][] m) {
        if (m == null || m.length < 2) {
            throw new IllegalArgumentException("Distance matrix needs at least one color (size >= 2)");
        }
        int[][] out = new int[m.length][];
        for (int i = 0; i < m.length; i++) {
            if (m[i].length != m.length) {
                throw new IllegalArgumentException("Distance matrix must be square, row " + i + " has " + m[i].length);
            }
            out[i] = m[i].clone();
        }
        return out;
    }
}
