package org.autotile.core.matching;

import org.autotile.core.catalog.CatalogType;
import org.autotile.core.catalog.SimpleTileCatalog;
import org.autotile.core.catalog.TestCatalogs;
import org.autotile.core.model.ColorVector;
import org.autotile.core.model.Direction;
import org.autotile.core.model.TileRef;
import org.autotile.core.model.TileVariant;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;

import static org.autotile.core.catalog.TestCatalogs.*;
import static org.junit.jupiter.api.Assertions.*;

class TileMatcherTest {

    @Test
    void testExactMatch() {
        var catalog = terrain();
        var matcher = new TileMatcher(catalog, new Random(1));
        var desired = ColorVector.of(0, GRASS, 0, DIRT, 0, DIRT, 0, GRASS);

        TileVariant v = matcher.bestMatch(desired, desired.mask());
        assertNotNull(v);
        assertEquals(desired, v.colors);
    }

    @Test
    void testNoEligibleCandidate() {
        var catalog = terrain();
        var matcher = new TileMatcher(catalog, new Random(1));
        // no tile carries Dirt and Sand together
        var desired = ColorVector.of(0, DIRT, 0, SAND, 0, SAND, 0, SAND);
        assertNull(matcher.bestMatch(desired, desired.mask()));
    }

    @Test
    void testSoftCostPrefersNearestColor() {
        var catalog = terrain();
        var matcher = new TileMatcher(catalog, new Random(1));
        // top-right wants Sand but is not a hard constraint; only Grass/Dirt candidates fit the rest
        var desired = ColorVector.of(0, SAND, 0, DIRT, 0, DIRT, 0, DIRT);
        var mask = ColorVector.of(0, 0, 0, 1, 0, 1, 0, 1).mask();

        TileVariant v = matcher.bestMatch(desired, mask);
        assertNotNull(v);
        assertEquals(GRASS, v.colors.colorAt(Direction.TOP_RIGHT), "distance(Sand, Grass)=1 beats distance(Sand, Dirt)=2");
        assertEquals(DIRT, v.colors.colorAt(Direction.BOTTOM_RIGHT));
    }

    @Test
    void testUnreachableSoftSlotRejectsCandidates() {
        var catalog = terrainWithWater();
        var matcher = new TileMatcher(catalog, new Random(1));
        var desired = ColorVector.of(0, WATER, 0, GRASS, 0, GRASS, 0, GRASS);
        var mask = ColorVector.of(0, 0, 0, 1, 0, 1, 0, 1).mask();

        assertNull(matcher.bestMatch(desired, mask));
    }

    @Test
    void testEmptyMaskAcceptsAnything() {
        var catalog = terrain();
        var matcher = new TileMatcher(catalog, new Random(3));
        assertNotNull(matcher.bestMatch(ColorVector.EMPTY, ColorVector.EMPTY));
    }

    @Test
    void testMaskedSlotsAlwaysMatch() {
        var catalog = terrainWithWater();
        var matcher = new TileMatcher(catalog, new Random(7));
        var gen = new Random(99);

        for (int n = 0; n < 500; n++) {
            int[] slots = new int[Direction.COUNT];
            for (int i = 1; i < Direction.COUNT; i += 2) {
                slots[i] = gen.nextInt(catalog.colorCount() + 1);
            }
            var desired = ColorVector.of(slots);
            var mask = ColorVector.EMPTY;
            for (int i = 0; i < Direction.COUNT; i++) {
                if (gen.nextBoolean()) mask = mask.withColor(i, 0xFF);
            }

            TileVariant v = matcher.bestMatch(desired, mask);
            if (v != null) {
                assertEquals(desired.and(mask), v.colors.and(mask), "desired=" + desired + " mask=" + mask);
            }
        }
    }

    @Test
    void testTieBreakUsesProbability() {
        var catalog = new SimpleTileCatalog(CatalogType.CORNER, new int[][]{{0, 0}, {0, 0}});
        var builder = new TestCatalogs.Builder(catalog);
        TileRef heavy = builder.addDuplicate(ColorVector.allCorners(1));
        TileRef never = builder.addDuplicate(ColorVector.allCorners(1));
        catalog.setTileProbability(heavy.tileId, 1.0);
        catalog.setTileProbability(never.tileId, 0.0);

        var matcher = new TileMatcher(catalog, new Random(5));
        var desired = ColorVector.allCorners(1);
        for (int i = 0; i < 100; i++) {
            assertEquals(heavy, matcher.bestMatch(desired, desired.mask()).tile);
        }
    }

    @Test
    void testTieBreakDrawsAllEqualWeights() {
        var catalog = new SimpleTileCatalog(CatalogType.CORNER, new int[][]{{0, 0}, {0, 0}});
        var builder = new TestCatalogs.Builder(catalog);
        builder.addDuplicate(ColorVector.allCorners(1));
        builder.addDuplicate(ColorVector.allCorners(1));
        builder.addDuplicate(ColorVector.allCorners(1));

        var matcher = new TileMatcher(catalog, new Random(11));
        var desired = ColorVector.allCorners(1);
        var seen = new HashSet<TileRef>();
        for (int i = 0; i < 300; i++) {
            seen.add(matcher.bestMatch(desired, desired.mask()).tile);
        }
        assertEquals(3, seen.size());
    }

    @Test
    void testZeroWeightsReturnLastCandidate() {
        var catalog = new SimpleTileCatalog(CatalogType.CORNER, new int[][]{{0, 0}, {0, 0}});
        catalog.setColorProbability(1, 0.0);
        var builder = new TestCatalogs.Builder(catalog);
        builder.addDuplicate(ColorVector.allCorners(1));
        TileRef last = builder.addDuplicate(ColorVector.allCorners(1));

        var matcher = new TileMatcher(catalog, new Random(5));
        var desired = ColorVector.allCorners(1);
        assertEquals(last, matcher.bestMatch(desired, desired.mask()).tile);
    }
}
