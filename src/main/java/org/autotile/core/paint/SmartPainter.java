package org.autotile.core.paint;

import org.autotile.core.catalog.TileCatalog;
import org.autotile.core.map.TileMap;
import org.autotile.core.model.Position;
import org.autotile.core.model.config.PaintSettings;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Terrain brush with automatic intermediate colors.
 *
 * Painting Sand next to Dirt when only Sand-Grass and Grass-Dirt transition tiles exist
 * first assigns Grass to the surrounding ring, then lets the matcher place the transitions.
 *
 * <pre>
 * SmartPainter painter = new SmartPainter(new PaintSettings(42L));
 * painter.smartPaint(map, catalog, Set.of(Position.of(4, 4)), SAND);
 * </pre>
 *
 * Not thread-safe: one painter (and its RNG) per editing thread.
 *
 * The RNG is seeded once, when the painter is built, and keeps advancing across calls. Two
 * identical calls on the same painter may break ties differently; for repeatable output build a
 * new painter (same seed) per call.
 */
public class SmartPainter {

    private final PaintSettings settings;
    private final Random rng;
    private final StageListener listener;

    public SmartPainter(PaintSettings settings) {
        this(settings, new Random(settings.seed), new LoggingStageListener());
    }

    public SmartPainter(PaintSettings settings, Random rng, StageListener listener) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.rng = Objects.requireNonNull(rng, "rng");
        this.listener = listener;
    }

    public void smartPaint(TileMap map, TileCatalog catalog, Set<Position> positions, int color) {
        paint(map, catalog, positions, color);
    }

    /** Same as {@link #smartPaint}, returning what happened. */
    public PaintReport paint(TileMap map, TileCatalog catalog, Set<Position> positions, int color) {
        Objects.requireNonNull(map, "map");
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(positions, "positions");
        if (color <= 0) {
            throw new IllegalArgumentException("Paint color must be positive: " + color);
        }
        if (positions.isEmpty()) {
            return new PaintReport();
        }

        Set<Position> cells = Collections.unmodifiableSet(new LinkedHashSet<>(positions));
        PaintContext ctx = new PaintContext(map, catalog, settings, rng, cells, color);
        return new PaintPipeline(settings.validateSeams, listener).run(ctx);
    }

    /**
     * Repaints the 4-connected area of the start cell's color. No-op when the start cell has no
     * color or already has {@code color}.
     */
    public PaintReport floodFill(TileMap map, TileCatalog catalog, int x, int y, int color) {
        Objects.requireNonNull(map, "map");
        Objects.requireNonNull(catalog, "catalog");
        Position start = Position.of(x, y);

        int current = CellColors.dominant(map, catalog, start);
        if (current == 0 || current == color) {
            return new PaintReport();
        }

        Set<Position> region = FloodFill.collect(map, catalog, start, settings.maxFillCells);
        return paint(map, catalog, region, color);
    }
}
