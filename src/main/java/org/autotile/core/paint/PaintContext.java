package org.autotile.core.paint;

import org.autotile.core.catalog.TileCatalog;
import org.autotile.core.map.TileMap;
import org.autotile.core.model.Position;
import org.autotile.core.model.config.PaintSettings;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * State of one paint call, shared by the stages.
 */
public class PaintContext {

    public final TileMap map;
    public final TileCatalog catalog;
    public final PaintSettings settings;

    /** Tie-break RNG for the matcher. */
    public final Random rng;

    /** Cells the user painted. */
    public final Set<Position> positions;
    public final int color;

    /** Position -> wanted color: user cells plus bridging rings. Filled by the RINGS stage. */
    public final Map<Position, Integer> paintColors = new LinkedHashMap<>();

    /** Number of bridging cells merged into {@link #paintColors}. */
    public int intermediateCount;

    /** Cells to re-resolve. Filled by the FOOTPRINT stage. */
    public final Set<Position> affected = new LinkedHashSet<>();

    public final PaintReport report = new PaintReport();

    public PaintContext(TileMap map, TileCatalog catalog, PaintSettings settings, Random rng,
                        Set<Position> positions, int color) {
        this.map = map;
        this.catalog = catalog;
        this.settings = settings;
        this.rng = rng;
        this.positions = positions;
        this.color = color;
    }
}
