package org.autotile.core.paint;

import org.autotile.core.catalog.TileCatalog;
import org.autotile.core.map.TileMap;
import org.autotile.core.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 4-connected region of cells sharing the start cell's dominant color.
 */
public final class FloodFill {

    private static final Logger log = LoggerFactory.getLogger(FloodFill.class);

    private static final int[][] FOUR_DIRECTIONS = {
            {0, -1}, {1, 0}, {0, 1}, {-1, 0}
    };

    private FloodFill() {
    }

    /**
     * @return the connected cells in BFS order; empty if the start cell has no color.
     * Stops collecting at {@code maxCells}.
     */
    public static Set<Position> collect(TileMap map, TileCatalog catalog, Position start, int maxCells) {
        Set<Position> filled = new LinkedHashSet<>();
        int target = CellColors.dominant(map, catalog, start);
        if (target == 0) return filled;

        ArrayDeque<Position> queue = new ArrayDeque<>();
        Set<Position> seen = new HashSet<>();
        queue.add(start);
        seen.add(start);

        while (!queue.isEmpty()) {
            if (filled.size() >= maxCells) {
                log.warn("Flood fill from {} stopped at {} cell(s)", start, maxCells);
                break;
            }
            Position p = queue.poll();
            filled.add(p);

            for (int[] d : FOUR_DIRECTIONS) {
                Position nb = p.offset(d[0], d[1]);
                if (!seen.add(nb)) continue;
                if (CellColors.dominant(map, catalog, nb) == target) {
                    queue.add(nb);
                }
            }
        }
        return filled;
    }
}
