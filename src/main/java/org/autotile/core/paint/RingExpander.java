package org.autotile.core.paint;

import org.autotile.core.catalog.TileCatalog;
import org.autotile.core.map.TileMap;
import org.autotile.core.model.Position;
import org.autotile.core.topology.NeighborModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Breadth-first search outward from a painted region that assigns bridging colors to the
 * surrounding cells whose current color is more than one transition away.
 *
 * Every frontier cell remembers the colors of the cells that reached it (the painted color for
 * the first ring). A cell is bridged from the remembered color closest to its own dominant color,
 * so branches heading into different terrains keep their own chain of intermediates.
 */
public class RingExpander {

    private static final Logger log = LoggerFactory.getLogger(RingExpander.class);

    private final TileMap map;
    private final TileCatalog catalog;

    public RingExpander(TileMap map, TileCatalog catalog) {
        this.map = map;
        this.catalog = catalog;
    }

    /**
     * @return bridging color per cell, in discovery order; empty when every neighboring
     * terrain is directly reachable (or not reachable at all)
     */
    public Map<Position, Integer> computeRings(Set<Position> positions, int color) {
        Map<Position, Integer> intermediates = new LinkedHashMap<>();
        Set<Position> visited = new HashSet<>(positions);

        TreeMap<Position, TreeSet<Integer>> frontier = new TreeMap<>(Position.ROW_MAJOR);
        for (Position p : positions) {
            for (Position nb : NeighborModel.neighbors(p)) {
                if (!visited.contains(nb)) {
                    frontier.computeIfAbsent(nb, k -> new TreeSet<>()).add(color);
                }
            }
        }

        int rings = 0;
        while (!frontier.isEmpty()) {
            TreeMap<Position, TreeSet<Integer>> next = new TreeMap<>(Position.ROW_MAJOR);
            boolean placed = false;

            for (Map.Entry<Position, TreeSet<Integer>> e : frontier.entrySet()) {
                Position pos = e.getKey();
                if (!visited.add(pos)) continue;

                int existing = CellColors.dominant(map, catalog, pos);
                if (existing == 0) continue;

                int from = closestFrom(e.getValue(), existing);
                if (existing == from) continue;

                int distance = catalog.distance(from, existing);
                if (distance == TileCatalog.UNREACHABLE) {
                    // no chain of transition tiles; the boundary stays as it is
                    continue;
                }
                if (distance <= 1) continue;

                int hop = nextColorOnPath(from, existing);
                if (hop == 0) continue;

                intermediates.put(pos, hop);
                placed = true;

                for (Position nb : NeighborModel.neighbors(pos)) {
                    if (!visited.contains(nb)) {
                        next.computeIfAbsent(nb, k -> new TreeSet<>()).add(hop);
                    }
                }
            }

            if (placed) rings++;
            frontier = next;
        }

        if (!intermediates.isEmpty()) {
            log.debug("Bridged color {}: {} ring(s), {} intermediate cell(s)", color, rings, intermediates.size());
        }
        return intermediates;
    }

    /**
     * First hop on a shortest path: the lowest color c != from with distance(from, c) == 1
     * minimizing distance(c, to). 0 if there is none or from and to are already adjacent.
     */
    public int nextColorOnPath(int from, int to) {
        int direct = catalog.distance(from, to);
        if (direct != TileCatalog.UNREACHABLE && direct <= 1) return 0;

        int best = 0;
        int bestRemaining = Integer.MAX_VALUE;
        for (int c = 1; c <= catalog.colorCount(); c++) {
            if (c == from) continue;
            if (catalog.distance(from, c) != 1) continue;

            int remaining = catalog.distance(c, to);
            if (remaining == TileCatalog.UNREACHABLE) continue;
            if (remaining < bestRemaining) {
                best = c;
                bestRemaining = remaining;
            }
        }
        return best;
    }

    private int closestFrom(TreeSet<Integer> candidates, int existing) {
        int best = candidates.first();
        int bestDistance = Integer.MAX_VALUE;
        for (int c : candidates) {
            int d = catalog.distance(c, existing);
            if (d == TileCatalog.UNREACHABLE) continue;
            if (d < bestDistance) {
                best = c;
                bestDistance = d;
            }
        }
        return best;
    }
}
