package org.autotile.core.paint;

import org.autotile.core.catalog.CatalogType;
import org.autotile.core.catalog.TileCatalog;
import org.autotile.core.map.TileMap;
import org.autotile.core.matching.TileMatcher;
import org.autotile.core.model.ColorVector;
import org.autotile.core.model.Direction;
import org.autotile.core.model.Position;
import org.autotile.core.model.TileVariant;
import org.autotile.core.topology.NeighborModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Picks a tile for every cell of a region, inside-out.
 *
 * Painted cells go first, then the rest, each group ordered by Manhattan distance to the
 * centroid of the painted cells, so later cells see as many committed neighbors as possible.
 */
public class RegionResolver {

    private static final Logger log = LoggerFactory.getLogger(RegionResolver.class);

    private final TileMap map;
    private final TileCatalog catalog;
    private final TileMatcher matcher;

    public RegionResolver(TileMap map, TileCatalog catalog, TileMatcher matcher) {
        this.map = map;
        this.catalog = catalog;
        this.matcher = matcher;
    }

    /**
     * Resolves and writes every cell that has a matching tile.
     *
     * @return cells left untouched because no variant fits, in resolve order
     */
    public List<Position> resolve(Collection<Position> cells, Map<Position, Integer> paintColors) {
        List<Position> unmatched = new ArrayList<>();

        for (Position pos : order(cells, paintColors)) {
            ColorVector desired = desiredFromSurroundings(pos);

            Integer paint = paintColors.get(pos);
            if (paint != null) {
                desired = applyPaintColor(desired, paint, catalog.type());
            }

            TileVariant match = matcher.bestMatch(desired, desired.mask());
            if (match != null) {
                map.setCell(pos.x, pos.y, match.tile);
            } else {
                log.debug("No tile for {} desired={}", pos, desired);
                unmatched.add(pos);
            }
        }
        return unmatched;
    }

    List<Position> order(Collection<Position> cells, Map<Position, Integer> paintColors) {
        double cx = 0;
        double cy = 0;
        if (!paintColors.isEmpty()) {
            for (Position p : paintColors.keySet()) {
                cx += p.x;
                cy += p.y;
            }
            cx /= paintColors.size();
            cy /= paintColors.size();
        }
        final double centerX = cx;
        final double centerY = cy;

        List<Position> ordered = new ArrayList<>(cells);
        ordered.sort(Comparator
                .comparingInt((Position p) -> paintColors.containsKey(p) ? 0 : 1)
                .thenComparingDouble(p -> p.manhattan(centerX, centerY))
                .thenComparing(Position.ROW_MAJOR));
        return ordered;
    }

    /** Colors this cell must share with its already placed neighbors. */
    ColorVector desiredFromSurroundings(Position pos) {
        ColorVector desired = ColorVector.EMPTY;
        for (int i = 0; i < Direction.COUNT; i++) {
            ColorVector nb = CellColors.of(map, catalog, NeighborModel.neighbor(pos, i));
            if (nb == null) continue;
            desired = desired.withColor(i, nb.colorAt(NeighborModel.opposite(i)));
        }
        return desired;
    }

    static ColorVector applyPaintColor(ColorVector desired, int color, CatalogType type) {
        ColorVector result = desired;
        for (int i : type.activeSlots()) {
            result = result.withColor(i, color);
        }
        return result;
    }
}
