package org.autotile.core.paint;

import org.autotile.core.catalog.TileCatalog;
import org.autotile.core.map.TileMap;
import org.autotile.core.model.ColorVector;
import org.autotile.core.model.Direction;
import org.autotile.core.model.Position;
import org.autotile.core.topology.NeighborModel;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Counts adjacent placed tiles that disagree on a shared edge/corner color.
 * Slots with 0 on either side are ignored.
 */
public final class SeamCheck {

    private SeamCheck() {
    }

    /** Each mismatching pair touching {@code cells} is counted once. */
    public static int mismatches(TileMap map, TileCatalog catalog, Collection<Position> cells) {
        Set<Position> inside = new HashSet<>(cells);
        int count = 0;

        for (Position p : cells) {
            ColorVector own = CellColors.of(map, catalog, p);
            if (own == null) continue;

            for (int i = 0; i < Direction.COUNT; i++) {
                Position nb = NeighborModel.neighbor(p, i);
                if (inside.contains(nb) && Position.ROW_MAJOR.compare(p, nb) > 0) continue;

                ColorVector other = CellColors.of(map, catalog, nb);
                if (other == null) continue;

                int a = own.colorAt(i);
                int b = other.colorAt(NeighborModel.opposite(i));
                if (a != 0 && b != 0 && a != b) {
                    count++;
                }
            }
        }
        return count;
    }
}
