package org.autotile.core.paint;

import org.autotile.core.catalog.TileCatalog;
import org.autotile.core.map.TileMap;
import org.autotile.core.model.ColorVector;
import org.autotile.core.model.Position;
import org.autotile.core.model.TileRef;

final class CellColors {

    private CellColors() {
    }

    static ColorVector of(TileMap map, TileCatalog catalog, Position pos) {
        TileRef tile = map.cellAt(pos.x, pos.y);
        if (tile == null) return null;
        return catalog.colorVectorOf(tile);
    }

    static int dominant(TileMap map, TileCatalog catalog, Position pos) {
        ColorVector cv = of(map, catalog, pos);
        return cv == null ? 0 : cv.dominantColor();
    }
}
