package org.autotile.core.map;

import org.autotile.core.model.TileRef;

/**
 * Host-owned grid. The painter reads cells and writes through {@link #setCell}; it never clamps
 * coordinates, so out-of-range handling is up to the implementation.
 */
public interface TileMap {

    int width();

    int height();

    /** Tile at (x, y), or null when the cell is empty. */
    TileRef cellAt(int x, int y);

    void setCell(int x, int y, TileRef tile);
}
