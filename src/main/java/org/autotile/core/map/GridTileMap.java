package org.autotile.core.map;

import org.autotile.core.model.TileRef;

import java.util.Arrays;

/**
 * Row-major in-memory map. Reads outside the grid return null, writes outside are dropped.
 */
public class GridTileMap implements TileMap {

    private final int width;
    private final int height;
    private final TileRef[] cells;

    public GridTileMap(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Map size must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.cells = new TileRef[width * height];
    }

    public static GridTileMap filled(int width, int height, TileRef tile) {
        GridTileMap map = new GridTileMap(width, height);
        Arrays.fill(map.cells, tile);
        return map;
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public TileRef cellAt(int x, int y) {
        if (!inBounds(x, y)) return null;
        return cells[y * width + x];
    }

    @Override
    public void setCell(int x, int y, TileRef tile) {
        if (!inBounds(x, y)) return;
        cells[y * width + x] = tile;
    }

    public GridTileMap copy() {
        GridTileMap out = new GridTileMap(width, height);
        System.arraycopy(cells, 0, out.cells, 0, cells.length);
        return out;
    }

    public boolean sameCells(GridTileMap other) {
        return other != null
                && width == other.width
                && height == other.height
                && Arrays.equals(cells, other.cells);
    }
}
