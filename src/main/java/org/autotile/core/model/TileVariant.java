package org.autotile.core.model;

import java.util.Objects;

/**
 * One placeable orientation of a tile with its colors.
 * Rotated/reflected duplicates are separate variants sharing a tile id.
 */
public final class TileVariant {

    public final ColorVector colors;
    public final TileRef tile;

    public TileVariant(ColorVector colors, TileRef tile) {
        this.colors = Objects.requireNonNull(colors, "colors");
        this.tile = Objects.requireNonNull(tile, "tile");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TileVariant)) return false;
        TileVariant other = (TileVariant) o;
        return colors.equals(other.colors) && tile.equals(other.tile);
    }

    @Override
    public int hashCode() {
        return 31 * colors.hashCode() + tile.hashCode();
    }

    @Override
    public String toString() {
        return "TileVariant{" + tile + " " + colors + "}";
    }
}
