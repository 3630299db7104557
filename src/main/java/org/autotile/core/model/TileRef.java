package org.autotile.core.model;

/**
 * Placeable tile reference: tile id in the tileset plus orientation flags.
 * Owned by the catalog; the painter only copies it into the map.
 */
public final class TileRef {

    public final int tileId;
    public final boolean flipH;
    public final boolean flipV;
    /** Anti-diagonal flip (x/y swap), combined with H/V gives the 90° rotations. */
    public final boolean flipD;

    public TileRef(int tileId, boolean flipH, boolean flipV, boolean flipD) {
        this.tileId = tileId;
        this.flipH = flipH;
        this.flipV = flipV;
        this.flipD = flipD;
    }

    public static TileRef of(int tileId) {
        return new TileRef(tileId, false, false, false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TileRef)) return false;
        TileRef other = (TileRef) o;
        return tileId == other.tileId
                && flipH == other.flipH
                && flipV == other.flipV
                && flipD == other.flipD;
    }

    @Override
    public int hashCode() {
        int h = tileId;
        h = 31 * h + (flipH ? 1 : 0);
        h = 31 * h + (flipV ? 1 : 0);
        h = 31 * h + (flipD ? 1 : 0);
        return h;
    }

    @Override
    public String toString() {
        return "TileRef{" + tileId
                + (flipH ? " H" : "")
                + (flipV ? " V" : "")
                + (flipD ? " D" : "")
                + "}";
    }
}
