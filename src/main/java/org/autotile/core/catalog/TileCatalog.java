package org.autotile.core.catalog;

import org.autotile.core.model.ColorVector;
import org.autotile.core.model.TileRef;
import org.autotile.core.model.TileVariant;

import java.util.List;

/**
 * Host-provided tile catalog (a Wang set). Immutable for the duration of a paint call.
 *
 * The painter never builds or validates a catalog: variants (including rotated/reflected
 * duplicates) and the color distance table arrive pre-computed.
 */
public interface TileCatalog {

    /** Returned by {@link #distance(int, int)} when no chain of transition tiles links two colors. */
    int UNREACHABLE = -1;

    /** All variants in a stable enumeration order. */
    List<TileVariant> variants();

    /** Colors of a placed tile, or null if the tile is not part of this catalog. */
    ColorVector colorVectorOf(TileRef tile);

    /** Symmetric; distance(c, c) == 0; {@link #UNREACHABLE} when no path exists. */
    int distance(int a, int b);

    /** Colors are numbered 1..colorCount(). */
    int colorCount();

    /** Non-negative selection weight. */
    double probability(TileVariant variant);

    CatalogType type();
}
