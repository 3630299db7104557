package org.autotile.app;

import org.autotile.core.catalog.SimpleTileCatalog;
import org.autotile.core.catalog.TileCatalog;
import org.autotile.core.io.CatalogJsonLoader;
import org.autotile.core.io.LocalPaintConfigLoader;
import org.autotile.core.map.GridTileMap;
import org.autotile.core.model.ColorVector;
import org.autotile.core.model.Position;
import org.autotile.core.model.TileRef;
import org.autotile.core.model.TileVariant;
import org.autotile.core.model.config.PaintSettings;
import org.autotile.core.paint.PaintReport;
import org.autotile.core.paint.SmartPainter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Paints onto a map filled with one solid terrain and prints the dominant color of every cell.
 *
 * <pre>
 * PaintMain catalog.json 9 9 2 4,4 3 [seed]
 * PaintMain catalog.json 9 9 2 3,3;4,4;5,5 3
 * </pre>
 */
public class PaintMain {

    private static final Logger log = LoggerFactory.getLogger(PaintMain.class);

    public static void main(String[] args) {
        if (args.length < 6) {
            System.out.println("usage: PaintMain <catalog.json> <width> <height> <fillColor> <x,y[;x,y...]> <color> [seed]");
            return;
        }

        SimpleTileCatalog catalog = CatalogJsonLoader.load(Paths.get(args[0]));
        int width = Integer.parseInt(args[1]);
        int height = Integer.parseInt(args[2]);
        int fillColor = Integer.parseInt(args[3]);
        Set<Position> positions = parsePositions(args[4]);
        int color = Integer.parseInt(args[5]);

        PaintSettings settings = new PaintSettings(0L);
        LocalPaintConfigLoader.apply(settings);
        settings.applyOverridesFromSystem();
        if (args.length >= 7) {
            settings.seed = Long.parseLong(args[6]);
        }

        TileRef fill = solidTile(catalog, fillColor);
        if (fill == null) {
            throw new IllegalArgumentException("Catalog has no solid tile for color " + fillColor);
        }
        GridTileMap map = GridTileMap.filled(width, height, fill);

        log.info("Painting color {} at {} cell(s) on {}x{} map of color {} ({})",
                color, positions.size(), width, height, fillColor, settings);
        PaintReport report = new SmartPainter(settings).paint(map, catalog, positions, color);
        log.info("Done: {}", report);

        printDominantColors(map, catalog, System.out);
    }

    static Set<Position> parsePositions(String arg) {
        Set<Position> out = new LinkedHashSet<>();
        for (String part : arg.split(";")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) continue;
            String[] xy = trimmed.split(",");
            if (xy.length != 2) {
                throw new IllegalArgumentException("Bad position '" + trimmed + "', expected x,y");
            }
            out.add(Position.of(Integer.parseInt(xy[0].trim()), Integer.parseInt(xy[1].trim())));
        }
        return out;
    }

    /** First variant carrying only {@code color} on every active slot. */
    static TileRef solidTile(TileCatalog catalog, int color) {
        ColorVector solid = ColorVector.EMPTY;
        for (int i : catalog.type().activeSlots()) {
            solid = solid.withColor(i, color);
        }
        for (TileVariant v : catalog.variants()) {
            if (v.colors.equals(solid)) {
                return v.tile;
            }
        }
        return null;
    }

    static void printDominantColors(GridTileMap map, TileCatalog catalog, PrintStream out) {
        for (int y = 0; y < map.height(); y++) {
            StringBuilder line = new StringBuilder();
            for (int x = 0; x < map.width(); x++) {
                ColorVector cv = catalog.colorVectorOf(map.cellAt(x, y));
                if (x > 0) line.append(' ');
                line.append(cv == null ? "." : Integer.toString(cv.dominantColor()));
            }
            out.println(line);
        }
    }
}
