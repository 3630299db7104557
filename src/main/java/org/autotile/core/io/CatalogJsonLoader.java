package org.autotile.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.autotile.core.catalog.CatalogType;
import org.autotile.core.catalog.SimpleTileCatalog;
import org.autotile.core.model.ColorVector;
import org.autotile.core.model.Direction;
import org.autotile.core.model.TileRef;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads a pre-baked catalog. Distances and variants must already be computed by the tileset tooling.
 *
 * <pre>
 * {
 *   "type": "corner",
 *   "colors": [ {"name": "Grass", "probability": 1.0}, ... ],
 *   "distances": [[0, 1, 1], [1, 0, 2], [1, 2, 0]],
 *   "tileProbabilities": {"7": 0.25},
 *   "variants": [ {"tile": 7, "flipH": false, "flipV": false, "flipD": false,
 *                  "colors": [0, 1, 0, 1, 0, 1, 0, 1]}, ... ]
 * }
 * </pre>
 *
 * distances is colorCount x colorCount for colors 1..colorCount, -1 = unreachable.
 */
public class CatalogJsonLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static SimpleTileCatalog load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read catalog: " + path.toAbsolutePath(), e);
        }
    }

    public static SimpleTileCatalog read(InputStream in) throws IOException {
        JsonNode root = MAPPER.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IOException("Catalog JSON must be an object");
        }
        try {
            return build(root);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid catalog: " + e.getMessage(), e);
        }
    }

    private static SimpleTileCatalog build(JsonNode root) throws IOException {
        CatalogType type = CatalogType.parse(required(root, "type").asText());

        JsonNode dist = required(root, "distances");
        if (!dist.isArray() || dist.size() == 0) {
            throw new IOException("distances must be a non-empty array");
        }
        int n = dist.size();
        int[][] matrix = new int[n + 1][n + 1];
        for (int i = 0; i < n; i++) {
            JsonNode row = dist.get(i);
            if (!row.isArray() || row.size() != n) {
                throw new IOException("distances row " + i + " must have " + n + " entries");
            }
            for (int j = 0; j < n; j++) {
                matrix[i + 1][j + 1] = intValue(row.get(j), "distances[" + i + "][" + j + "]");
            }
        }

        SimpleTileCatalog catalog = new SimpleTileCatalog(type, matrix);

        JsonNode colors = root.path("colors");
        for (int i = 0; i < colors.size() && i < n; i++) {
            JsonNode c = colors.get(i);
            if (c.has("probability")) {
                catalog.setColorProbability(i + 1, doubleValue(c.get("probability"), "colors[" + i + "].probability"));
            }
        }

        JsonNode tileProbabilities = root.path("tileProbabilities");
        Iterator<Map.Entry<String, JsonNode>> it = tileProbabilities.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            int tileId;
            try {
                tileId = Integer.parseInt(e.getKey());
            } catch (NumberFormatException ex) {
                throw new IOException("tileProbabilities key is not a tile id: " + e.getKey(), ex);
            }
            catalog.setTileProbability(tileId, doubleValue(e.getValue(), "tileProbabilities." + e.getKey()));
        }

        for (JsonNode v : required(root, "variants")) {
            JsonNode colorArr = required(v, "colors");
            if (!colorArr.isArray() || colorArr.size() != Direction.COUNT) {
                throw new IOException("variant colors must have " + Direction.COUNT + " entries: " + v);
            }
            int[] slots = new int[Direction.COUNT];
            for (int i = 0; i < Direction.COUNT; i++) {
                slots[i] = intValue(colorArr.get(i), "variant colors[" + i + "]");
            }
            TileRef tile = new TileRef(
                    intValue(required(v, "tile"), "variant tile"),
                    v.path("flipH").asBoolean(false),
                    v.path("flipV").asBoolean(false),
                    v.path("flipD").asBoolean(false)
            );
            catalog.addVariant(ColorVector.of(slots), tile);
        }

        return catalog;
    }

    private static int intValue(JsonNode node, String field) throws IOException {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IOException(field + " must be an integer, got " + node);
        }
        return node.intValue();
    }

    private static double doubleValue(JsonNode node, String field) throws IOException {
        if (!node.isNumber()) {
            throw new IOException(field + " must be a number, got " + node);
        }
        return node.doubleValue();
    }

    private static JsonNode required(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("Missing field '" + field + "'");
        }
        return value;
    }
}
