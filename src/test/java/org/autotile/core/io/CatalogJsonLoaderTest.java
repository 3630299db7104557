package org.autotile.core.io;

import org.autotile.core.catalog.CatalogType;
import org.autotile.core.catalog.TileCatalog;
import org.autotile.core.model.ColorVector;
import org.autotile.core.model.TileRef;
import org.autotile.core.model.TileVariant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CatalogJsonLoaderTest {

    private static InputStream fixture() {
        InputStream in = CatalogJsonLoaderTest.class.getResourceAsStream("/catalogs/grass-dirt-sand.json");
        assertNotNull(in, "fixture missing");
        return in;
    }

    private static InputStream json(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testReadFixture() throws IOException {
        TileCatalog catalog;
        try (InputStream in = fixture()) {
            catalog = CatalogJsonLoader.read(in);
        }

        assertEquals(CatalogType.CORNER, catalog.type());
        assertEquals(3, catalog.colorCount());
        assertEquals(2, catalog.distance(2, 3));
        assertEquals(1, catalog.distance(1, 3));
        assertEquals(31, catalog.variants().size());

        assertEquals(ColorVector.allCorners(1), catalog.colorVectorOf(TileRef.of(0)));
        assertEquals(ColorVector.allCorners(2), catalog.colorVectorOf(TileRef.of(15)));
    }

    @Test
    void testProbabilitiesFromFile() throws IOException {
        TileCatalog catalog;
        try (InputStream in = fixture()) {
            catalog = CatalogJsonLoader.read(in);
        }
        // tile 0 = solid Grass with tile probability 0.25
        assertEquals(0.25, catalog.probability(new TileVariant(ColorVector.allCorners(1), TileRef.of(0))), 1e-9);
        // Dirt has color probability 0.5 on all four corners
        assertEquals(0.0625, catalog.probability(new TileVariant(ColorVector.allCorners(2), TileRef.of(15))), 1e-9);
    }

    @Test
    void testUnreachableAndFlags() throws IOException {
        String doc = "{\"type\":\"edge\",\"distances\":[[0,-1],[-1,0]],"
                + "\"variants\":[{\"tile\":4,\"flipH\":true,\"flipD\":true,\"colors\":[1,0,1,0,1,0,1,0]}]}";
        TileCatalog catalog = CatalogJsonLoader.read(json(doc));

        assertEquals(CatalogType.EDGE, catalog.type());
        assertEquals(TileCatalog.UNREACHABLE, catalog.distance(1, 2));
        TileVariant v = catalog.variants().get(0);
        assertEquals(new TileRef(4, true, false, true), v.tile);
        assertEquals(ColorVector.allEdges(1), v.colors);
    }

    @Test
    void testMalformed() {
        assertThrows(IOException.class, () -> CatalogJsonLoader.read(json("[]")));
        assertThrows(IOException.class, () -> CatalogJsonLoader.read(json("{\"type\":\"corner\"}")));
        assertThrows(IOException.class, () -> CatalogJsonLoader.read(json(
                "{\"type\":\"corner\",\"distances\":[[0]],\"variants\":[{\"tile\":1,\"colors\":[1,1]}]}")));
    }

    @Test
    void testMalformedValues() {
        String variant = "{\"tile\":1,\"colors\":[0,1,0,1,0,1,0,1]}";

        // unknown catalog type
        assertThrows(IOException.class, () -> CatalogJsonLoader.read(json(
                "{\"type\":\"hexagon\",\"distances\":[[0]],\"variants\":[" + variant + "]}")));
        // no colors at all
        assertThrows(IOException.class, () -> CatalogJsonLoader.read(json(
                "{\"type\":\"corner\",\"distances\":[],\"variants\":[" + variant + "]}")));
        // text distance
        assertThrows(IOException.class, () -> CatalogJsonLoader.read(json(
                "{\"type\":\"corner\",\"distances\":[[0,\"one\"],[1,0]],\"variants\":[" + variant + "]}")));
        // slot color above 255
        assertThrows(IOException.class, () -> CatalogJsonLoader.read(json(
                "{\"type\":\"corner\",\"distances\":[[0]],\"variants\":[{\"tile\":1,\"colors\":[0,300,0,1,0,1,0,1]}]}")));
        // text slot color
        assertThrows(IOException.class, () -> CatalogJsonLoader.read(json(
                "{\"type\":\"corner\",\"distances\":[[0]],\"variants\":[{\"tile\":1,\"colors\":[0,\"x\",0,1,0,1,0,1]}]}")));
        // fractional tile id
        assertThrows(IOException.class, () -> CatalogJsonLoader.read(json(
                "{\"type\":\"corner\",\"distances\":[[0]],\"variants\":[{\"tile\":1.5,\"colors\":[0,1,0,1,0,1,0,1]}]}")));
        // non-numeric tile probability key
        assertThrows(IOException.class, () -> CatalogJsonLoader.read(json(
                "{\"type\":\"corner\",\"distances\":[[0]],\"tileProbabilities\":{\"grass\":0.5},"
                        + "\"variants\":[" + variant + "]}")));
    }

    @Test
    void testLoadFromPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("catalog.json");
        try (InputStream in = fixture()) {
            Files.copy(in, file);
        }
        assertEquals(31, CatalogJsonLoader.load(file).variants().size());

        assertThrows(IllegalStateException.class, () -> CatalogJsonLoader.load(dir.resolve("missing.json")));

        Path bad = dir.resolve("hexagon.json");
        Files.writeString(bad, "{\"type\":\"hexagon\",\"distances\":[[0]],\"variants\":[]}");
        var e = assertThrows(IllegalStateException.class, () -> CatalogJsonLoader.load(bad));
        assertTrue(e.getMessage().contains("hexagon.json"));
        assertInstanceOf(IOException.class, e.getCause());
    }
}
