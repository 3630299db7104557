package org.autotile.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ColorVectorTest {

    @Test
    void testSlotLayout() {
        assertEquals(0x01L, ColorVector.of(1, 0, 0, 0, 0, 0, 0, 0).value());
        assertEquals(0x0200L, ColorVector.of(0, 2, 0, 0, 0, 0, 0, 0).value());
        assertEquals(0xFFL << 56, ColorVector.of(0, 0, 0, 0, 0, 0, 0, 255).value());
        assertEquals(0x0807060504030201L, ColorVector.of(1, 2, 3, 4, 5, 6, 7, 8).value());
    }

    @Test
    void testAccessorsByDirection() {
        var cv = ColorVector.of(1, 2, 3, 4, 5, 6, 7, 8);
        assertEquals(1, cv.colorAt(Direction.TOP));
        assertEquals(4, cv.colorAt(Direction.BOTTOM_RIGHT));
        assertEquals(8, cv.colorAt(Direction.TOP_LEFT));

        var changed = cv.withColor(Direction.RIGHT, 9);
        assertEquals(9, changed.colorAt(2));
        assertEquals(3, cv.colorAt(2), "original is unchanged");
        assertEquals(ColorVector.of(1, 2, 9, 4, 5, 6, 7, 8), changed);
    }

    @Test
    void testMask() {
        var cv = ColorVector.of(0, 3, 0, 1, 0, 0, 0, 2);
        var mask = cv.mask();
        assertEquals(0xFF000000FF00FF00L, mask.value());
        assertTrue(mask.isMasked(1));
        assertFalse(mask.isMasked(0));
        assertTrue(ColorVector.EMPTY.mask().isEmpty());
    }

    @Test
    void testDominantColor() {
        assertEquals(2, ColorVector.of(0, 1, 0, 2, 0, 2, 0, 2).dominantColor());
        // tie: earliest slot wins
        assertEquals(3, ColorVector.of(0, 3, 0, 1, 0, 3, 0, 1).dominantColor());
        assertEquals(0, ColorVector.EMPTY.dominantColor());
    }

    @Test
    void testFactories() {
        assertEquals(ColorVector.of(0, 5, 0, 5, 0, 5, 0, 5), ColorVector.allCorners(5));
        assertEquals(ColorVector.of(5, 0, 5, 0, 5, 0, 5, 0), ColorVector.allEdges(5));
        assertArrayEquals(new int[]{4, 4, 4, 4, 4, 4, 4, 4}, ColorVector.all(4).toArray());
    }

    @Test
    void testRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> ColorVector.of(1, 2, 3));
        assertThrows(IllegalArgumentException.class, () -> ColorVector.of(256, 0, 0, 0, 0, 0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> ColorVector.EMPTY.colorAt(8));
        assertThrows(IllegalArgumentException.class, () -> ColorVector.EMPTY.withColor(0, -1));
    }
}
