package org.autotile.core.model;

/**
 * Per-direction color descriptor of a tile (or of the constraints on a cell).
 *
 * Packed layout: slot i = bits [8*i, 8*i + 8) of {@link #value()}, slots ordered as {@link Direction}.
 * External catalogs rely on this layout bit-for-bit.
 *
 * Slot value 0 = "don't care" / unconstrained.
 */
public final class ColorVector {

    public static final int SLOT_BITS = 8;
    public static final int SLOT_MASK = 0xFF;

    public static final ColorVector EMPTY = new ColorVector(0L);

    private final long value;

    private ColorVector(long value) {
        this.value = value;
    }

    public static ColorVector ofValue(long value) {
        return value == 0L ? EMPTY : new ColorVector(value);
    }

    /** Colors in slot order Top, TopRight, ..., TopLeft. */
    public static ColorVector of(int... colors) {
        if (colors == null || colors.length != Direction.COUNT) {
            throw new IllegalArgumentException("ColorVector requires exactly " + Direction.COUNT + " colors");
        }
        long v = 0L;
        for (int i = 0; i < Direction.COUNT; i++) {
            v |= ((long) checkColor(colors[i])) << (i * SLOT_BITS);
        }
        return ofValue(v);
    }

    public static ColorVector allCorners(int color) {
        return of(0, color, 0, color, 0, color, 0, color);
    }

    public static ColorVector allEdges(int color) {
        return of(color, 0, color, 0, color, 0, color, 0);
    }

    public static ColorVector all(int color) {
        return of(color, color, color, color, color, color, color, color);
    }

    public long value() {
        return value;
    }

    public int colorAt(int index) {
        checkIndex(index);
        return (int) ((value >>> (index * SLOT_BITS)) & SLOT_MASK);
    }

    public int colorAt(Direction direction) {
        return colorAt(direction.index());
    }

    public ColorVector withColor(int index, int color) {
        checkIndex(index);
        int shift = index * SLOT_BITS;
        long cleared = value & ~(((long) SLOT_MASK) << shift);
        return ofValue(cleared | (((long) checkColor(color)) << shift));
    }

    public ColorVector withColor(Direction direction, int color) {
        return withColor(direction.index(), color);
    }

    /** Hard-constraint mask: slot = 0xFF where this vector's slot is nonzero. */
    public ColorVector mask() {
        long m = 0L;
        for (int i = 0; i < Direction.COUNT; i++) {
            if (colorAt(i) != 0) {
                m |= ((long) SLOT_MASK) << (i * SLOT_BITS);
            }
        }
        return ofValue(m);
    }

    public boolean isMasked(int index) {
        return colorAt(index) != 0;
    }

    public ColorVector and(ColorVector mask) {
        return ofValue(value & mask.value);
    }

    public boolean isEmpty() {
        return value == 0L;
    }

    /** Most frequent nonzero slot color, earliest slot wins ties; 0 when all slots are 0. */
    public int dominantColor() {
        int[] counts = new int[SLOT_MASK + 1];
        int best = 0;
        int bestCount = 0;
        for (int i = 0; i < Direction.COUNT; i++) {
            int c = colorAt(i);
            if (c == 0) continue;
            counts[c]++;
        }
        for (int i = 0; i < Direction.COUNT; i++) {
            int c = colorAt(i);
            if (c != 0 && counts[c] > bestCount) {
                best = c;
                bestCount = counts[c];
            }
        }
        return best;
    }

    public int[] toArray() {
        int[] out = new int[Direction.COUNT];
        for (int i = 0; i < Direction.COUNT; i++) {
            out[i] = colorAt(i);
        }
        return out;
    }

    private static int checkColor(int color) {
        if (color < 0 || color > SLOT_MASK) {
            throw new IllegalArgumentException("Slot color out of range 0.." + SLOT_MASK + ": " + color);
        }
        return color;
    }

    private static void checkIndex(int index) {
        if (index < 0 || index >= Direction.COUNT) {
            throw new IllegalArgumentException("Slot index out of range: " + index);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColorVector)) return false;
        return value == ((ColorVector) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ColorVector[");
        for (int i = 0; i < Direction.COUNT; i++) {
            if (i > 0) sb.append(',');
            sb.append(colorAt(i));
        }
        return sb.append(']').toString();
    }
}
