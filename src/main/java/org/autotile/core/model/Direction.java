package org.autotile.core.model;

/**
 * The 8 slots of a {@link ColorVector}, clockwise from Top.
 * Ordinal = slot index; the order is part of the catalog contract.
 */
public enum Direction {
    TOP(0, -1),
    TOP_RIGHT(1, -1),
    RIGHT(1, 0),
    BOTTOM_RIGHT(1, 1),
    BOTTOM(0, 1),
    BOTTOM_LEFT(-1, 1),
    LEFT(-1, 0),
    TOP_LEFT(-1, -1);

    public static final int COUNT = 8;

    private static final Direction[] VALUES = values();

    public final int dx;
    public final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public int index() {
        return ordinal();
    }

    public boolean isCorner() {
        return (ordinal() & 1) == 1;
    }

    public Direction opposite() {
        return VALUES[opposite(ordinal())];
    }

    public static int opposite(int index) {
        return (index + 4) % COUNT;
    }

    public static Direction of(int index) {
        if (index < 0 || index >= COUNT) {
            throw new IllegalArgumentException("Direction index out of range: " + index);
        }
        return VALUES[index];
    }
}
