package org.autotile.core.model;

import java.util.Comparator;

/**
 * Grid cell coordinate. Equality by value.
 */
public final class Position {

    /** Row by row, then by column. */
    public static final Comparator<Position> ROW_MAJOR =
            Comparator.<Position>comparingInt(p -> p.y).thenComparingInt(p -> p.x);

    public final int x;
    public final int y;

    public Position(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public static Position of(int x, int y) {
        return new Position(x, y);
    }

    public Position offset(int dx, int dy) {
        return new Position(x + dx, y + dy);
    }

    public double manhattan(double cx, double cy) {
        return Math.abs(x - cx) + Math.abs(y - cy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position other = (Position) o;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
