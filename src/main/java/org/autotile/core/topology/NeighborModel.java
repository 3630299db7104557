package org.autotile.core.topology;

import org.autotile.core.model.Direction;
import org.autotile.core.model.Position;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed 8-direction square-grid topology.
 *
 * The color a cell records at direction i is the same edge/corner its neighbor in that
 * direction records at {@link #opposite(int)}.
 */
public final class NeighborModel {

    private NeighborModel() {
    }

    public static int opposite(int index) {
        return Direction.opposite(index);
    }

    public static Position neighbor(Position pos, int index) {
        Direction d = Direction.of(index);
        return pos.offset(d.dx, d.dy);
    }

    /** The 8 neighbors in slot order. */
    public static List<Position> neighbors(Position pos) {
        List<Position> out = new ArrayList<>(Direction.COUNT);
        for (Direction d : Direction.values()) {
            out.add(pos.offset(d.dx, d.dy));
        }
        return out;
    }

    /** pos plus its 8 neighbors. */
    public static List<Position> block3x3(Position pos) {
        List<Position> out = new ArrayList<>(Direction.COUNT + 1);
        out.add(pos);
        out.addAll(neighbors(pos));
        return out;
    }

    /** Union of the 3x3 blocks around every position, in first-seen order. */
    public static Set<Position> expand(Collection<Position> positions) {
        Set<Position> out = new LinkedHashSet<>();
        for (Position p : positions) {
            out.addAll(block3x3(p));
        }
        return out;
    }
}
