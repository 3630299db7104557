package org.autotile.core.paint;

import org.autotile.core.model.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one paint call. Unmatched cells are not errors: they keep their previous tile.
 */
public class PaintReport {

    public int paintedCells;
    public int intermediateCells;
    public int affectedCells;
    public int placedCells;

    /** -1 when the seam check did not run. */
    public int seamMismatches = -1;

    private final List<Position> unmatched = new ArrayList<>();

    public void addUnmatched(List<Position> cells) {
        unmatched.addAll(cells);
    }

    public List<Position> unmatched() {
        return Collections.unmodifiableList(unmatched);
    }

    public int unmatchedCells() {
        return unmatched.size();
    }

    @Override
    public String toString() {
        return "PaintReport{painted=" + paintedCells
                + ", intermediates=" + intermediateCells
                + ", affected=" + affectedCells
                + ", placed=" + placedCells
                + ", unmatched=" + unmatched.size()
                + (seamMismatches >= 0 ? ", seamMismatches=" + seamMismatches : "")
                + "}";
    }
}
