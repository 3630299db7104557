package org.autotile.core.paint.stages;

import org.autotile.core.paint.PaintContext;
import org.autotile.core.paint.PaintStage;
import org.autotile.core.paint.StageId;
import org.autotile.core.topology.NeighborModel;

/**
 * Painted + bridging cells and a one-cell border around them.
 */
public class FootprintStage implements PaintStage {

    @Override
    public StageId id() {
        return StageId.FOOTPRINT;
    }

    @Override
    public String name() {
        return "Affected footprint";
    }

    @Override
    public void apply(PaintContext ctx) {
        ctx.affected.addAll(NeighborModel.expand(ctx.paintColors.keySet()));
        ctx.report.affectedCells = ctx.affected.size();
    }
}
