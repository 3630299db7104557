package org.autotile.core.paint.stages;

import org.autotile.core.model.Position;
import org.autotile.core.paint.PaintContext;
import org.autotile.core.paint.PaintStage;
import org.autotile.core.paint.RingExpander;
import org.autotile.core.paint.StageId;

import java.util.Map;

public class RingStage implements PaintStage {

    @Override
    public StageId id() {
        return StageId.RINGS;
    }

    @Override
    public String name() {
        return "Intermediate color rings";
    }

    @Override
    public void apply(PaintContext ctx) {
        for (Position p : ctx.positions) {
            ctx.paintColors.put(p, ctx.color);
        }

        Map<Position, Integer> rings = new RingExpander(ctx.map, ctx.catalog).computeRings(ctx.positions, ctx.color);
        for (Map.Entry<Position, Integer> e : rings.entrySet()) {
            if (ctx.paintColors.putIfAbsent(e.getKey(), e.getValue()) == null) {
                ctx.intermediateCount++;
            }
        }

        ctx.report.paintedCells = ctx.positions.size();
        ctx.report.intermediateCells = ctx.intermediateCount;
    }
}
