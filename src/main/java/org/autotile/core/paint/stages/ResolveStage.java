package org.autotile.core.paint.stages;

import org.autotile.core.matching.TileMatcher;
import org.autotile.core.model.Position;
import org.autotile.core.paint.PaintContext;
import org.autotile.core.paint.PaintStage;
import org.autotile.core.paint.RegionResolver;
import org.autotile.core.paint.StageId;

import java.util.List;

public class ResolveStage implements PaintStage {

    @Override
    public StageId id() {
        return StageId.RESOLVE;
    }

    @Override
    public String name() {
        return "Resolve tiles (inside-out)";
    }

    @Override
    public void apply(PaintContext ctx) {
        TileMatcher matcher = new TileMatcher(ctx.catalog, ctx.rng);
        RegionResolver resolver = new RegionResolver(ctx.map, ctx.catalog, matcher);

        List<Position> unmatched = resolver.resolve(ctx.affected, ctx.paintColors);
        ctx.report.addUnmatched(unmatched);
        ctx.report.placedCells = ctx.affected.size() - unmatched.size();
    }
}
