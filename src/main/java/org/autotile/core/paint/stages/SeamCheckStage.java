package org.autotile.core.paint.stages;

import org.autotile.core.paint.PaintContext;
import org.autotile.core.paint.PaintStage;
import org.autotile.core.paint.SeamCheck;
import org.autotile.core.paint.StageId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SeamCheckStage implements PaintStage {

    private static final Logger log = LoggerFactory.getLogger(SeamCheckStage.class);

    @Override
    public StageId id() {
        return StageId.SEAM_CHECK;
    }

    @Override
    public String name() {
        return "Seam check";
    }

    @Override
    public void apply(PaintContext ctx) {
        int mismatches = SeamCheck.mismatches(ctx.map, ctx.catalog, ctx.affected);
        ctx.report.seamMismatches = mismatches;
        if (mismatches > 0) {
            log.warn("{} seam mismatch(es) around {} painted cell(s) with color {}",
                    mismatches, ctx.positions.size(), ctx.color);
        }
    }
}
