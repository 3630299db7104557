package org.autotile.core.paint;

import org.autotile.core.paint.stages.FootprintStage;
import org.autotile.core.paint.stages.ResolveStage;
import org.autotile.core.paint.stages.RingStage;
import org.autotile.core.paint.stages.SeamCheckStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed stage order of a smart paint: bridging rings, footprint, resolve, optional seam check.
 */
public class PaintPipeline {

    private static final Logger log = LoggerFactory.getLogger(PaintPipeline.class);

    private final List<PaintStage> stages = new ArrayList<>();
    private final StageListener listener;

    public PaintPipeline(boolean seamCheck, StageListener listener) {
        this.listener = (listener != null) ? listener : new LoggingStageListener();

        stages.add(new RingStage());
        stages.add(new FootprintStage());
        stages.add(new ResolveStage());
        if (seamCheck) {
            stages.add(new SeamCheckStage());
        }
    }

    public PaintPipeline() {
        this(false, new LoggingStageListener());
    }

    public List<PaintStage> stages() {
        return Collections.unmodifiableList(stages);
    }

    public PaintReport run(PaintContext ctx) {
        for (PaintStage stage : stages) {
            long start = System.currentTimeMillis();
            listener.onStageStart(stage.id(), stage.name());

            try {
                stage.apply(ctx);
            } catch (RuntimeException e) {
                throw new PaintException("Paint failed at stage: " + stage.id() + " - " + stage.name(), e);
            } finally {
                long elapsed = System.currentTimeMillis() - start;
                listener.onStageEnd(stage.id(), stage.name(), elapsed);
            }
        }

        log.debug("Paint color {} at {} cell(s): {}", ctx.color, ctx.positions.size(), ctx.report);
        return ctx.report;
    }
}
