package org.autotile.core.paint;

public interface PaintStage {
    StageId id();
    String name();
    void apply(PaintContext ctx);
}
