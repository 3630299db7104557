package org.autotile.core.paint;

public enum StageId {
    RINGS,
    FOOTPRINT,
    RESOLVE,
    SEAM_CHECK
}
