package org.autotile.core.paint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingStageListener implements StageListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingStageListener.class);

    @Override
    public void onStageStart(StageId id, String name) {
        log.debug("[STAGE START] {} - {}", id, name);
    }

    @Override
    public void onStageEnd(StageId id, String name, long elapsedMs) {
        log.debug("[STAGE END]   {} - {} ({} ms)", id, name, elapsedMs);
    }
}
