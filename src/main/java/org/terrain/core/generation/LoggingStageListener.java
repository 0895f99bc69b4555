package org.terrain.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingStageListener implements StageListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingStageListener.class);

    @Override
    public void onStageStart(StageId id, String name) {
        LOGGER.info("[STAGE START] {} - {}", id, name);
    }

    @Override
    public void onStageEnd(StageId id, String name, long elapsedMs) {
        LOGGER.info("[STAGE END]   {} - {} ({} ms)", id, name, elapsedMs);
    }
}
