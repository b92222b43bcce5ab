package org.planet.core.generation;

public interface StageListener {
    void onStageStart(StageId id, String name);
    void onStageEnd(StageId id, String name, long elapsedMs);

    /** Listener that prints nothing. */
    StageListener SILENT = new StageListener() {
        @Override
        public void onStageStart(StageId id, String name) {
        }

        @Override
        public void onStageEnd(StageId id, String name, long elapsedMs) {
        }
    };
}
