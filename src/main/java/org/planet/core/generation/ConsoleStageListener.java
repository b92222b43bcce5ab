package org.planet.core.generation;

public class ConsoleStageListener implements StageListener {

    private final String prefix;
    private long totalMs;

    public ConsoleStageListener() {
        this("");
    }

    /** Prefix printed before each line, e.g. the planet id when several run in one batch. */
    public ConsoleStageListener(String prefix) {
        this.prefix = prefix == null || prefix.isEmpty() ? "" : prefix + " ";
    }

    @Override
    public void onStageStart(StageId id, String name) {
        System.out.println(prefix + "[STAGE START] " + id + " - " + name);
    }

    @Override
    public void onStageEnd(StageId id, String name, long elapsedMs) {
        totalMs += elapsedMs;
        System.out.println(prefix + "[STAGE END]   " + id + " - " + name + " (" + elapsedMs + " ms, total "
                + totalMs + " ms)");
    }

    public long totalMs() {
        return totalMs;
    }
}
