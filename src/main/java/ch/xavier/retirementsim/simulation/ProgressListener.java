package ch.xavier.retirementsim.simulation;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (completed, total) -> {
    };

    /**
     * Must not block: it is called on the thread that just finished a path.
     */
    void onProgress(int completed, int total);
}
