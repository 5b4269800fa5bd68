package ch.xavier.retirementsim.simulation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, checked between paths and between optimizer oracle calls.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
