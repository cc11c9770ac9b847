package ai.dadaist.collage.work;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked at task boundaries.
 */
public final class CancellationToken {

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
