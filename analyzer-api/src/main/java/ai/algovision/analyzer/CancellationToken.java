package ai.algovision.analyzer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag passed explicitly through parse, visit and build. Setting it never interrupts work; the
 * holder checks it at phase boundaries.
 */
public final class CancellationToken {
    private final String requestId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public CancellationToken(String requestId) {
        this.requestId = requestId;
    }

    public static CancellationToken none() {
        return new CancellationToken("");
    }

    public String requestId() {
        return requestId;
    }

    /** @return true if this call flipped the flag */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken[" + requestId + (isCancelled() ? ", cancelled]" : "]");
    }
}
