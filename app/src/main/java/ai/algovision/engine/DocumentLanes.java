package ai.algovision.engine;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One serial lane per document over a shared executor: tasks for the same document run strictly in submission order,
 * tasks for different documents run concurrently.
 */
final class DocumentLanes {
    private static final Logger logger = LogManager.getLogger(DocumentLanes.class);

    private final Executor executor;
    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    DocumentLanes(Executor executor) {
        this.executor = executor;
    }

    CompletableFuture<Void> submit(String docId, Runnable task) {
        var future = tails.compute(docId, (id, tail) -> {
            // a failed task must not stall the lane
            var previous = tail == null ? CompletableFuture.<Void>completedFuture(null) : tail.handle((r, e) -> null);
            return previous.thenRunAsync(wrap(docId, task), executor);
        });
        future.whenComplete((r, e) -> tails.remove(docId, future));
        return future;
    }

    /** Completes once every task submitted so far has finished. */
    CompletableFuture<Void> drain() {
        var pending = tails.values().toArray(new CompletableFuture<?>[0]);
        return CompletableFuture.allOf(pending).handle((r, e) -> null);
    }

    private Runnable wrap(String docId, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Throwable th) {
                logger.error("Task for {} failed", docId, th);
                throw th;
            }
        };
    }
}
