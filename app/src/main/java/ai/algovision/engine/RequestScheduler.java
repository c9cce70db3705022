package ai.algovision.engine;

import ai.algovision.analyzer.CancellationToken;
import ai.algovision.protocol.EngineResponse;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Tracks the active analysis request per document and issues cancellation notices.
 *
 * <p>Every method runs synchronously on the calling thread, so a superseded request's {@code cancelled} notice is
 * emitted before its successor is even queued. Emission of results goes through {@link #emitIfLive}, which holds the
 * same lock as cancellation; a request whose notice has been sent can never emit a result afterwards.
 */
public final class RequestScheduler {
    private static final Logger logger = LogManager.getLogger(RequestScheduler.class);

    private final Consumer<EngineResponse> sink;
    private final Map<String, CancellationToken> activeByDocument = new HashMap<>();
    // request ids are only unique per document; a cancel reaches every live request sharing the id
    private final ListMultimap<String, CancellationToken> byRequestId = ArrayListMultimap.create();

    public RequestScheduler(Consumer<EngineResponse> sink) {
        this.sink = sink;
    }

    /** Cancels the document's active request, if any, then registers {@code requestId} as active. */
    public synchronized CancellationToken begin(String docId, String requestId) {
        var previous = activeByDocument.get(docId);
        if (previous != null && previous.cancel()) {
            logger.debug("Request {} for {} superseded by {}", previous.requestId(), docId, requestId);
            sink.accept(new EngineResponse.Cancelled(previous.requestId()));
        }
        var token = new CancellationToken(requestId);
        activeByDocument.put(docId, token);
        byRequestId.put(requestId, token);
        return token;
    }

    /** Flags {@code requestId} as cancelled, known or not, and acknowledges with a notice. */
    public synchronized void cancel(String requestId) {
        var tokens = byRequestId.get(requestId);
        if (!tokens.isEmpty()) {
            tokens.forEach(CancellationToken::cancel);
        } else {
            logger.debug("Cancel for unknown or finished request {}", requestId);
        }
        sink.accept(new EngineResponse.Cancelled(requestId));
    }

    /** Cancels and forgets the document's active request, emitting its notice. */
    public synchronized void cancelDocument(String docId) {
        var token = activeByDocument.remove(docId);
        if (token != null && token.cancel()) {
            logger.debug("Request {} cancelled by close of {}", token.requestId(), docId);
            sink.accept(new EngineResponse.Cancelled(token.requestId()));
        }
    }

    /** Clears the markers for {@code token}, but only where they still point at it. */
    public synchronized void complete(String docId, CancellationToken token) {
        activeByDocument.remove(docId, token);
        byRequestId.remove(token.requestId(), token);
    }

    /** @return false if the request was cancelled and the response dropped */
    public synchronized boolean emitIfLive(CancellationToken token, EngineResponse response) {
        if (token.isCancelled()) {
            logger.debug("Dropping result of cancelled request {}", token.requestId());
            return false;
        }
        sink.accept(response);
        return true;
    }

    public synchronized @Nullable String activeRequest(String docId) {
        var token = activeByDocument.get(docId);
        return token == null ? null : token.requestId();
    }

    /** Emits a response that no request owns, such as {@code init:done}. */
    public synchronized void emit(EngineResponse response) {
        sink.accept(response);
    }
}
