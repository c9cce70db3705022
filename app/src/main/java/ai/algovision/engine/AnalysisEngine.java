package ai.algovision.engine;

import ai.algovision.analyzer.AnalysisContext;
import ai.algovision.analyzer.AnalysisResult;
import ai.algovision.analyzer.AnalyzeOptions;
import ai.algovision.analyzer.AnalyzerRegistry;
import ai.algovision.analyzer.CancellationToken;
import ai.algovision.analyzer.Language;
import ai.algovision.analyzer.LanguageAnalyzer;
import ai.algovision.ir.Diagnostic;
import ai.algovision.ir.IrDocument;
import ai.algovision.ir.IrInvariants;
import ai.algovision.protocol.EngineRequest;
import ai.algovision.protocol.EngineResponse;
import ai.algovision.treesitter.ParseFailedException;
import ai.algovision.treesitter.ParserRuntime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSTree;

/**
 * Entry point for all engine operations. Document work runs on per-document serial lanes; cancellation bookkeeping and
 * notices happen on the calling thread.
 */
public final class AnalysisEngine {
    private static final Logger logger = LogManager.getLogger(AnalysisEngine.class);

    private final ParserRuntime runtime;
    private final AnalyzerRegistry registry;
    private final DocumentManager documents = new DocumentManager();
    private final RequestScheduler scheduler;
    private final DocumentLanes lanes;
    private final int defaultMaxNodes;

    public AnalysisEngine(
            ParserRuntime runtime,
            AnalyzerRegistry registry,
            Executor executor,
            int defaultMaxNodes,
            Consumer<EngineResponse> sink) {
        this.runtime = runtime;
        this.registry = registry;
        this.scheduler = new RequestScheduler(sink);
        this.lanes = new DocumentLanes(executor);
        this.defaultMaxNodes = defaultMaxNodes;
    }

    /** Dispatches a decoded protocol message. */
    public void handle(EngineRequest request) {
        if (request instanceof EngineRequest.Init) {
            init();
        } else if (request instanceof EngineRequest.OpenDoc open) {
            openDoc(open.docId(), open.language(), open.text(), open.version());
        } else if (request instanceof EngineRequest.ApplyEdits edits) {
            applyEdits(edits.docId(), edits.version(), edits.edits());
            if (edits.analyzeAfter()) {
                analyze(edits.docId(), edits.effectiveRequestId(), edits.options());
            }
        } else if (request instanceof EngineRequest.Analyze analyze) {
            analyze(analyze.docId(), analyze.requestId(), analyze.options());
        } else if (request instanceof EngineRequest.Cancel cancel) {
            cancel(cancel.requestId());
        } else if (request instanceof EngineRequest.CloseDoc close) {
            closeDoc(close.docId());
        } else {
            throw new IllegalArgumentException("Unhandled request " + request);
        }
    }

    /** Loads the grammars and replies {@code init:done}, or an {@code INTERNAL} result if they cannot be loaded. */
    public void init() {
        try {
            long coldStartMs = runtime.warmUp();
            scheduler.emit(new EngineResponse.InitDone(coldStartMs));
        } catch (RuntimeException | LinkageError e) {
            logger.error("Failed to initialize parser runtime", e);
            scheduler.emit(EngineResponse.Result.failed(
                    EngineResponse.INIT_REQUEST_ID,
                    "",
                    "",
                    Diagnostic.internal("Failed to initialize parser runtime: " + e.getMessage()),
                    EngineResponse.Perf.ZERO));
        }
    }

    public CompletableFuture<Void> openDoc(String docId, String languageId, String text, int version) {
        return lanes.submit(docId, () -> documents.open(docId, languageId, text, version));
    }

    public CompletableFuture<Void> applyEdits(String docId, int version, List<TextEdit> edits) {
        var copy = List.copyOf(edits);
        return lanes.submit(docId, () -> documents.applyEdits(docId, version, copy));
    }

    /**
     * Supersedes the document's active request, then queues this one behind the document's pending work. Replies with
     * a {@code result}, or nothing if the request is cancelled before it finishes.
     */
    public CompletableFuture<Void> analyze(String docId, String requestId, @Nullable AnalyzeOptions options) {
        var effective = (options == null ? AnalyzeOptions.defaults() : options).withDefaultMaxNodes(defaultMaxNodes);
        var token = scheduler.begin(docId, requestId);
        return lanes.submit(docId, () -> {
            try {
                var result = run(docId, token, effective);
                if (result != null) {
                    scheduler.emitIfLive(token, result);
                }
            } finally {
                scheduler.complete(docId, token);
            }
        });
    }

    public void cancel(String requestId) {
        scheduler.cancel(requestId);
    }

    public CompletableFuture<Void> closeDoc(String docId) {
        scheduler.cancelDocument(docId);
        return lanes.submit(docId, () -> documents.close(docId));
    }

    /** Completes when all work queued so far has finished. */
    public CompletableFuture<Void> drain() {
        return lanes.drain();
    }

    DocumentManager documents() {
        return documents;
    }

    private EngineResponse.@Nullable Result run(String docId, CancellationToken token, AnalyzeOptions options) {
        long start = System.nanoTime();
        if (token.isCancelled()) {
            return null;
        }
        var requestId = token.requestId();
        var document = documents.get(docId);
        if (document == null) {
            return EngineResponse.Result.failed(
                    requestId, docId, "", Diagnostic.internal("Document not found: " + docId), perf(start, 0, 0));
        }
        var language = Language.fromId(document.languageId());
        LanguageAnalyzer analyzer = language.flatMap(registry::find).orElse(null);
        if (language.isEmpty() || analyzer == null) {
            return EngineResponse.Result.failed(
                    requestId,
                    docId,
                    document.languageId(),
                    Diagnostic.internal("No analyzer found for language '" + document.languageId() + "'"),
                    perf(start, 0, 0));
        }
        var invalidOptions = options.validationError();
        if (invalidOptions != null) {
            logger.warn("Rejecting {} for {}: {}", requestId, docId, invalidOptions);
            return EngineResponse.Result.failed(
                    requestId, docId, document.languageId(), Diagnostic.internal(invalidOptions), perf(start, 0, 0));
        }

        long parseStart = System.nanoTime();
        TSTree tree;
        try {
            tree = runtime.parse(language.get(), document.text(), document.tree());
        } catch (ParseFailedException e) {
            logger.warn("Parse failed for {}: {}", docId, e.getMessage(), e);
            return EngineResponse.Result.failed(
                    requestId,
                    docId,
                    document.languageId(),
                    Diagnostic.parseFailure(e.getMessage()),
                    perf(start, System.nanoTime() - parseStart, 0));
        }
        if (token.isCancelled()) {
            return null;
        }
        document.setTree(tree);
        var syntaxTree = ParserRuntime.toSyntaxTree(tree, document.text());
        long parseNanos = System.nanoTime() - parseStart;
        if (token.isCancelled()) {
            return null;
        }

        long irStart = System.nanoTime();
        AnalysisResult result;
        try {
            result = analyzer.analyze(new AnalysisContext(syntaxTree, docId, language.get(), options, token));
        } catch (RuntimeException e) {
            logger.error("Analyzer for {} failed on {}", language.get().displayName(), docId, e);
            result = AnalysisResult.failed(Diagnostic.internal("Analysis failed: " + e));
        }
        long irNanos = System.nanoTime() - irStart;
        if (token.isCancelled()) {
            return null;
        }

        var diagnostics = new ArrayList<Diagnostic>();
        var errorRange = syntaxTree.firstErrorRange();
        if (errorRange != null) {
            diagnostics.add(Diagnostic.syntaxError("Source contains syntax errors", errorRange));
        }
        diagnostics.addAll(result.diagnostics());
        checkInvariants(docId, result.ir());
        return new EngineResponse.Result(
                requestId, docId, document.languageId(), result.ir(), diagnostics, perf(start, parseNanos, irNanos));
    }

    private static void checkInvariants(String docId, IrDocument ir) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        var violations = IrInvariants.check(ir);
        if (!violations.isEmpty()) {
            logger.warn("IR for {} violates {} invariants: {}", docId, violations.size(), violations);
        }
    }

    private static EngineResponse.Perf perf(long startNanos, long parseNanos, long irNanos) {
        return new EngineResponse.Perf(
                parseNanos / 1_000_000.0, irNanos / 1_000_000.0, (System.nanoTime() - startNanos) / 1_000_000.0);
    }
}
