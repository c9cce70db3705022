package ai.algovision;

import ai.algovision.analyzer.AnalyzerRegistry;
import ai.algovision.engine.AnalysisEngine;
import ai.algovision.protocol.ProtocolCodec;
import ai.algovision.protocol.StdioServer;
import ai.algovision.treesitter.ParserRuntime;
import ai.algovision.util.ExecutorServiceUtil;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Runs the analysis engine over stdin/stdout. Logs go to stderr. */
public final class EngineMain {
    private static final Logger logger = LogManager.getLogger(EngineMain.class);

    private EngineMain() {}

    public static void main(String[] args) {
        try {
            var config = EngineConfig.fromArgs(args);
            logger.info(
                    "Starting analysis engine: maxNodes={}, workerThreads={}, preload={}",
                    config.maxNodes(),
                    config.workerThreads(),
                    config.preload());

            var runtime = new ParserRuntime();
            if (config.preload()) {
                runtime.warmUp();
            }
            var executor = ExecutorServiceUtil.newFixedThreadExecutor(config.workerThreads(), "algovision-worker-");
            var out = new PrintStream(System.out, false, StandardCharsets.UTF_8);
            var server = new StdioServer(new ProtocolCodec(), out);
            var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            try {
                server.serve(in, s -> new AnalysisEngine(
                        runtime, AnalyzerRegistry.defaults(), executor, config.maxNodes(), s::send));
            } finally {
                executor.shutdown();
            }
            logger.info("Analysis engine stopped");
        } catch (Throwable th) {
            logger.error("Fatal error in analysis engine", th);
            System.exit(1);
        }
    }
}
