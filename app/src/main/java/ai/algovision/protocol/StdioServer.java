package ai.algovision.protocol;

import ai.algovision.engine.AnalysisEngine;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Serves the engine over JSON lines: one request per input line, one response per output line. Malformed lines are
 * logged and skipped.
 */
public final class StdioServer {
    private static final Logger logger = LogManager.getLogger(StdioServer.class);

    private final ProtocolCodec codec;
    private final PrintStream out;

    public StdioServer(ProtocolCodec codec, PrintStream out) {
        this.codec = codec;
        this.out = out;
    }

    /** Response sink that writes each message as one line; safe to call from any thread. */
    public void send(EngineResponse response) {
        var line = codec.encode(response);
        synchronized (out) {
            out.println(line);
            out.flush();
        }
    }

    /** Reads requests until end of input, then waits for queued work to finish. */
    public void serve(BufferedReader in, Function<StdioServer, AnalysisEngine> engineFactory)
            throws IOException, InterruptedException {
        var engine = engineFactory.apply(this);
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            try {
                engine.handle(codec.decode(line));
            } catch (ProtocolException e) {
                logger.warn("Skipping message: {}", e.getMessage());
            } catch (RuntimeException e) {
                logger.error("Failed to handle message {}", line, e);
            }
        }
        logger.info("Input closed; waiting for pending work");
        try {
            engine.drain().get();
        } catch (ExecutionException e) {
            logger.error("Pending work failed during shutdown", e.getCause());
        }
    }
}
