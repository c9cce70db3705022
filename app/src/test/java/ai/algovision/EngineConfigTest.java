package ai.algovision;

import static org.junit.jupiter.api.Assertions.*;

import ai.algovision.analyzer.AnalyzeOptions;
import java.util.Map;
import org.junit.jupiter.api.Test;

public final class EngineConfigTest {

    @Test
    void testArgumentsInBothForms() {
        var parsed = EngineConfig.parseArgs(new String[] {"--max-nodes", "500", "--Worker-Threads=3", "stray", "--preload"});
        assertEquals(Map.of("max-nodes", "500", "worker-threads", "3", "preload", ""), parsed);
    }

    @Test
    void testArgumentsWinOverEnvironment() {
        var env = Map.of("ALGOVISION_MAX_NODES", "100", "ALGOVISION_WORKER_THREADS", "8", "ALGOVISION_PRELOAD", "no");
        var config = EngineConfig.resolve(EngineConfig.parseArgs(new String[] {"--max-nodes=50"}), env::get);
        assertEquals(new EngineConfig(50, 8, false), config);
    }

    @Test
    void testDefaultsWhenUnset() {
        var config = EngineConfig.resolve(Map.of(), name -> null);
        assertEquals(AnalyzeOptions.DEFAULT_MAX_NODES, config.maxNodes());
        assertTrue(config.workerThreads() >= 1);
        assertTrue(config.preload());
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> EngineConfig.resolve(Map.of("max-nodes", "lots"), name -> null));
        assertThrows(
                IllegalArgumentException.class,
                () -> EngineConfig.resolve(Map.of("preload", "maybe"), name -> null));
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(0, 1, true));
    }
}
