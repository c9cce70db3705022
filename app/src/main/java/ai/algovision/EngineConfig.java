package ai.algovision;

import ai.algovision.analyzer.AnalyzeOptions;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;

/**
 * Engine settings, resolved from {@code --key value} / {@code --key=value} arguments first, then environment
 * variables, then defaults.
 *
 * @param maxNodes default node cap for requests that do not set one
 * @param workerThreads size of the shared worker pool
 * @param preload load the grammars at startup instead of on the first request
 */
public record EngineConfig(int maxNodes, int workerThreads, boolean preload) {

    public EngineConfig {
        if (maxNodes < 1) {
            throw new IllegalArgumentException("max-nodes must be positive, got " + maxNodes);
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("worker-threads must be positive, got " + workerThreads);
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(AnalyzeOptions.DEFAULT_MAX_NODES, defaultWorkerThreads(), true);
    }

    public static EngineConfig fromArgs(String[] args) {
        return resolve(parseArgs(args), System::getenv);
    }

    static EngineConfig resolve(Map<String, String> parsedArgs, Function<String, @Nullable String> env) {
        var maxNodes = getConfigValue(parsedArgs, "max-nodes", "ALGOVISION_MAX_NODES", env);
        var workers = getConfigValue(parsedArgs, "worker-threads", "ALGOVISION_WORKER_THREADS", env);
        var preload = getConfigValue(parsedArgs, "preload", "ALGOVISION_PRELOAD", env);
        return new EngineConfig(
                maxNodes == null ? AnalyzeOptions.DEFAULT_MAX_NODES : parseInt("max-nodes", maxNodes),
                workers == null ? defaultWorkerThreads() : parseInt("worker-threads", workers),
                preload == null || parseBoolean("preload", preload));
    }

    static Map<String, String> parseArgs(String[] args) {
        var result = new HashMap<String, String>();
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            if (!arg.startsWith("--")) {
                continue;
            }
            var withoutPrefix = arg.substring(2);
            String key;
            String value;
            if (withoutPrefix.contains("=")) {
                // Form: --key=value
                var parts = withoutPrefix.split("=", 2);
                key = parts[0];
                value = parts[1];
            } else {
                // Form: --key value
                key = withoutPrefix;
                if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                    value = args[++i];
                } else {
                    value = "";
                }
            }
            result.put(key.toLowerCase(Locale.ROOT), value);
        }
        return result;
    }

    private static @Nullable String getConfigValue(
            Map<String, String> parsedArgs, String argKey, String envVarName, Function<String, @Nullable String> env) {
        var argValue = parsedArgs.get(argKey);
        if (argValue != null && !argValue.isBlank()) {
            return argValue;
        }
        var envValue = env.apply(envVarName);
        return envValue == null || envValue.isBlank() ? null : envValue;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
        };
    }

    private static int defaultWorkerThreads() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
