package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A structured analysis diagnostic.
 *
 * @param range source range the diagnostic refers to, if any
 * @param details machine-readable extras, e.g. {@code skipped} and {@code maxNodes} for {@code NODE_CAP_REACHED}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagnostic(
        @JsonProperty("severity") Severity severity,
        @JsonProperty("code") DiagnosticCode code,
        @JsonProperty("message") String message,
        @JsonProperty("range") @Nullable IrRange range,
        @JsonProperty("details") @Nullable Map<String, Object> details) {

    public Diagnostic {
        if (message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
        details = details == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static Diagnostic of(Severity severity, DiagnosticCode code, String message) {
        return new Diagnostic(severity, code, message, null, null);
    }

    public static Diagnostic internal(String message) {
        return of(Severity.ERROR, DiagnosticCode.INTERNAL, message);
    }

    public static Diagnostic parseFailure(String message) {
        return of(Severity.ERROR, DiagnosticCode.TS_PARSE_ERROR, message);
    }

    public static Diagnostic syntaxError(String message, IrRange range) {
        return new Diagnostic(Severity.WARN, DiagnosticCode.TS_PARSE_ERROR, message, range, null);
    }

    public static Diagnostic nodeCapReached(int skipped, int maxNodes) {
        var details = new LinkedHashMap<String, Object>();
        details.put("skipped", skipped);
        details.put("maxNodes", maxNodes);
        return new Diagnostic(
                Severity.WARN,
                DiagnosticCode.NODE_CAP_REACHED,
                "Node cap of " + maxNodes + " reached; skipped " + skipped + " nodes",
                null,
                details);
    }

    public static Diagnostic unsupported(String construct, IrRange range) {
        return new Diagnostic(
                Severity.INFO,
                DiagnosticCode.UNSUPPORTED_CONSTRUCT,
                "Unsupported construct '" + construct + "' modeled as a plain statement",
                range,
                null);
    }
}
