package ai.algovision.ir;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CallEdge(
        @JsonProperty("callerId") String callerId,
        @JsonProperty("calleeName") String calleeName,
        @JsonProperty("kind") CallKind kind) {

    public CallEdge {
        if (calleeName.isBlank()) {
            throw new IllegalArgumentException("calleeName must not be blank");
        }
    }
}
