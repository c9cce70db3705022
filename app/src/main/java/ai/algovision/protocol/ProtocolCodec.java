package ai.algovision.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;

/** JSON encoding of protocol messages, one message per line. */
public final class ProtocolCodec {
    private final ObjectMapper mapper;

    public ProtocolCodec() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public ProtocolCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** @throws ProtocolException if {@code line} is not a well-formed request */
    public EngineRequest decode(String line) {
        try {
            var request = mapper.readValue(line, EngineRequest.class);
            if (request == null) {
                throw new ProtocolException("Empty request", new IllegalArgumentException(line));
            }
            return request;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed request: " + e.getOriginalMessage(), e);
        }
    }

    public String encode(EngineResponse response) {
        try {
            return mapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode " + response.getClass().getSimpleName(), e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
