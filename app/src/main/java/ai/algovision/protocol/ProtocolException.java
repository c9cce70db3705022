package ai.algovision.protocol;

/** A protocol line that cannot be decoded into a request. */
public class ProtocolException extends RuntimeException {
    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
