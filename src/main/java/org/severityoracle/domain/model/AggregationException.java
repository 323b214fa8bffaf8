package org.severityoracle.domain.model;

/**
 * Raised when the oracle rejects a call. The {@link ErrorKind} is what callers branch on,
 * the message is for humans.
 */
public class AggregationException extends RuntimeException {

    private final ErrorKind kind;

    public AggregationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AggregationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }

    public static AggregationException unauthorized(String message) {
        return new AggregationException(ErrorKind.UNAUTHORIZED, message);
    }

    public static AggregationException invalidArgument(String message) {
        return new AggregationException(ErrorKind.INVALID_ARGUMENT, message);
    }

    public static AggregationException unknownRequest(long requestId) {
        return new AggregationException(ErrorKind.UNKNOWN_REQUEST, "request " + requestId + " was never opened");
    }

    public static AggregationException alreadyFinalized(long requestId) {
        return new AggregationException(ErrorKind.ALREADY_FINALIZED, "request " + requestId + " is already finalized");
    }
}
