package org.severityoracle.common.http;

import java.io.IOException;

/**
 * The request bytes went out but no answer came back (read timeout, reset, half a response).
 * The peer may well have acted on the request, so sending it again is not safe.
 */
public class UnacknowledgedExchangeException extends IOException {
    public UnacknowledgedExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
