package org.severityoracle.domain.model;

/** The response sink could not hand the finalized payload to its consumer. */
public class ResponseDeliveryException extends Exception {

    public ResponseDeliveryException(String message) {
        super(message);
    }

    public ResponseDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
