package org.severityoracle.domain.interfaces;

import org.severityoracle.domain.model.ResponseDeliveryException;

/**
 * Where a finalized category goes. Called at most once per successful finalize;
 * a thrown exception means the consumer did not get it and the request stays open.
 */
@FunctionalInterface
public interface IResponseSink {

    /**
     * @param replyTo the address captured when the request was opened, may be null
     */
    void deliver(long requestId, String replyTo, byte[] payload) throws ResponseDeliveryException;

    /**
     * Rejects, on open, a reply address this sink could never deliver to.
     *
     * @throws IllegalArgumentException if {@code replyTo} is unusable
     */
    default void checkReplyTo(String replyTo) {
    }
}
