package org.severityoracle.infrastructure.impl;

import org.severityoracle.domain.interfaces.IResponseSink;

import java.nio.charset.StandardCharsets;

/** Sink of last resort: nobody is listening, so the result only goes to the console. */
public class LoggingResponseSink implements IResponseSink {

    @Override
    public void deliver(long requestId, String replyTo, byte[] payload) {
        System.out.println("[Sink] request=" + requestId + " payload=" + new String(payload, StandardCharsets.US_ASCII));
    }
}
