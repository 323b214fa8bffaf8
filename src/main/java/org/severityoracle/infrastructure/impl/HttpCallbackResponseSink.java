package org.severityoracle.infrastructure.impl;

import org.severityoracle.common.http.HttpMessages;
import org.severityoracle.common.http.HttpStatus;
import org.severityoracle.common.http.UnacknowledgedExchangeException;
import org.severityoracle.common.interfaces.HttpWire;
import org.severityoracle.common.interfaces.RetryExecutor;
import org.severityoracle.domain.interfaces.IResponseSink;
import org.severityoracle.domain.model.ResponseDeliveryException;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POSTs the category byte to the reply address the request originator gave on open.
 * <p>
 * Requests opened without an address fall through to {@code fallback}. A payload is sent again
 * only when it provably never reached the consumer: the connection failed, or the consumer answered
 * 429/503. Once the bytes are out, a lost answer or a 5xx counts as delivered, so the consumer
 * never sees the same result twice. A 4xx refusal fails the delivery.
 */
public class HttpCallbackResponseSink implements IResponseSink {

    private static final int DEFAULT_CALLBACK_PORT = 80;
    private static final String DEFAULT_CALLBACK_PATH = "/";

    /** Status used when the request went out but no readable answer came back. */
    private static final int NO_ANSWER = -1;

    private final HttpWire http;
    private final RetryExecutor retry;
    private final IResponseSink fallback;

    public HttpCallbackResponseSink(HttpWire http, RetryExecutor retry, IResponseSink fallback) {
        this.http = http;
        this.retry = retry;
        this.fallback = fallback;
    }

    /** @throws IllegalArgumentException if {@code replyTo} is not {@code host[:port][/path]} */
    @Override
    public void checkReplyTo(String replyTo) {
        target(replyTo);
    }

    @Override
    public void deliver(long requestId, String replyTo, byte[] payload) throws ResponseDeliveryException {
        if (replyTo == null || replyTo.isBlank()) {
            fallback.deliver(requestId, null, payload);
            return;
        }
        HttpMessages.Target target;
        try {
            target = target(replyTo);
        } catch (IllegalArgumentException e) {
            throw new ResponseDeliveryException("bad reply address for request " + requestId + ": " + e.getMessage(), e);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", "SeverityOracle/1.0");
        headers.put("Content-Type", "text/plain; charset=us-ascii");
        headers.put("X-Request-Id", String.valueOf(requestId));
        String head = http.buildRequest("POST", target.path(), target.host(), target.port(), headers, payload.length);
        String where = target.host() + ":" + target.port() + target.path();

        int code;
        try {
            code = retry.execute(() -> {
                String resp;
                try {
                    resp = http.exchange(target.host(), target.port(), head, payload);
                } catch (UnacknowledgedExchangeException sent) {
                    System.err.println("[Callback] " + sent.getMessage());
                    return NO_ANSWER;
                }
                int status = HttpMessages.statusCodeOf(HttpMessages.firstLine(resp));
                if (HttpStatus.isUnprocessed(status)) {
                    throw new IOException("callback answered HTTP " + status + ", not processed");
                }
                return status;
            });
        } catch (Exception e) {
            throw new ResponseDeliveryException("callback " + where + " unreachable: " + e.getMessage(), e);
        }

        if (HttpStatus.isSuccess(code)) {
            System.out.println("[Callback] delivered request=" + requestId + " to " + where);
        } else if (code == NO_ANSWER || code >= HttpStatus.INTERNAL_SERVER_ERROR) {
            System.err.println("[Callback] request=" + requestId + " sent to " + where
                    + " but not acknowledged (" + (code == NO_ANSWER ? "no answer" : "HTTP " + code) + "), not resending");
        } else {
            throw new ResponseDeliveryException("callback refused request " + requestId + " with HTTP " + code);
        }
    }

    private static HttpMessages.Target target(String replyTo) {
        return HttpMessages.parseTarget(replyTo.trim(), DEFAULT_CALLBACK_PORT, DEFAULT_CALLBACK_PATH);
    }
}
