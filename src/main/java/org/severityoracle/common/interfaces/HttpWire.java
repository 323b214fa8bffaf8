package org.severityoracle.common.interfaces;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;

/**
 * Client side of the HTTP/1.1 wire: build a request, push it out, slurp the answer.
 * No routing or oracle logic lives here.
 */
public interface HttpWire {

    /** Full request head (request line, Host, extra headers, Content-Length), no body. */
    String buildRequest(String method,
                        String path,
                        String host,
                        int port,
                        Map<String, String> extraHeaders,
                        int contentLength);

    void send(OutputStream out, String requestHead, byte[] body) throws IOException;

    /** Whole response (status line, headers, body) as one string; the server closes the connection. */
    String readRawResponse(InputStream in) throws IOException;

    /** Connect, send, read, close. */
    String exchange(String host, int port, String requestHead, byte[] body) throws IOException;
}
