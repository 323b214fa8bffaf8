package org.severityoracle.common.http;

import org.severityoracle.common.interfaces.HttpWire;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Plain-socket HTTP/1.1 client used by the callback sink and the reporter CLI.
 * Every exchange is one connection with {@code Connection: close}.
 */
public class DefaultHttpWire implements HttpWire {

    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public DefaultHttpWire() {
        this(2_000, 5_000);
    }

    public DefaultHttpWire(int connectTimeoutMs, int readTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
    }

    /**
     * Builds a raw HTTP/1.1 request head.
     *
     * @param method        HTTP method (e.g. "POST", "GET")
     * @param path          resource path, must start with '/'
     * @param host          target host
     * @param port          target port
     * @param extraHeaders  additional headers, may be null
     * @param contentLength body size in bytes
     * @return request head ending with the blank line
     */
    @Override
    public String buildRequest(String method, String path, String host, int port,
                               Map<String, String> extraHeaders, int contentLength) {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append(" ").append(path).append(" HTTP/1.1\r\n");
        sb.append("Host: ").append(host).append(":").append(port).append("\r\n");

        if (extraHeaders != null) {
            for (Map.Entry<String, String> e : extraHeaders.entrySet()) {
                sb.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
            }
        }

        sb.append("Connection: close\r\n");
        sb.append("Content-Length: ").append(contentLength).append("\r\n\r\n");
        return sb.toString();
    }

    @Override
    public void send(OutputStream out, String requestHead, byte[] body) throws IOException {
        out.write(requestHead.getBytes(StandardCharsets.UTF_8));
        if (body != null && body.length > 0) {
            out.write(body);
        }
        out.flush();
    }

    @Override
    public String readRawResponse(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    /**
     * Failures while connecting surface as plain {@link IOException}s: nothing was sent. Once the
     * connection is up, any failure is reported as {@link UnacknowledgedExchangeException}.
     */
    @Override
    public String exchange(String host, int port, String requestHead, byte[] body) throws IOException {
        try (Socket s = new Socket()) {
            s.connect(new InetSocketAddress(host, port), connectTimeoutMs);
            try {
                s.setSoTimeout(readTimeoutMs);
                OutputStream out = s.getOutputStream();
                InputStream in = s.getInputStream();
                send(out, requestHead, body);
                return readRawResponse(in);
            } catch (IOException e) {
                throw new UnacknowledgedExchangeException("no answer from " + host + ":" + port + " after sending: "
                        + e.getMessage(), e);
            }
        }
    }
}
