package org.severityoracle.api.impl;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads one HTTP/1.1 request off a socket stream: request line, headers, Content-Length body.
 */
public final class HttpRequestReader {

    /** Bodies here are tiny JSON objects; anything bigger is a broken or hostile client. */
    public static final int MAX_BODY_BYTES = 64 * 1024;

    private HttpRequestReader() {}

    /**
     * @param in  buffered socket input
     * @param out socket output, only used to answer {@code Expect: 100-continue}
     * @return the parsed request, or {@code null} when the client sent nothing usable
     * @throws MalformedRequestException when the head or the declared length is invalid
     */
    public static MinimalHttpRequest read(InputStream in, OutputStream out) throws IOException {
        String start = readLineAscii(in);
        if (start == null || start.isEmpty()) {
            return null;
        }
        String[] p = start.split(" ", 3);
        if (p.length < 2) {
            throw new MalformedRequestException("bad request line: " + start);
        }
        String method = p[0].toUpperCase();
        String path = p[1];
        String ver = p.length > 2 ? p[2] : "HTTP/1.1";

        Map<String, String> headers = new LinkedHashMap<>();
        String line;
        while ((line = readLineAscii(in)) != null && !line.isEmpty()) {
            int idx = line.indexOf(':');
            if (idx > 0) {
                headers.put(line.substring(0, idx).trim().toLowerCase(), line.substring(idx + 1).trim());
            }
        }

        String expect = headers.get("expect");
        if (expect != null && expect.equalsIgnoreCase("100-continue")) {
            out.write("HTTP/1.1 100 Continue\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();
        }

        int len;
        try {
            len = Integer.parseInt(headers.getOrDefault("content-length", "0").trim());
        } catch (NumberFormatException e) {
            throw new MalformedRequestException("bad Content-Length");
        }
        if (len < 0 || len > MAX_BODY_BYTES) {
            throw new MalformedRequestException("Content-Length out of range: " + len);
        }

        byte[] body = in.readNBytes(len);
        if (body.length < len) {
            throw new MalformedRequestException("body truncated: " + body.length + " of " + len + " bytes");
        }
        return new MinimalHttpRequest(method, path, ver, headers, body);
    }

    static String readLineAscii(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int prev = -1, b;
        while ((b = in.read()) != -1) {
            if (prev == '\r' && b == '\n') {
                byte[] bytes = buf.toByteArray();
                int len = Math.max(0, bytes.length - 1);
                return new String(bytes, 0, len, StandardCharsets.US_ASCII);
            }
            buf.write(b);
            prev = b;
        }
        return (buf.size() == 0) ? null : buf.toString(StandardCharsets.US_ASCII);
    }

    /** The bytes on the socket are not an HTTP request we can serve. */
    public static class MalformedRequestException extends IOException {
        public MalformedRequestException(String message) {
            super(message);
        }
    }
}
