package org.severityoracle;

import org.severityoracle.api.impl.HttpRequestReader;
import org.severityoracle.api.impl.MinimalHttpRequest;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HttpRequestReaderTest {

    private static MinimalHttpRequest read(String raw, ByteArrayOutputStream out) throws IOException {
        return HttpRequestReader.read(new ByteArrayInputStream(raw.getBytes(StandardCharsets.UTF_8)), out);
    }

    @Test
    void readsHeadAndBody() throws Exception {
        MinimalHttpRequest req = read("post /requests/7/submissions?x=1 HTTP/1.1\r\n"
                + "X-Principal: station-a\r\nContent-Length: 15\r\n\r\n{\"severity\":42}", new ByteArrayOutputStream());

        assertEquals("POST", req.method());
        assertEquals("/requests/7/submissions", req.path());
        assertEquals("HTTP/1.1", req.version());
        assertEquals("station-a", req.header("x-principal"));
        assertEquals("station-a", req.header("X-PRINCIPAL"));
        assertEquals("{\"severity\":42}", new String(req.body(), StandardCharsets.UTF_8));
    }

    @Test
    void emptyStreamYieldsNull() throws Exception {
        assertNull(read("", new ByteArrayOutputStream()));
        assertNull(read("\r\n", new ByteArrayOutputStream()));
    }

    @Test
    void answersExpectContinue() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        MinimalHttpRequest req = read("PUT /settings/quorum HTTP/1.1\r\nExpect: 100-continue\r\n"
                + "Content-Length: 12\r\n\r\n{\"quorum\":5}", out);
        assertEquals("HTTP/1.1 100 Continue\r\n\r\n", out.toString(StandardCharsets.US_ASCII));
        assertEquals(12, req.body().length);
    }

    @Test
    void rejectsMalformedRequests() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertThrows(HttpRequestReader.MalformedRequestException.class, () -> read("GARBAGE\r\n\r\n", out));
        assertThrows(HttpRequestReader.MalformedRequestException.class,
                () -> read("POST / HTTP/1.1\r\nContent-Length: abc\r\n\r\n", out));
        assertThrows(HttpRequestReader.MalformedRequestException.class,
                () -> read("POST / HTTP/1.1\r\nContent-Length: -1\r\n\r\n", out));
        assertThrows(HttpRequestReader.MalformedRequestException.class,
                () -> read("POST / HTTP/1.1\r\nContent-Length: " + (HttpRequestReader.MAX_BODY_BYTES + 1) + "\r\n\r\n", out));
        assertThrows(HttpRequestReader.MalformedRequestException.class,
                () -> read("POST / HTTP/1.1\r\nContent-Length: 10\r\n\r\nabc", out));
    }
}
