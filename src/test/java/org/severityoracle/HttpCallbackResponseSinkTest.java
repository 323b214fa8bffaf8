package org.severityoracle;

import org.severityoracle.api.impl.MinimalHttpRequest;
import org.severityoracle.common.http.DefaultHttpWire;
import org.severityoracle.common.util.SimpleRetryExecutor;
import org.severityoracle.domain.impl.SeverityPolicy;
import org.severityoracle.domain.interfaces.IAggregationListener;
import org.severityoracle.domain.model.AggregationException;
import org.severityoracle.domain.model.AggregationSettings;
import org.severityoracle.domain.model.ErrorKind;
import org.severityoracle.domain.model.ResponseDeliveryException;
import org.severityoracle.infrastructure.impl.AggregationServiceImpl;
import org.severityoracle.infrastructure.impl.HttpCallbackResponseSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HttpCallbackResponseSinkTest {

    private final List<Long> fallbackIds = new ArrayList<>();
    private HttpCallbackResponseSink sink;

    @BeforeEach
    void setUp() {
        sink = sinkWithReadTimeout(2_000);
    }

    private HttpCallbackResponseSink sinkWithReadTimeout(int readTimeoutMs) {
        return new HttpCallbackResponseSink(new DefaultHttpWire(500, readTimeoutMs),
                new SimpleRetryExecutor(3, 1, 5, 0),
                (id, replyTo, payload) -> fallbackIds.add(id));
    }

    @Test
    void postsCategoryByteToCallback() throws Exception {
        try (NetTestUtils.CallbackReceiver receiver = new NetTestUtils.CallbackReceiver()) {
            sink.deliver(7, receiver.address("/results"), new byte[]{'L'});

            MinimalHttpRequest got = receiver.next(2_000);
            assertNotNull(got);
            assertEquals("POST", got.method());
            assertEquals("/results", got.path());
            assertEquals("7", got.header("X-Request-Id"));
            assertEquals("L", new String(got.body(), StandardCharsets.US_ASCII));
            assertTrue(fallbackIds.isEmpty());
        }
    }

    @Test
    void resendsWhenConsumerSaysItDidNotProcess() throws Exception {
        try (NetTestUtils.CallbackReceiver receiver = new NetTestUtils.CallbackReceiver(503, 429)) {
            sink.deliver(1, receiver.address("/"), new byte[]{'S'});
            assertNotNull(receiver.next(2_000));
            assertNotNull(receiver.next(2_000));
            assertNotNull(receiver.next(2_000));
        }
    }

    @Test
    void slowAcknowledgementIsNotResent() throws Exception {
        HttpCallbackResponseSink impatient = sinkWithReadTimeout(300);
        try (NetTestUtils.CallbackReceiver receiver = new NetTestUtils.CallbackReceiver().ackDelay(600)) {
            impatient.deliver(1, receiver.address("/"), new byte[]{'M'});

            assertNotNull(receiver.next(2_000));
            assertNull(receiver.next(1_000));
        }
    }

    @Test
    void serverErrorAfterSendingIsNotResent() throws Exception {
        try (NetTestUtils.CallbackReceiver receiver = new NetTestUtils.CallbackReceiver(500)) {
            sink.deliver(1, receiver.address("/"), new byte[]{'S'});
            assertNotNull(receiver.next(2_000));
            assertNull(receiver.next(300));
        }
    }

    @Test
    void refusalFailsWithoutResending() throws Exception {
        try (NetTestUtils.CallbackReceiver receiver = new NetTestUtils.CallbackReceiver(400)) {
            assertThrows(ResponseDeliveryException.class, () -> sink.deliver(1, receiver.address("/"), new byte[]{'S'}));
            assertNotNull(receiver.next(2_000));
            assertNull(receiver.next(300));
        }
    }

    @Test
    void givesUpWhenConsumerNeverTakesIt() throws Exception {
        try (NetTestUtils.CallbackReceiver receiver = new NetTestUtils.CallbackReceiver(503, 503, 503)) {
            assertThrows(ResponseDeliveryException.class, () -> sink.deliver(1, receiver.address("/"), new byte[]{'S'}));
        }

        String gone = "localhost:" + NetTestUtils.freePort() + "/gone";
        assertThrows(ResponseDeliveryException.class, () -> sink.deliver(2, gone, new byte[]{'S'}));
    }

    @Test
    void requestsWithoutAddressUseFallback() throws Exception {
        sink.deliver(3, null, new byte[]{'M'});
        sink.deliver(4, " ", new byte[]{'M'});
        assertEquals(List.of(3L, 4L), fallbackIds);
    }

    @Test
    void badAddressIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> sink.checkReplyTo("host:port"));
        assertThrows(ResponseDeliveryException.class, () -> sink.deliver(1, "host:port", new byte[]{'S'}));
        sink.checkReplyTo("consumer:8080/results");
    }

    @Test
    void slowConsumerGetsTheResultExactlyOnce() throws Exception {
        AggregationServiceImpl oracle = AggregationServiceImpl.create("admin", new AggregationSettings(1, 20, 100),
                SeverityPolicy.unbounded(), sinkWithReadTimeout(300), new IAggregationListener() {});
        try (NetTestUtils.CallbackReceiver receiver = new NetTestUtils.CallbackReceiver().ackDelay(600)) {
            oracle.open(1, "Tokyo", receiver.address("/severity"));
            oracle.submit("admin", 1, 50);

            oracle.finalize(1);
            assertTrue(oracle.status(1).finalized());
            AggregationException again = assertThrows(AggregationException.class, () -> oracle.finalize(1));
            assertEquals(ErrorKind.ALREADY_FINALIZED, again.kind());

            assertNotNull(receiver.next(2_000));
            assertNull(receiver.next(1_000));
        }

        AggregationException bad = assertThrows(AggregationException.class, () -> oracle.open(2, "Osaka", "host:port"));
        assertEquals(ErrorKind.INVALID_ARGUMENT, bad.kind());
        assertFalse(oracle.status(2).opened());
    }
}
