package org.severityoracle;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.severityoracle.api.impl.HttpResponseImpl;
import org.severityoracle.api.impl.MinimalHttpRequest;
import org.severityoracle.api.impl.handlers.HandlerFactory;
import org.severityoracle.api.impl.handlers.JsonHandler;
import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.domain.impl.SeverityPolicy;
import org.severityoracle.domain.interfaces.IAggregationListener;
import org.severityoracle.domain.model.AggregationSettings;
import org.severityoracle.domain.model.ErrorKind;
import org.severityoracle.infrastructure.impl.AggregationServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HandlerFactoryTest {

    private final List<String> delivered = new ArrayList<>();
    private AggregationServiceImpl service;
    private HandlerFactory factory;

    @BeforeEach
    void setUp() {
        service = AggregationServiceImpl.create("admin", new AggregationSettings(2, 20, 100),
                SeverityPolicy.unbounded(),
                (id, replyTo, payload) -> delivered.add(id + ":" + new String(payload, StandardCharsets.US_ASCII)),
                new IAggregationListener() {});
        factory = new HandlerFactory(service);
    }

    private HttpResponseImpl call(String method, String path, String principal, String json) throws Exception {
        Map<String, String> headers = new HashMap<>();
        if (principal != null) headers.put("x-principal", principal);
        byte[] body = json == null ? new byte[0] : json.getBytes(StandardCharsets.UTF_8);
        MinimalHttpRequest req = new MinimalHttpRequest(method, path, "HTTP/1.1", headers, body);
        HttpResponseImpl res = new HttpResponseImpl();
        factory.create(req).handle(req, res);
        return res;
    }

    private static JsonObject json(HttpResponseImpl res) {
        return JsonParser.parseString(res.bodyText()).getAsJsonObject();
    }

    private static String errorOf(HttpResponseImpl res) {
        return json(res).get("error").getAsString();
    }

    @Test
    void fullLifecycleOverRoutes() throws Exception {
        assertEquals(200, call("PUT", "/access/sources/a", "admin", "{\"allowed\":true}").status());

        HttpResponseImpl opened = call("POST", "/requests", null, "{\"requestId\":9,\"subject\":\"Tokyo\"}");
        assertEquals(201, opened.status());
        assertEquals(1, json(opened).get("totalRequests").getAsLong());
        assertTrue(json(opened).get("callback").isJsonNull());

        HttpResponseImpl submitted = call("POST", "/requests/9/submissions", "a", "{\"severity\":10}");
        assertEquals(201, submitted.status());
        assertEquals(1, json(submitted).get("submissions").getAsInt());
        assertEquals(201, call("POST", "/requests/9/submissions", "admin", "{\"severity\":50}").status());

        HttpResponseImpl finalized = call("POST", "/requests/9/finalize", null, null);
        assertEquals(200, finalized.status());
        assertEquals(30, json(finalized).get("median").getAsInt());
        assertEquals("M", json(finalized).get("category").getAsString());
        assertEquals(List.of("9:M"), delivered);

        JsonObject status = json(call("GET", "/requests/9", null, null));
        assertTrue(status.get("finalized").getAsBoolean());
        assertEquals(2, status.get("submissionCount").getAsInt());
        assertEquals("Tokyo", status.get("subject").getAsString());

        assertEquals(9, json(call("GET", "/subjects/Tokyo", null, null)).get("requestId").getAsLong());
    }

    @Test
    void errorKindsMapToStatusCodes() throws Exception {
        call("POST", "/requests", null, "{\"requestId\":1,\"subject\":\"x\"}");

        HttpResponseImpl forbidden = call("POST", "/requests/1/submissions", "stranger", "{\"severity\":1}");
        assertEquals(403, forbidden.status());
        assertEquals("UNAUTHORIZED", errorOf(forbidden));

        call("POST", "/requests/1/submissions", "admin", "{\"severity\":1}");
        HttpResponseImpl dup = call("POST", "/requests/1/submissions", "admin", "{\"severity\":1}");
        assertEquals(409, dup.status());
        assertEquals("DUPLICATE_SUBMISSION", errorOf(dup));

        HttpResponseImpl quorum = call("POST", "/requests/1/finalize", null, null);
        assertEquals(409, quorum.status());
        assertEquals("QUORUM_NOT_MET", errorOf(quorum));

        HttpResponseImpl unknown = call("POST", "/requests/2/finalize", null, null);
        assertEquals(404, unknown.status());
        assertEquals("UNKNOWN_REQUEST", errorOf(unknown));

        assertEquals(400, call("POST", "/requests/1/submissions", "admin", "{\"severity\":1.5}").status());
        assertEquals(400, call("POST", "/requests/1/submissions", "admin", "{\"severity\":-1}").status());
        assertEquals(400, call("POST", "/requests/1/submissions", "admin", "not json").status());
        assertEquals(400, call("POST", "/requests", null, "{\"requestId\":3}").status());
        assertEquals(400, call("GET", "/requests/abc", null, null).status());
    }

    @Test
    void statusTable() throws Exception {
        assertEquals(403, JsonHandler.statusFor(ErrorKind.UNAUTHORIZED));
        assertEquals(400, JsonHandler.statusFor(ErrorKind.INVALID_ARGUMENT));
        assertEquals(409, JsonHandler.statusFor(ErrorKind.ALREADY_FINALIZED));
        assertEquals(500, JsonHandler.statusFor(ErrorKind.NO_VALUES));
        assertEquals(502, JsonHandler.statusFor(ErrorKind.DELIVERY_FAILED));
    }

    @Test
    void settingsRoutesAreAdminOnly() throws Exception {
        assertEquals(403, call("PUT", "/settings/quorum", "a", "{\"quorum\":4}").status());
        assertEquals(400, call("PUT", "/settings/thresholds", "admin", "{\"medium\":9,\"large\":9}").status());

        JsonObject s = json(call("PUT", "/settings/thresholds", "admin", "{\"medium\":5,\"large\":9}"));
        assertEquals(5, s.get("mediumThreshold").getAsInt());
        assertEquals(9, s.get("largeThreshold").getAsInt());

        call("PUT", "/settings/quorum", "admin", "{\"quorum\":4}");
        assertEquals(4, json(call("GET", "/settings", null, null)).get("quorum").getAsInt());
    }

    @Test
    void adminHandOver() throws Exception {
        assertEquals("admin", json(call("GET", "/access/admin", null, null)).get("admin").getAsString());
        assertEquals(400, call("PUT", "/access/admin", "admin", "{\"admin\":null}").status());
        assertEquals(403, call("PUT", "/access/admin", "ops", "{\"admin\":\"ops\"}").status());
        assertEquals("ops", json(call("PUT", "/access/admin", "admin", "{\"admin\":\"ops\"}")).get("admin").getAsString());
        assertFalse(json(call("GET", "/access/sources/ops", null, null)).get("allowed").getAsBoolean());
    }

    @Test
    void miscRoutes() throws Exception {
        HttpResponseImpl cancel = call("POST", "/requests/5/cancel", "anyone", null);
        assertEquals(202, cancel.status());
        assertFalse(json(cancel).get("cancelled").getAsBoolean());

        assertEquals("ok", json(call("GET", "/health", null, null)).get("status").getAsString());
        assertEquals(404, call("GET", "/subjects/Nowhere", null, null).status());
        assertEquals(404, call("DELETE", "/requests/1", null, null).status());
        assertEquals(404, call("GET", "/", null, null).status());

        assertEquals(200, call("GET", "/health?x=1", null, null).status());

        call("POST", "/requests", null, "{\"requestId\":1,\"subject\":\"New York\"}");
        assertEquals(1, json(call("GET", "/subjects/New%20York", null, null)).get("requestId").getAsLong());
    }

    @Test
    void routesIgnoreQueryOnAnyRequestType() throws Exception {
        HttpRequest raw = new HttpRequest() {
            @Override public String method() { return "GET"; }
            @Override public String path() { return "/health?verbose=1"; }
            @Override public String version() { return "HTTP/1.1"; }
            @Override public String header(String name) { return null; }
            @Override public byte[] body() { return new byte[0]; }
        };
        HttpResponseImpl res = new HttpResponseImpl();
        factory.create(raw).handle(raw, res);
        assertEquals(200, res.status());
    }
}
