package org.severityoracle.api.impl.handlers;

import com.google.gson.JsonObject;
import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.api.interfaces.http.HttpResponse;
import org.severityoracle.common.http.HttpStatus;
import org.severityoracle.domain.interfaces.IAggregationService;

import java.util.Map;

/**
 * POST /requests  {"requestId": 7, "subject": "Tokyo", "callback": "host:port/path"}
 * <p>
 * The callback is optional; without it the finalized category only reaches the fallback sink.
 */
public class OpenRequestHandler extends JsonHandler {

    private final IAggregationService service;

    public OpenRequestHandler(IAggregationService service) {
        this.service = service;
    }

    @Override
    protected void serve(HttpRequest req, HttpResponse res) {
        JsonObject body = jsonBody(req);
        long requestId = requiredLong(body, "requestId");
        String subject = requiredString(body, "subject");
        String callback = optionalString(body, "callback");

        service.open(requestId, subject, callback);

        Map<String, Object> out = fields();
        out.put("requestId", requestId);
        out.put("subject", subject);
        out.put("callback", callback);
        out.put("totalRequests", service.totalRequests());
        json(res, HttpStatus.CREATED, out);
    }
}
