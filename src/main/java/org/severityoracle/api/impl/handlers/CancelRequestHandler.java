package org.severityoracle.api.impl.handlers;

import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.api.interfaces.http.HttpResponse;
import org.severityoracle.common.http.HttpStatus;
import org.severityoracle.domain.interfaces.IAggregationService;

import java.util.Map;

/** POST /requests/{id}/cancel. Accepted, never acted upon. */
public class CancelRequestHandler extends JsonHandler {

    private final IAggregationService service;
    private final long requestId;

    public CancelRequestHandler(IAggregationService service, long requestId) {
        this.service = service;
        this.requestId = requestId;
    }

    @Override
    protected void serve(HttpRequest req, HttpResponse res) {
        service.cancel(requestId);
        Map<String, Object> out = fields();
        out.put("requestId", requestId);
        out.put("accepted", true);
        out.put("cancelled", false);
        json(res, HttpStatus.ACCEPTED, out);
    }
}
