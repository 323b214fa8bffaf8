package org.severityoracle.api.impl.handlers;

import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.api.interfaces.http.HttpResponse;
import org.severityoracle.common.http.HttpStatus;
import org.severityoracle.domain.interfaces.IAggregationService;

import java.util.Map;

public class HealthHandler extends JsonHandler {
    private final IAggregationService service;

    public HealthHandler(IAggregationService service) { this.service = service; }

    @Override
    protected void serve(HttpRequest req, HttpResponse res) {
        Map<String, Object> out = fields();
        out.put("status", "ok");
        out.put("totalRequests", service.totalRequests());
        json(res, HttpStatus.OK, out);
    }
}
