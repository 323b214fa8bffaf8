package org.severityoracle.api.impl.handlers;

import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.api.interfaces.http.HttpResponse;
import org.severityoracle.common.http.HttpStatus;
import org.severityoracle.domain.interfaces.IAggregationService;

import java.util.Map;

/** POST /requests/{id}/submissions  {"severity": 42}, reporting source in X-Principal. */
public class SubmitHandler extends JsonHandler {

    private final IAggregationService service;
    private final long requestId;

    public SubmitHandler(IAggregationService service, long requestId) {
        this.service = service;
        this.requestId = requestId;
    }

    @Override
    protected void serve(HttpRequest req, HttpResponse res) {
        String source = principal(req);
        int severity = requiredInt(jsonBody(req), "severity");

        service.submit(source, requestId, severity);

        Map<String, Object> out = fields();
        out.put("requestId", requestId);
        out.put("source", source);
        out.put("severity", severity);
        out.put("submissions", service.status(requestId).submissionCount());
        json(res, HttpStatus.CREATED, out);
    }
}
