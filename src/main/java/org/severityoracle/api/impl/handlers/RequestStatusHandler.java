package org.severityoracle.api.impl.handlers;

import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.api.interfaces.http.HttpResponse;
import org.severityoracle.common.http.HttpStatus;
import org.severityoracle.domain.interfaces.IAggregationService;

/** GET /requests/{id}. Never-opened ids answer 200 with {@code opened: false}. */
public class RequestStatusHandler extends JsonHandler {

    private final IAggregationService service;
    private final long requestId;

    public RequestStatusHandler(IAggregationService service, long requestId) {
        this.service = service;
        this.requestId = requestId;
    }

    @Override
    protected void serve(HttpRequest req, HttpResponse res) {
        json(res, HttpStatus.OK, service.status(requestId));
    }
}
