package org.severityoracle.api.impl.handlers;

import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.api.interfaces.http.HttpResponse;
import org.severityoracle.common.http.HttpStatus;
import org.severityoracle.domain.interfaces.IAggregationService;
import org.severityoracle.domain.model.FinalizedResult;

import java.util.Map;

/** POST /requests/{id}/finalize. Open to any caller. */
public class FinalizeHandler extends JsonHandler {

    private final IAggregationService service;
    private final long requestId;

    public FinalizeHandler(IAggregationService service, long requestId) {
        this.service = service;
        this.requestId = requestId;
    }

    @Override
    protected void serve(HttpRequest req, HttpResponse res) {
        FinalizedResult result = service.finalize(requestId);

        Map<String, Object> out = fields();
        out.put("requestId", result.requestId());
        out.put("median", result.median());
        out.put("category", String.valueOf(result.category().code()));
        out.put("submissions", result.submissionCount());
        json(res, HttpStatus.OK, out);
    }
}
