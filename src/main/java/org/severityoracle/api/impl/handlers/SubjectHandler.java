package org.severityoracle.api.impl.handlers;

import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.api.interfaces.http.HttpResponse;
import org.severityoracle.common.http.HttpStatus;
import org.severityoracle.domain.interfaces.IAggregationService;

import java.util.Map;
import java.util.Optional;

/** GET /subjects/{name}: latest request opened for the subject. */
public class SubjectHandler extends JsonHandler {

    private final IAggregationService service;
    private final String subject;

    public SubjectHandler(IAggregationService service, String subject) {
        this.service = service;
        this.subject = subject;
    }

    @Override
    protected void serve(HttpRequest req, HttpResponse res) {
        Optional<Long> id = service.requestIdFor(subject);
        if (id.isEmpty()) {
            error(res, HttpStatus.NOT_FOUND, "UNKNOWN_SUBJECT", "no request was opened for subject " + subject);
            return;
        }
        Map<String, Object> out = fields();
        out.put("subject", subject);
        out.put("requestId", id.get());
        json(res, HttpStatus.OK, out);
    }
}
