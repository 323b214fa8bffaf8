package org.severityoracle.api.impl.handlers;

import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.api.interfaces.http.HttpResponse;
import org.severityoracle.common.http.HttpStatus;
import org.severityoracle.domain.interfaces.IAggregationService;

import java.util.Map;

/**
 * GET/PUT /access/admin and GET/PUT /access/sources/{principal}.
 * A null {@code source} targets the admin route.
 */
public class AccessHandler extends JsonHandler {

    private final IAggregationService service;
    private final String source;

    public AccessHandler(IAggregationService service, String source) {
        this.service = service;
        this.source = source;
    }

    @Override
    protected void serve(HttpRequest req, HttpResponse res) {
        boolean write = "PUT".equals(req.method());
        Map<String, Object> out = fields();
        if (source == null) {
            if (write) {
                service.setAdmin(principal(req), optionalString(jsonBody(req), "admin"));
            }
            out.put("admin", service.admin());
        } else {
            if (write) {
                service.setSource(principal(req), source, requiredBoolean(jsonBody(req), "allowed"));
            }
            out.put("source", source);
            out.put("allowed", service.isSource(source));
        }
        json(res, HttpStatus.OK, out);
    }
}
