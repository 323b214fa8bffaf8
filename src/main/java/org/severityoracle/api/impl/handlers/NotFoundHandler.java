package org.severityoracle.api.impl.handlers;

import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.api.interfaces.http.HttpResponse;
import org.severityoracle.common.http.HttpStatus;

public class NotFoundHandler extends JsonHandler {
    @Override
    protected void serve(HttpRequest req, HttpResponse res) {
        error(res, HttpStatus.NOT_FOUND, "NOT_FOUND", "no route for " + req.method() + " " + req.path());
    }
}
