package org.severityoracle.api.interfaces;

import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.api.interfaces.http.HttpResponse;

public interface IHttpHandler {
    void handle(HttpRequest req, HttpResponse res) throws Exception;
}
