package org.severityoracle.api.interfaces;

import org.severityoracle.api.interfaces.http.HttpRequest;

public interface IHandlerFactory {
    IHttpHandler create(HttpRequest req);
}
