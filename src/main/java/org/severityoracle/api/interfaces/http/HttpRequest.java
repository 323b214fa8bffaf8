package org.severityoracle.api.interfaces.http;

/** Minimal request contract */
public interface HttpRequest {
    String method();

    /** Request target without the query string, still percent-encoded. */
    String path();

    String version();
    String header(String name);
    byte[] body();
}
