package org.severityoracle.api.impl;

import org.severityoracle.api.interfaces.http.HttpRequest;

import java.util.Map;

public class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final String version;
    private final Map<String, String> headers;
    private final byte[] body;

    /** {@code headers} must hold lower-cased names; lookups are case-insensitive. */
    public MinimalHttpRequest(String method, String path, String version,
                              Map<String, String> headers, byte[] body) {
        this.method = method;
        this.path = stripQuery(path);
        this.version = version;
        this.headers = headers;
        this.body = body == null ? new byte[0] : body;
    }

    @Override public String method() { return method; }
    @Override public String path() { return path; }
    @Override public String version() { return version; }

    @Override
    public String header(String name) {
        if (name == null) return null;
        return headers.get(name.toLowerCase());
    }

    @Override public byte[] body() { return body; }

    private static String stripQuery(String target) {
        if (target == null || target.isEmpty()) return "/";
        int q = target.indexOf('?');
        return q >= 0 ? target.substring(0, q) : target;
    }
}
