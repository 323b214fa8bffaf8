package org.severityoracle.common.http;

/** Status codes the oracle speaks, with their reason phrases. */
public final class HttpStatus {

    public static final int OK = 200;
    public static final int CREATED = 201;
    public static final int ACCEPTED = 202;
    public static final int NO_CONTENT = 204;
    public static final int BAD_REQUEST = 400;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int METHOD_NOT_ALLOWED = 405;
    public static final int CONFLICT = 409;
    public static final int TOO_MANY_REQUESTS = 429;
    public static final int INTERNAL_SERVER_ERROR = 500;
    public static final int BAD_GATEWAY = 502;
    public static final int SERVICE_UNAVAILABLE = 503;

    private HttpStatus() {}

    public static String reason(int code) {
        return switch (code) {
            case OK -> "OK";
            case CREATED -> "Created";
            case ACCEPTED -> "Accepted";
            case NO_CONTENT -> "No Content";
            case BAD_REQUEST -> "Bad Request";
            case FORBIDDEN -> "Forbidden";
            case NOT_FOUND -> "Not Found";
            case METHOD_NOT_ALLOWED -> "Method Not Allowed";
            case CONFLICT -> "Conflict";
            case TOO_MANY_REQUESTS -> "Too Many Requests";
            case INTERNAL_SERVER_ERROR -> "Internal Server Error";
            case BAD_GATEWAY -> "Bad Gateway";
            case SERVICE_UNAVAILABLE -> "Service Unavailable";
            default -> "Unknown";
        };
    }

    /** Worth another attempt: the peer is overloaded or briefly broken. */
    public static boolean isRetryable(int code) {
        return code == TOO_MANY_REQUESTS || code == INTERNAL_SERVER_ERROR || code == SERVICE_UNAVAILABLE;
    }

    /** The peer says it did not process the request, so resending cannot duplicate it. */
    public static boolean isUnprocessed(int code) {
        return code == TOO_MANY_REQUESTS || code == SERVICE_UNAVAILABLE;
    }

    public static boolean isSuccess(int code) {
        return code >= 200 && code < 300;
    }
}
