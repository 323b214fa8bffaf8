package org.severityoracle.common.http;

/**
 * Pulls pieces out of a raw HTTP message string.
 */
public final class HttpMessages {

    private HttpMessages() {}

    /** First line (status line) of an HTTP message. */
    public static String firstLine(String http) {
        int i = http.indexOf("\r\n");
        return (i >= 0) ? http.substring(0, i) : http;
    }

    /** Numeric status from a status line, or -1 if it cannot be parsed. */
    public static int statusCodeOf(String statusLine) {
        String[] parts = statusLine.split(" ");
        if (parts.length >= 2) {
            try {
                return Integer.parseInt(parts[1]);
            } catch (NumberFormatException ignored) {
                // not a status line
            }
        }
        return -1;
    }

    /** Header value (case-insensitive name) from the head section, or null. */
    public static String headerValue(String http, String name) {
        int headEnd = http.indexOf("\r\n\r\n");
        String headers = (headEnd >= 0) ? http.substring(0, headEnd) : http;
        for (String line : headers.split("\r\n")) {
            int i = line.indexOf(':');
            if (i > 0 && line.substring(0, i).trim().equalsIgnoreCase(name)) {
                return line.substring(i + 1).trim();
            }
        }
        return null;
    }

    /** Everything after the blank line. */
    public static String bodyOf(String http) {
        int i = http.indexOf("\r\n\r\n");
        return (i >= 0) ? http.substring(i + 4) : "";
    }

    /**
     * Splits {@code host:port[/path]} (optionally prefixed with http://) into its parts.
     */
    public static Target parseTarget(String urlOrHostPort, int defaultPort, String defaultPath) {
        String hostPort = urlOrHostPort.replaceFirst("^https?://", "");
        int slash = hostPort.indexOf('/');
        String hp = slash >= 0 ? hostPort.substring(0, slash) : hostPort;
        String path = slash >= 0 ? hostPort.substring(slash) : defaultPath;

        int colon = hp.indexOf(':');
        String host = colon >= 0 ? hp.substring(0, colon) : hp;
        int port = defaultPort;
        if (colon >= 0) {
            try {
                port = Integer.parseInt(hp.substring(colon + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("bad port in " + urlOrHostPort, e);
            }
        }
        if (host.isBlank()) {
            throw new IllegalArgumentException("missing host in " + urlOrHostPort);
        }
        return new Target(host, port, path.startsWith("/") ? path : "/" + path);
    }

    public record Target(String host, int port, String path) {}
}
