package org.severityoracle.app;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.severityoracle.common.http.DefaultHttpWire;
import org.severityoracle.common.http.HttpMessages;
import org.severityoracle.common.http.HttpStatus;
import org.severityoracle.common.interfaces.HttpWire;
import org.severityoracle.common.interfaces.RetryExecutor;
import org.severityoracle.common.util.SimpleRetryExecutor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line client for the oracle's HTTP API.
 * <pre>
 * ReporterClient localhost:4567 open 7 Tokyo [callback]
 * ReporterClient localhost:4567 submit 7 42 station-a
 * ReporterClient localhost:4567 finalize 7
 * ReporterClient localhost:4567 status 7
 * </pre>
 * Retries 429/500/503 answers and connection failures with exponential backoff.
 */
public final class ReporterClient {

    private static final int DEFAULT_PORT = 4567;

    private static final Gson GSON = new Gson();
    private static final Gson PRETTY = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private static final HttpWire HTTP = new DefaultHttpWire();

    // 4 attempts, 200 -> 400 -> 800 ms + <= 100 ms jitter
    private static final RetryExecutor RETRY = new SimpleRetryExecutor(4, 200, 1600, 100);

    private ReporterClient() {}

    /** One HTTP call derived from the command line. {@code body} is null for GET. */
    public record Command(String method, String path, String principal, String body) {}

    public static void main(String[] args) throws Exception {
        if (args.length < 3) {
            System.out.println(usage());
            return;
        }

        HttpMessages.Target target = HttpMessages.parseTarget(args[0], DEFAULT_PORT, "/");
        String[] rest = new String[args.length - 1];
        System.arraycopy(args, 1, rest, 0, rest.length);

        Command cmd;
        try {
            cmd = parse(rest);
        } catch (IllegalArgumentException e) {
            System.out.println(e.getMessage());
            System.out.println(usage());
            return;
        }

        String resp = send(target, cmd);
        System.out.println(HttpMessages.firstLine(resp));
        String body = HttpMessages.bodyOf(resp);
        if (!body.isBlank()) {
            System.out.println(pretty(body));
        }
    }

    /**
     * Turns {@code <command> <args...>} into the HTTP call to make.
     *
     * @throws IllegalArgumentException on an unknown command or wrong arguments
     */
    public static Command parse(String[] args) {
        if (args.length == 0) {
            throw new IllegalArgumentException("missing command");
        }
        String command = args[0].toLowerCase();
        switch (command) {
            case "open": {
                requireArgs(args, 3, 4);
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("requestId", requestId(args[1]));
                body.put("subject", args[2]);
                if (args.length == 4) body.put("callback", args[3]);
                return new Command("POST", "/requests", null, GSON.toJson(body));
            }
            case "submit": {
                requireArgs(args, 4, 4);
                long id = requestId(args[1]);
                int severity;
                try {
                    severity = Integer.parseInt(args[2]);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("severity must be an integer: " + args[2]);
                }
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("severity", severity);
                return new Command("POST", "/requests/" + id + "/submissions", args[3], GSON.toJson(body));
            }
            case "finalize": {
                requireArgs(args, 2, 2);
                return new Command("POST", "/requests/" + requestId(args[1]) + "/finalize", null, "");
            }
            case "status": {
                requireArgs(args, 2, 2);
                return new Command("GET", "/requests/" + requestId(args[1]), null, null);
            }
            default:
                throw new IllegalArgumentException("unknown command: " + args[0]);
        }
    }

    private static String send(HttpMessages.Target target, Command cmd) throws Exception {
        byte[] body = cmd.body() == null ? new byte[0] : cmd.body().getBytes(StandardCharsets.UTF_8);
        Map<String, String> extra = new LinkedHashMap<>();
        extra.put("User-Agent", "ReporterClient/1.0");
        if (cmd.principal() != null) extra.put("X-Principal", cmd.principal());
        if (cmd.body() != null) extra.put("Content-Type", "application/json; charset=utf-8");
        String head = HTTP.buildRequest(cmd.method(), cmd.path(), target.host(), target.port(), extra, body.length);

        return RETRY.execute(() -> {
            String r = HTTP.exchange(target.host(), target.port(), head, body);
            int code = HttpMessages.statusCodeOf(HttpMessages.firstLine(r));
            if (HttpStatus.isRetryable(code)) {
                throw new IOException("HTTP " + code + " retryable");
            }
            return r;
        });
    }

    private static String pretty(String json) {
        try {
            return PRETTY.toJson(JsonParser.parseString(json));
        } catch (JsonParseException e) {
            return json;
        }
    }

    private static long requestId(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("request id must be an integer: " + raw);
        }
    }

    private static void requireArgs(String[] args, int min, int max) {
        if (args.length < min || args.length > max) {
            throw new IllegalArgumentException("wrong number of arguments for " + args[0]);
        }
    }

    private static String usage() {
        return "Usage:\n"
                + "  ReporterClient <host:port> open <requestId> <subject> [callback]\n"
                + "  ReporterClient <host:port> submit <requestId> <severity> <principal>\n"
                + "  ReporterClient <host:port> finalize <requestId>\n"
                + "  ReporterClient <host:port> status <requestId>";
    }
}
