package org.severityoracle.api.impl.handlers;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.severityoracle.api.interfaces.IHttpHandler;
import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.api.interfaces.http.HttpResponse;
import org.severityoracle.common.http.HttpStatus;
import org.severityoracle.domain.model.AggregationException;
import org.severityoracle.domain.model.ErrorKind;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared plumbing for the oracle's JSON routes: body parsing, caller identity, and turning
 * {@link AggregationException}s into status codes with a {@code {"error","message"}} body.
 */
public abstract class JsonHandler implements IHttpHandler {

    public static final String PRINCIPAL_HEADER = "X-Principal";

    protected static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    @Override
    public final void handle(HttpRequest req, HttpResponse res) {
        try {
            serve(req, res);
        } catch (AggregationException e) {
            error(res, statusFor(e.kind()), e.kind().name(), e.getMessage());
        }
    }

    protected abstract void serve(HttpRequest req, HttpResponse res);

    public static int statusFor(ErrorKind kind) {
        return switch (kind) {
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case ALREADY_FINALIZED, DUPLICATE_SUBMISSION, QUORUM_NOT_MET -> HttpStatus.CONFLICT;
            case UNKNOWN_REQUEST -> HttpStatus.NOT_FOUND;
            case DELIVERY_FAILED -> HttpStatus.BAD_GATEWAY;
            case NO_VALUES -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    /** Caller identity as asserted by the channel; null when absent. */
    protected static String principal(HttpRequest req) {
        String p = req.header(PRINCIPAL_HEADER);
        return (p == null || p.isBlank()) ? null : p.trim();
    }

    protected static JsonObject jsonBody(HttpRequest req) {
        byte[] bytes = req.body();
        String text = bytes == null ? "" : new String(bytes, StandardCharsets.UTF_8).trim();
        if (text.isEmpty()) {
            throw AggregationException.invalidArgument("request body must be a JSON object");
        }
        try {
            JsonElement root = JsonParser.parseString(text);
            if (!root.isJsonObject()) {
                throw AggregationException.invalidArgument("request body must be a JSON object");
            }
            return root.getAsJsonObject();
        } catch (JsonParseException e) {
            throw AggregationException.invalidArgument("invalid JSON: " + e.getMessage());
        }
    }

    protected static long requiredLong(JsonObject obj, String name) {
        return exactNumber(obj, name).longValueExact();
    }

    protected static int requiredInt(JsonObject obj, String name) {
        try {
            return exactNumber(obj, name).intValueExact();
        } catch (ArithmeticException e) {
            throw AggregationException.invalidArgument("'" + name + "' is out of range");
        }
    }

    protected static String requiredString(JsonObject obj, String name) {
        JsonElement el = obj.get(name);
        if (el == null || !el.isJsonPrimitive() || !el.getAsJsonPrimitive().isString()) {
            throw AggregationException.invalidArgument("'" + name + "' must be a string");
        }
        return el.getAsString();
    }

    protected static String optionalString(JsonObject obj, String name) {
        JsonElement el = obj.get(name);
        if (el == null || el.isJsonNull()) return null;
        if (!el.isJsonPrimitive() || !el.getAsJsonPrimitive().isString()) {
            throw AggregationException.invalidArgument("'" + name + "' must be a string");
        }
        return el.getAsString();
    }

    protected static boolean requiredBoolean(JsonObject obj, String name) {
        JsonElement el = obj.get(name);
        if (el == null || !el.isJsonPrimitive() || !el.getAsJsonPrimitive().isBoolean()) {
            throw AggregationException.invalidArgument("'" + name + "' must be true or false");
        }
        return el.getAsBoolean();
    }

    /** Request id from a path segment. */
    public static long parseRequestId(String segment) {
        try {
            return Long.parseLong(segment);
        } catch (NumberFormatException e) {
            throw AggregationException.invalidArgument("request id must be an integer, got '" + segment + "'");
        }
    }

    private static BigDecimal exactNumber(JsonObject obj, String name) {
        JsonElement el = obj.get(name);
        if (el == null || !el.isJsonPrimitive() || !((JsonPrimitive) el).isNumber()) {
            throw AggregationException.invalidArgument("'" + name + "' must be an integer");
        }
        BigDecimal value;
        try {
            value = el.getAsBigDecimal();
        } catch (NumberFormatException e) {
            throw AggregationException.invalidArgument("'" + name + "' must be an integer");
        }
        if (value.stripTrailingZeros().scale() > 0) {
            throw AggregationException.invalidArgument("'" + name + "' must be an integer");
        }
        try {
            // probe the range once so callers get INVALID_ARGUMENT instead of ArithmeticException
            value.longValueExact();
        } catch (ArithmeticException e) {
            throw AggregationException.invalidArgument("'" + name + "' is out of range");
        }
        return value;
    }

    protected static Map<String, Object> fields() {
        return new LinkedHashMap<>();
    }

    protected static void json(HttpResponse res, int code, Object body) {
        res.status(code, HttpStatus.reason(code));
        res.header("Content-Type", "application/json; charset=utf-8");
        res.body(GSON.toJson(body));
    }

    public static void error(HttpResponse res, int code, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        res.status(code, HttpStatus.reason(code));
        res.header("Content-Type", "application/json; charset=utf-8");
        res.body(GSON.toJson(body));
    }
}
