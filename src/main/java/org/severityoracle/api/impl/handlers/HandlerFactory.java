package org.severityoracle.api.impl.handlers;

import org.severityoracle.api.interfaces.IHandlerFactory;
import org.severityoracle.api.interfaces.IHttpHandler;
import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.common.http.HttpStatus;
import org.severityoracle.domain.interfaces.IAggregationService;
import org.severityoracle.domain.model.AggregationException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Routes a request to a fresh handler bound to its path parameters.
 */
public class HandlerFactory implements IHandlerFactory {

    private final IAggregationService service;

    public HandlerFactory(IAggregationService service) {
        this.service = service;
    }

    @Override
    public IHttpHandler create(HttpRequest req) {
        String m = req.method().toUpperCase();
        List<String> seg;
        try {
            seg = segments(req.path());
        } catch (IllegalArgumentException e) {
            return badRequest("malformed path: " + req.path());
        }

        try {
            if (seg.isEmpty()) return new NotFoundHandler();

            switch (seg.get(0)) {
                case "requests":
                    return requestRoute(m, seg);
                case "subjects":
                    if (seg.size() == 2 && "GET".equals(m)) return new SubjectHandler(service, seg.get(1));
                    break;
                case "settings":
                    if (seg.size() == 1 && "GET".equals(m)) return new SettingsHandler(service, SettingsHandler.Action.READ);
                    if (seg.size() == 2 && "PUT".equals(m)) {
                        if ("quorum".equals(seg.get(1))) return new SettingsHandler(service, SettingsHandler.Action.SET_QUORUM);
                        if ("thresholds".equals(seg.get(1))) return new SettingsHandler(service, SettingsHandler.Action.SET_THRESHOLDS);
                    }
                    break;
                case "access":
                    if (!"GET".equals(m) && !"PUT".equals(m)) break;
                    if (seg.size() == 2 && "admin".equals(seg.get(1))) return new AccessHandler(service, null);
                    if (seg.size() == 3 && "sources".equals(seg.get(1))) return new AccessHandler(service, seg.get(2));
                    break;
                case "health":
                    if (seg.size() == 1 && "GET".equals(m)) return new HealthHandler(service);
                    break;
                default:
                    break;
            }
        } catch (AggregationException e) {
            return badRequest(e.getMessage());
        }
        return new NotFoundHandler();
    }

    private IHttpHandler requestRoute(String m, List<String> seg) {
        if (seg.size() == 1) {
            return "POST".equals(m) ? new OpenRequestHandler(service) : new NotFoundHandler();
        }
        long id = JsonHandler.parseRequestId(seg.get(1));
        if (seg.size() == 2 && "GET".equals(m)) return new RequestStatusHandler(service, id);
        if (seg.size() == 3 && "POST".equals(m)) {
            switch (seg.get(2)) {
                case "submissions": return new SubmitHandler(service, id);
                case "finalize":    return new FinalizeHandler(service, id);
                case "cancel":      return new CancelRequestHandler(service, id);
                default:            break;
            }
        }
        return new NotFoundHandler();
    }

    /** Non-empty, percent-decoded path segments; any query string is ignored. */
    static List<String> segments(String path) {
        List<String> out = new ArrayList<>();
        int q = path.indexOf('?');
        String bare = q >= 0 ? path.substring(0, q) : path;
        for (String s : bare.split("/")) {
            if (!s.isEmpty()) {
                out.add(URLDecoder.decode(s.replace("+", "%2B"), StandardCharsets.UTF_8));
            }
        }
        return out;
    }

    private static IHttpHandler badRequest(String message) {
        return (req, res) -> JsonHandler.error(res, HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", message);
    }
}
