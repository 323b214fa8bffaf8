package org.severityoracle.api.impl.handlers;

import com.google.gson.JsonObject;
import org.severityoracle.api.interfaces.http.HttpRequest;
import org.severityoracle.api.interfaces.http.HttpResponse;
import org.severityoracle.common.http.HttpStatus;
import org.severityoracle.domain.interfaces.IAggregationService;

/**
 * GET /settings, PUT /settings/quorum {"quorum"}, PUT /settings/thresholds {"medium","large"}.
 * Every answer carries the settings in force afterwards.
 */
public class SettingsHandler extends JsonHandler {

    public enum Action { READ, SET_QUORUM, SET_THRESHOLDS }

    private final IAggregationService service;
    private final Action action;

    public SettingsHandler(IAggregationService service, Action action) {
        this.service = service;
        this.action = action;
    }

    @Override
    protected void serve(HttpRequest req, HttpResponse res) {
        switch (action) {
            case SET_QUORUM -> {
                JsonObject body = jsonBody(req);
                service.setQuorum(principal(req), requiredInt(body, "quorum"));
            }
            case SET_THRESHOLDS -> {
                JsonObject body = jsonBody(req);
                service.setThresholds(principal(req), requiredInt(body, "medium"), requiredInt(body, "large"));
            }
            case READ -> { }
        }
        json(res, HttpStatus.OK, service.settings());
    }
}
