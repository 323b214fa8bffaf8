package org.severityoracle.infrastructure.impl;

import org.severityoracle.domain.interfaces.IAggregationListener;
import org.severityoracle.domain.model.FinalizedResult;

/** Writes every oracle notification as one tagged console line. */
public class ConsoleAggregationListener implements IAggregationListener {

    @Override
    public void onRequestOpened(long requestId, String subject) {
        System.out.println("[Oracle] opened request=" + requestId + " subject=\"" + subject + "\"");
    }

    @Override
    public void onCancelRequested(long requestId) {
        System.out.println("[Oracle] cancel requested for request=" + requestId + " (ignored)");
    }

    @Override
    public void onSubmission(long requestId, String source, int severity) {
        System.out.println("[Oracle] submission request=" + requestId + " source=" + source + " severity=" + severity);
    }

    @Override
    public void onFinalized(FinalizedResult result) {
        System.out.println("[Oracle] finalized request=" + result.requestId()
                + " median=" + result.median()
                + " category=" + result.category()
                + " submissions=" + result.submissionCount());
    }
}
