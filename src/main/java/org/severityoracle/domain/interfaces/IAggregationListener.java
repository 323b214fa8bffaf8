package org.severityoracle.domain.interfaces;

import org.severityoracle.domain.model.FinalizedResult;

/** Observer of oracle activity. All methods default to no-ops. */
public interface IAggregationListener {

    default void onRequestOpened(long requestId, String subject) {}

    default void onCancelRequested(long requestId) {}

    default void onSubmission(long requestId, String source, int severity) {}

    default void onFinalized(FinalizedResult result) {}
}
