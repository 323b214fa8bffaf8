package org.severityoracle.domain.interfaces;

import org.severityoracle.domain.impl.AggregationRequest;

import java.util.Optional;

public interface IRequestRegistry {

    /**
     * Open (or re-open) {@code requestId} for {@code subject}. Re-opening wipes submissions and
     * the finalized flag, so callers own request id uniqueness per logical event. {@code replyTo}
     * is stored with the round under the request's lock and may be null.
     */
    AggregationRequest open(long requestId, String subject, String replyTo);

    Optional<AggregationRequest> find(long requestId);

    /** Most recently opened request for the subject (last write wins). */
    Optional<Long> requestIdFor(String subject);

    long totalOpened();
}
