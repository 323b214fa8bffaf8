package org.severityoracle.domain.interfaces;

import org.severityoracle.domain.model.AggregationSettings;
import org.severityoracle.domain.model.FinalizedResult;
import org.severityoracle.domain.model.RequestStatus;

import java.util.Optional;

/**
 * The oracle as seen by the host layer. Every mutating call either completes or throws
 * {@link org.severityoracle.domain.model.AggregationException} without side effects.
 */
public interface IAggregationService {

    // ---- request lifecycle ----
    void open(long requestId, String subject);

    /** Open with the address the finalized category should be pushed to; null means none. */
    void open(long requestId, String subject, String replyTo);
    void cancel(long requestId);
    void submit(String source, long requestId, int severity);
    FinalizedResult finalize(long requestId);

    // ---- admin ----
    void setAdmin(String caller, String newAdmin);
    void setSource(String caller, String source, boolean allowed);
    void setQuorum(String caller, int quorum);
    void setThresholds(String caller, int medium, int large);

    // ---- queries ----
    Optional<Long> requestIdFor(String subject);
    long totalRequests();
    RequestStatus status(long requestId);
    String admin();
    boolean isSource(String principal);
    AggregationSettings settings();
}
