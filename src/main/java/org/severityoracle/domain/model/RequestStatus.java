package org.severityoracle.domain.model;

/**
 * Read-only view of one aggregation request.
 * A request that was never opened reports {@code opened == false}, no subject and zero submissions.
 */
public record RequestStatus(long requestId, boolean opened, String subject, boolean finalized, int submissionCount) {

    public static RequestStatus notOpened(long requestId) {
        return new RequestStatus(requestId, false, null, false, 0);
    }
}
