package org.severityoracle.domain.impl;

import org.severityoracle.domain.model.AggregationException;
import org.severityoracle.domain.model.ErrorKind;
import org.severityoracle.domain.model.RequestStatus;
import org.severityoracle.domain.model.Submission;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Aggregation state of one request id: who has reported, what they reported, and whether the
 * result has been sealed.
 * <p>
 * The object lives as long as the registry and is reset in place on re-open, so its lock is the
 * single serialization point for everything that touches this id. Mutators must be called with
 * {@link #lock()} held.
 */
public final class AggregationRequest {

    private final long id;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private boolean opened;
    private String subject;
    private String replyTo;
    private boolean finalized;
    private final List<Submission> submissions = new ArrayList<>();
    private final Set<String> submittedBy = new HashSet<>();

    public AggregationRequest(long id) {
        this.id = id;
    }

    public long id() { return id; }

    public ReentrantLock lock() { return lock; }

    /**
     * Back to an empty, unfinalized request for {@code newSubject}. The reply address belongs to
     * this round only; a null address drops the previous one.
     */
    public void reset(String newSubject, String newReplyTo) {
        checkLocked();
        opened = true;
        subject = newSubject;
        replyTo = newReplyTo;
        finalized = false;
        submissions.clear();
        submittedBy.clear();
    }

    /**
     * Record one report.
     *
     * @throws AggregationException UNKNOWN_REQUEST before the first open, ALREADY_FINALIZED once sealed,
     *                              DUPLICATE_SUBMISSION on a second report from {@code source}
     */
    public void accept(String source, int severity) {
        checkLocked();
        if (!opened) {
            throw AggregationException.unknownRequest(id);
        }
        if (finalized) {
            throw AggregationException.alreadyFinalized(id);
        }
        if (submittedBy.contains(source)) {
            throw new AggregationException(ErrorKind.DUPLICATE_SUBMISSION,
                    "source " + source + " already submitted to request " + id);
        }
        submissions.add(new Submission(source, severity));
        submittedBy.add(source);
    }

    public void markFinalized() {
        checkLocked();
        finalized = true;
    }

    /** False only for a slot the registry created but has not reset yet. */
    public boolean isOpened() {
        checkLocked();
        return opened;
    }

    /** Where the originator of the current round wants the result; null when it did not say. */
    public String replyTo() {
        checkLocked();
        return replyTo;
    }

    public boolean isFinalized() {
        checkLocked();
        return finalized;
    }

    public int submissionCount() {
        checkLocked();
        return submissions.size();
    }

    /** Severities in submission order, as a copy. */
    public List<Integer> severities() {
        checkLocked();
        List<Integer> out = new ArrayList<>(submissions.size());
        for (Submission s : submissions) {
            out.add(s.severity());
        }
        return out;
    }

    public List<Submission> submissions() {
        checkLocked();
        return List.copyOf(submissions);
    }

    /** Consistent snapshot; takes the lock itself. */
    public RequestStatus status() {
        lock.lock();
        try {
            if (!opened) {
                return RequestStatus.notOpened(id);
            }
            return new RequestStatus(id, true, subject, finalized, submissions.size());
        } finally {
            lock.unlock();
        }
    }

    private void checkLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("request " + id + " accessed without holding its lock");
        }
    }
}
