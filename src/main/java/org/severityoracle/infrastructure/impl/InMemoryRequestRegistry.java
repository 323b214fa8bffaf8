package org.severityoracle.infrastructure.impl;

import org.severityoracle.domain.impl.AggregationRequest;
import org.severityoracle.domain.interfaces.IRequestRegistry;
import org.severityoracle.domain.model.AggregationException;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Request slots keyed by id, plus the subject index.
 * Slots are never removed; re-open resets the existing slot under its own lock.
 */
public class InMemoryRequestRegistry implements IRequestRegistry {

    private final ConcurrentHashMap<Long, AggregationRequest> requests = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> subjects = new ConcurrentHashMap<>();
    private final AtomicLong opened = new AtomicLong();

    @Override
    public AggregationRequest open(long requestId, String subject, String replyTo) {
        if (subject == null) {
            throw AggregationException.invalidArgument("subject must not be null");
        }
        AggregationRequest request = requests.computeIfAbsent(requestId, AggregationRequest::new);
        request.lock().lock();
        try {
            request.reset(subject, replyTo);
            subjects.put(subject, requestId);
            opened.incrementAndGet();
        } finally {
            request.lock().unlock();
        }
        return request;
    }

    @Override
    public Optional<AggregationRequest> find(long requestId) {
        return Optional.ofNullable(requests.get(requestId));
    }

    @Override
    public Optional<Long> requestIdFor(String subject) {
        if (subject == null) return Optional.empty();
        return Optional.ofNullable(subjects.get(subject));
    }

    @Override
    public long totalOpened() { return opened.get(); }
}
