package org.severityoracle.domain.impl;

import org.severityoracle.domain.interfaces.IAggregationListener;
import org.severityoracle.domain.interfaces.IResponseSink;
import org.severityoracle.domain.model.AggregationException;
import org.severityoracle.domain.model.AggregationSettings;
import org.severityoracle.domain.model.Category;
import org.severityoracle.domain.model.ErrorKind;
import org.severityoracle.domain.model.FinalizedResult;
import org.severityoracle.domain.model.ResponseDeliveryException;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Seals a request exactly once.
 * <p>
 * Everything happens under the request's lock: gate checks, median, classification, delivery
 * and the state flip. The request is only marked finalized after the sink accepted the payload,
 * so a failed delivery leaves it open for another attempt and a concurrent caller can never
 * trigger a second delivery.
 */
public final class FinalizationCoordinator {

    private final SettingsHolder settings;
    private final MedianAggregator aggregator;
    private final CategoryClassifier classifier;
    private final IResponseSink sink;
    private final IAggregationListener listener;

    public FinalizationCoordinator(SettingsHolder settings,
                                   MedianAggregator aggregator,
                                   CategoryClassifier classifier,
                                   IResponseSink sink,
                                   IAggregationListener listener) {
        this.settings = settings;
        this.aggregator = aggregator;
        this.classifier = classifier;
        this.sink = sink;
        this.listener = listener;
    }

    public FinalizedResult finalize(AggregationRequest request) {
        ReentrantLock lock = request.lock();
        lock.lock();
        try {
            if (!request.isOpened()) {
                throw AggregationException.unknownRequest(request.id());
            }
            if (request.isFinalized()) {
                throw AggregationException.alreadyFinalized(request.id());
            }

            // live settings, read once so quorum and thresholds belong together
            AggregationSettings current = settings.current();
            int count = request.submissionCount();
            if (count < current.quorum()) {
                throw new AggregationException(ErrorKind.QUORUM_NOT_MET,
                        "request " + request.id() + " has " + count + " of " + current.quorum() + " submissions");
            }

            int median = aggregator.median(request.severities());
            Category category = classifier.classify(median, current);

            try {
                sink.deliver(request.id(), request.replyTo(), category.payload());
            } catch (ResponseDeliveryException e) {
                throw new AggregationException(ErrorKind.DELIVERY_FAILED,
                        "delivery of request " + request.id() + " failed: " + e.getMessage(), e);
            }

            request.markFinalized();
            FinalizedResult result = new FinalizedResult(request.id(), median, category, count);
            listener.onFinalized(result);
            return result;
        } finally {
            lock.unlock();
        }
    }
}
