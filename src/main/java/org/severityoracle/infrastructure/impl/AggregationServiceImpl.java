package org.severityoracle.infrastructure.impl;

import org.severityoracle.domain.impl.AggregationRequest;
import org.severityoracle.domain.impl.CategoryClassifier;
import org.severityoracle.domain.impl.FinalizationCoordinator;
import org.severityoracle.domain.impl.MedianAggregator;
import org.severityoracle.domain.impl.SettingsHolder;
import org.severityoracle.domain.impl.SeverityPolicy;
import org.severityoracle.domain.interfaces.IAccessControl;
import org.severityoracle.domain.interfaces.IAggregationListener;
import org.severityoracle.domain.interfaces.IAggregationService;
import org.severityoracle.domain.interfaces.IRequestRegistry;
import org.severityoracle.domain.interfaces.IResponseSink;
import org.severityoracle.domain.model.AggregationException;
import org.severityoracle.domain.model.AggregationSettings;
import org.severityoracle.domain.model.FinalizedResult;
import org.severityoracle.domain.model.RequestStatus;

import java.util.Optional;

public class AggregationServiceImpl implements IAggregationService {

    private final IAccessControl access;
    private final IRequestRegistry registry;
    private final SettingsHolder settings;
    private final SeverityPolicy severityPolicy;
    private final FinalizationCoordinator coordinator;
    private final IResponseSink sink;
    private final IAggregationListener listener;

    public AggregationServiceImpl(IAccessControl access,
                                  IRequestRegistry registry,
                                  SettingsHolder settings,
                                  SeverityPolicy severityPolicy,
                                  FinalizationCoordinator coordinator,
                                  IResponseSink sink,
                                  IAggregationListener listener) {
        this.access = access;
        this.registry = registry;
        this.settings = settings;
        this.severityPolicy = severityPolicy;
        this.coordinator = coordinator;
        this.sink = sink;
        this.listener = listener;
    }

    /** Default in-memory wiring around a deployer principal. */
    public static AggregationServiceImpl create(String deployer,
                                                AggregationSettings initial,
                                                SeverityPolicy severityPolicy,
                                                IResponseSink sink,
                                                IAggregationListener listener) {
        SettingsHolder settings = new SettingsHolder(initial);
        FinalizationCoordinator coordinator = new FinalizationCoordinator(
                settings, new MedianAggregator(), new CategoryClassifier(), sink, listener);
        return new AggregationServiceImpl(new AllowListAccessControl(deployer), new InMemoryRequestRegistry(),
                settings, severityPolicy, coordinator, sink, listener);
    }

    // ---------------------------------------------------------------- lifecycle

    @Override
    public void open(long requestId, String subject) {
        open(requestId, subject, null);
    }

    @Override
    public void open(long requestId, String subject, String replyTo) {
        String address = (replyTo == null || replyTo.isBlank()) ? null : replyTo.trim();
        if (address != null) {
            try {
                sink.checkReplyTo(address);
            } catch (IllegalArgumentException e) {
                throw AggregationException.invalidArgument("bad reply address: " + e.getMessage());
            }
        }
        registry.open(requestId, subject, address);
        listener.onRequestOpened(requestId, subject);
    }

    /** Accepted from anyone and deliberately ignored: the request keeps collecting and can still finalize. */
    @Override
    public void cancel(long requestId) {
        listener.onCancelRequested(requestId);
    }

    @Override
    public void submit(String source, long requestId, int severity) {
        if (!access.isSource(source)) {
            throw AggregationException.unauthorized("principal " + source + " is not an authorized source");
        }
        AggregationRequest request = registry.find(requestId)
                .orElseThrow(() -> AggregationException.unknownRequest(requestId));
        severityPolicy.check(severity);

        request.lock().lock();
        try {
            request.accept(source, severity);
            listener.onSubmission(requestId, source, severity);
        } finally {
            request.lock().unlock();
        }
    }

    @Override
    public FinalizedResult finalize(long requestId) {
        AggregationRequest request = registry.find(requestId)
                .orElseThrow(() -> AggregationException.unknownRequest(requestId));
        return coordinator.finalize(request);
    }

    // ---------------------------------------------------------------- admin

    @Override
    public void setAdmin(String caller, String newAdmin) {
        access.setAdmin(caller, newAdmin);
    }

    @Override
    public void setSource(String caller, String source, boolean allowed) {
        access.setSource(caller, source, allowed);
    }

    @Override
    public void setQuorum(String caller, int quorum) {
        access.requireAdmin(caller);
        settings.setQuorum(quorum);
    }

    @Override
    public void setThresholds(String caller, int medium, int large) {
        access.requireAdmin(caller);
        settings.setThresholds(medium, large);
    }

    // ---------------------------------------------------------------- queries

    @Override public Optional<Long> requestIdFor(String subject) { return registry.requestIdFor(subject); }
    @Override public long totalRequests() { return registry.totalOpened(); }
    @Override public String admin() { return access.admin(); }
    @Override public boolean isSource(String principal) { return access.isSource(principal); }
    @Override public AggregationSettings settings() { return settings.current(); }

    @Override
    public RequestStatus status(long requestId) {
        return registry.find(requestId)
                .map(AggregationRequest::status)
                .orElseGet(() -> RequestStatus.notOpened(requestId));
    }
}
