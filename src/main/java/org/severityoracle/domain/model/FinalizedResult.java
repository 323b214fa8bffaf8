package org.severityoracle.domain.model;

/** Outcome of a successful finalize, also the payload of the finalize notification. */
public record FinalizedResult(long requestId, int median, Category category, int submissionCount) {}
