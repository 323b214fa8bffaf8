package org.severityoracle.domain.model;

/** One accepted report: who sent it and the severity they saw. */
public record Submission(String source, int severity) {}
