package org.severityoracle.domain.model;

/**
 * Why an oracle operation was rejected.
 * Every kind is a synchronous, local failure: the rejected call left no state behind.
 */
public enum ErrorKind {
    UNAUTHORIZED,
    INVALID_ARGUMENT,
    ALREADY_FINALIZED,
    DUPLICATE_SUBMISSION,
    QUORUM_NOT_MET,
    NO_VALUES,
    UNKNOWN_REQUEST,
    DELIVERY_FAILED
}
