package org.severityoracle;

import org.severityoracle.domain.impl.AggregationRequest;
import org.severityoracle.domain.model.AggregationException;
import org.severityoracle.domain.model.ErrorKind;
import org.severityoracle.domain.model.RequestStatus;
import org.severityoracle.domain.model.Submission;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AggregationRequestTest {

    @Test
    void keepsSubmissionsInArrivalOrder() {
        AggregationRequest r = new AggregationRequest(3);
        r.lock().lock();
        try {
            r.reset("Tokyo", null);
            r.accept("b", 9);
            r.accept("a", 1);
            assertEquals(List.of(new Submission("b", 9), new Submission("a", 1)), r.submissions());
            assertEquals(List.of(9, 1), r.severities());
            assertEquals(2, r.submissionCount());
        } finally {
            r.lock().unlock();
        }
        assertEquals(new RequestStatus(3, true, "Tokyo", false, 2), r.status());
    }

    @Test
    void stateIsOnlyReachableUnderTheLock() {
        AggregationRequest r = new AggregationRequest(1);
        assertThrows(IllegalStateException.class, () -> r.reset("x", null));
        assertThrows(IllegalStateException.class, r::submissionCount);
        assertEquals(RequestStatus.notOpened(1), r.status());
    }

    @Test
    void unopenedSlotRefusesSubmissions() {
        AggregationRequest r = new AggregationRequest(1);
        r.lock().lock();
        try {
            AggregationException e = assertThrows(AggregationException.class, () -> r.accept("a", 1));
            assertEquals(ErrorKind.UNKNOWN_REQUEST, e.kind());
            assertFalse(r.isOpened());
        } finally {
            r.lock().unlock();
        }
    }

    @Test
    void resetClearsEverything() {
        AggregationRequest r = new AggregationRequest(1);
        r.lock().lock();
        try {
            r.reset("x", null);
            r.accept("a", 1);
            r.markFinalized();
            assertEquals(ErrorKind.ALREADY_FINALIZED,
                    assertThrows(AggregationException.class, () -> r.accept("b", 2)).kind());

            r.reset("y", null);
            assertFalse(r.isFinalized());
            assertTrue(r.submissions().isEmpty());
            r.accept("a", 5);
            assertEquals(1, r.submissionCount());
        } finally {
            r.lock().unlock();
        }
    }
}
