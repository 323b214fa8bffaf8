package org.severityoracle;

import org.severityoracle.domain.interfaces.IAccessControl;
import org.severityoracle.domain.model.AggregationException;
import org.severityoracle.domain.model.ErrorKind;
import org.severityoracle.infrastructure.impl.AllowListAccessControl;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AllowListAccessControlTest {

    private static ErrorKind kindOf(Runnable r) {
        return assertThrows(AggregationException.class, r::run).kind();
    }

    @Test
    void deployerIsAdminAndSource() {
        IAccessControl ac = new AllowListAccessControl("root");
        assertEquals("root", ac.admin());
        assertTrue(ac.isAdmin("root"));
        assertTrue(ac.isSource("root"));
        assertFalse(ac.isAdmin("other"));
        assertFalse(ac.isSource("other"));
        assertFalse(ac.isSource(null));
    }

    @Test
    void deployerMustBeAnIdentity() {
        assertEquals(ErrorKind.INVALID_ARGUMENT, kindOf(() -> new AllowListAccessControl(null)));
        assertEquals(ErrorKind.INVALID_ARGUMENT, kindOf(() -> new AllowListAccessControl("  ")));
    }

    @Test
    void setAdminRejectsNullIdentity() {
        IAccessControl ac = new AllowListAccessControl("root");
        assertEquals(ErrorKind.INVALID_ARGUMENT, kindOf(() -> ac.setAdmin("root", null)));
        assertEquals(ErrorKind.INVALID_ARGUMENT, kindOf(() -> ac.setAdmin("root", "")));
        assertEquals("root", ac.admin());
    }

    @Test
    void onlyTheCurrentAdminMayHandOver() {
        IAccessControl ac = new AllowListAccessControl("root");
        assertEquals(ErrorKind.UNAUTHORIZED, kindOf(() -> ac.setAdmin("mallory", "mallory")));
        // authorization is checked before the argument
        assertEquals(ErrorKind.UNAUTHORIZED, kindOf(() -> ac.setAdmin("mallory", null)));

        ac.setAdmin("root", "ops");
        assertEquals("ops", ac.admin());
        assertEquals(ErrorKind.UNAUTHORIZED, kindOf(() -> ac.setSource("root", "x", true)));
        assertEquals(ErrorKind.UNAUTHORIZED, kindOf(() -> ac.requireAdmin("root")));
        ac.setSource("ops", "x", true);
        assertTrue(ac.isSource("x"));
        // membership is independent of the admin role
        assertTrue(ac.isSource("root"));
    }

    @Test
    void setSourceIsIdempotentAndRevocable() {
        IAccessControl ac = new AllowListAccessControl("root");
        ac.setSource("root", "station-a", true);
        ac.setSource("root", "station-a", true);
        assertTrue(ac.isSource("station-a"));

        ac.setSource("root", "station-a", false);
        ac.setSource("root", "station-a", false);
        assertFalse(ac.isSource("station-a"));
    }

    @Test
    void setSourceValidatesCallerThenSource() {
        IAccessControl ac = new AllowListAccessControl("root");
        assertEquals(ErrorKind.UNAUTHORIZED, kindOf(() -> ac.setSource("station-a", "station-a", true)));
        assertEquals(ErrorKind.INVALID_ARGUMENT, kindOf(() -> ac.setSource("root", null, true)));
        assertEquals(ErrorKind.INVALID_ARGUMENT, kindOf(() -> ac.setSource("root", " ", false)));
    }
}
