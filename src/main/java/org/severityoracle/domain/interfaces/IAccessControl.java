package org.severityoracle.domain.interfaces;

/**
 * Capability check for admin actions and source submissions.
 * Principals are plain non-blank strings; {@code null} or blank is the null identity.
 */
public interface IAccessControl {

    String admin();

    boolean isAdmin(String principal);

    boolean isSource(String principal);

    /** Throws UNAUTHORIZED unless {@code caller} is the current admin. */
    void requireAdmin(String caller);

    /** Replace the admin. Only the current admin may do this, and never to the null identity. */
    void setAdmin(String caller, String newAdmin);

    /** Grant or revoke submission rights. Setting the value it already has is a no-op. */
    void setSource(String caller, String source, boolean allowed);
}
