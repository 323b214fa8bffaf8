package org.severityoracle.infrastructure.impl;

import org.severityoracle.domain.interfaces.IAccessControl;
import org.severityoracle.domain.model.AggregationException;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Admin plus a mutable allow-list of sources. Reads are lock-free; writes are serialized on
 * this instance so an admin hand-over and a membership change never interleave.
 */
public class AllowListAccessControl implements IAccessControl {

    private volatile String admin;
    private final ConcurrentHashMap<String, Boolean> sources = new ConcurrentHashMap<>();

    /** The deployer becomes admin and may report as a source right away. */
    public AllowListAccessControl(String deployer) {
        if (isNullIdentity(deployer)) {
            throw AggregationException.invalidArgument("deployer must be a non-blank principal");
        }
        this.admin = deployer;
        this.sources.put(deployer, Boolean.TRUE);
    }

    @Override
    public String admin() { return admin; }

    @Override
    public boolean isAdmin(String principal) {
        return principal != null && principal.equals(admin);
    }

    @Override
    public boolean isSource(String principal) {
        return principal != null && sources.getOrDefault(principal, Boolean.FALSE);
    }

    @Override
    public void requireAdmin(String caller) {
        if (!isAdmin(caller)) {
            throw AggregationException.unauthorized("caller " + caller + " is not the admin");
        }
    }

    @Override
    public synchronized void setAdmin(String caller, String newAdmin) {
        requireAdmin(caller);
        if (isNullIdentity(newAdmin)) {
            throw AggregationException.invalidArgument("admin must be a non-blank principal");
        }
        admin = newAdmin;
    }

    @Override
    public synchronized void setSource(String caller, String source, boolean allowed) {
        requireAdmin(caller);
        if (isNullIdentity(source)) {
            throw AggregationException.invalidArgument("source must be a non-blank principal");
        }
        if (allowed) {
            sources.put(source, Boolean.TRUE);
        } else {
            sources.remove(source);
        }
    }

    private static boolean isNullIdentity(String principal) {
        return principal == null || principal.isBlank();
    }
}
