package com.confidentialpayroll.infrastructure.security;

import com.confidentialpayroll.domain.model.Identity;

import java.util.Set;

/**
 * Capability checks and pause flag consulted by every protocol entry point.
 *
 * <p>Each {@code require*} method returns normally on allow and throws an
 * {@link com.confidentialpayroll.application.exceptions.AuthorizationException} or
 * {@link com.confidentialpayroll.application.exceptions.LifecycleException} on deny.
 */
public interface AccessControl {

    void requireAdmin(CallerContext context);

    void requireProvider(CallerContext context);

    void requireOracle(CallerContext context);

    void requireNotPaused();

    boolean isPaused();

    void pause(CallerContext context);

    void unpause(CallerContext context);

    /**
     * Capability names held by an identity ({@code ADMIN}, {@code PROVIDER}, {@code ORACLE}).
     */
    Set<String> capabilitiesOf(Identity identity);
}
