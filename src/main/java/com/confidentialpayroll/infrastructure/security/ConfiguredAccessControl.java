package com.confidentialpayroll.infrastructure.security;

import com.confidentialpayroll.application.exceptions.AuthorizationException;
import com.confidentialpayroll.application.exceptions.LifecycleException;
import com.confidentialpayroll.config.ProtocolProperties;
import com.confidentialpayroll.domain.model.Identity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Central capability enforcement point.
 *
 * <p>Role assignments are read from configuration; bootstrapping and transferring roles is
 * the job of whoever manages that configuration. The pause flag is held in memory and
 * starts from {@code payroll.protocol.start-paused}.
 *
 * <p>Every decision is written to the log as an {@code AUDIT} line.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Component
@Slf4j
public class ConfiguredAccessControl implements AccessControl {

    static final String ADMIN = "ADMIN";
    static final String PROVIDER = "PROVIDER";
    static final String ORACLE = "ORACLE";

    private final Set<Identity> admins;
    private final Set<Identity> providers;
    private final Set<Identity> oracles;
    private final AtomicBoolean paused;

    @Autowired
    public ConfiguredAccessControl(ProtocolProperties properties) {
        this(
            toIdentities(properties.getAccess().getAdmins()),
            toIdentities(properties.getAccess().getProviders()),
            toIdentities(properties.getAccess().getOracles()),
            properties.getProtocol().isStartPaused()
        );
    }

    public ConfiguredAccessControl(
            Set<Identity> admins,
            Set<Identity> providers,
            Set<Identity> oracles,
            boolean startPaused) {

        this.admins = Set.copyOf(admins);
        this.providers = Set.copyOf(providers);
        this.oracles = Set.copyOf(oracles);
        this.paused = new AtomicBoolean(startPaused);

        log.info("Access control initialized: admins={}, providers={}, oracles={}, paused={}",
            this.admins.size(), this.providers.size(), this.oracles.size(), startPaused);
    }

    @Override
    public void requireAdmin(CallerContext context) {
        if (!admins.contains(context.getPrincipal())) {
            auditDenial(context, ADMIN);
            throw AuthorizationException.notAdmin(context.getPrincipal());
        }
        auditGrant(context, ADMIN);
    }

    @Override
    public void requireProvider(CallerContext context) {
        if (!providers.contains(context.getPrincipal())) {
            auditDenial(context, PROVIDER);
            throw AuthorizationException.notProvider(context.getPrincipal());
        }
        auditGrant(context, PROVIDER);
    }

    @Override
    public void requireOracle(CallerContext context) {
        if (!oracles.contains(context.getPrincipal())) {
            auditDenial(context, ORACLE);
            throw AuthorizationException.notOracle(context.getPrincipal());
        }
        auditGrant(context, ORACLE);
    }

    @Override
    public void requireNotPaused() {
        if (paused.get()) {
            log.warn("Operation rejected: protocol is paused");
            throw LifecycleException.paused();
        }
    }

    @Override
    public boolean isPaused() {
        return paused.get();
    }

    @Override
    public void pause(CallerContext context) {
        requireAdmin(context);
        if (paused.compareAndSet(false, true)) {
            log.warn("Protocol PAUSED by {}", context.getPrincipal());
        }
    }

    @Override
    public void unpause(CallerContext context) {
        requireAdmin(context);
        if (paused.compareAndSet(true, false)) {
            log.warn("Protocol UNPAUSED by {}", context.getPrincipal());
        }
    }

    @Override
    public Set<String> capabilitiesOf(Identity identity) {
        Set<String> capabilities = new LinkedHashSet<>();
        if (admins.contains(identity)) {
            capabilities.add(ADMIN);
        }
        if (providers.contains(identity)) {
            capabilities.add(PROVIDER);
        }
        if (oracles.contains(identity)) {
            capabilities.add(ORACLE);
        }
        return capabilities;
    }

    private static Set<Identity> toIdentities(Collection<String> values) {
        return values.stream()
            .filter(v -> v != null && !v.isBlank())
            .map(Identity::of)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private void auditGrant(CallerContext context, String capability) {
        if (log.isDebugEnabled()) {
            log.debug("AUDIT: Capability granted - principal={}, capability={}, requestId={}, channel={}",
                context.getPrincipal(), capability, context.getRequestId(), context.getChannel());
        }
    }

    private void auditDenial(CallerContext context, String capability) {
        log.warn("AUDIT: Capability denied - principal={}, required={}, requestId={}, channel={}, timestamp={}",
            context.getPrincipal(),
            capability,
            context.getRequestId(),
            context.getChannel(),
            Instant.now());
    }
}
