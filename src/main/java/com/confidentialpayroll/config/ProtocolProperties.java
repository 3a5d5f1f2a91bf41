package com.confidentialpayroll.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Externalized settings bound from {@code payroll.*}.
 */
@Data
@ConfigurationProperties(prefix = "payroll")
public class ProtocolProperties {

    private Protocol protocol = new Protocol();
    private Access access = new Access();
    private Oracle oracle = new Oracle();
    private Audit audit = new Audit();

    @Data
    public static class Protocol {

        /**
         * Binds commitments to this deployment so they cannot be replayed against another one.
         */
        private String instanceId = "confidential-payroll-local";

        private Duration submissionCooldown = Duration.ofSeconds(10);

        private Duration decryptionRequestCooldown = Duration.ofSeconds(30);

        private boolean startPaused = false;
    }

    /**
     * Capability assignments. Role bootstrap and transfer happen outside this service.
     */
    @Data
    public static class Access {

        private Set<String> admins = new LinkedHashSet<>();
        private Set<String> providers = new LinkedHashSet<>();
        private Set<String> oracles = new LinkedHashSet<>();

        /**
         * HTTP Basic credentials. The user name is the caller identity.
         */
        private List<User> users = new ArrayList<>();
    }

    @Data
    public static class User {
        private String name;
        private String password;
    }

    @Data
    public static class Oracle {

        /**
         * Identity the built-in gateway uses when delivering callbacks.
         */
        private String identity = "decryption-oracle";

        private Duration callbackDelay = Duration.ofSeconds(2);

        /**
         * Pending requests older than this are reported by the monitor.
         */
        private Duration pendingWarningAfter = Duration.ofMinutes(10);

        private Duration pendingCheckInterval = Duration.ofMinutes(1);

        private int schedulerPoolSize = 2;
    }

    @Data
    public static class Audit {

        /**
         * Delay between outbox publication runs.
         */
        private Duration publishInterval = Duration.ofSeconds(10);
    }
}
