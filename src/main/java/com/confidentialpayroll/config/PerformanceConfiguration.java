package com.confidentialpayroll.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance Monitoring Configuration.
 *
 * Tracks:
 * - Latency of every protocol entry point
 * - Capability check outcomes
 * - Homomorphic operation timing
 * - Business counters for batches, contributions and decryptions
 *
 * Security: metric tags carry operation names only, never identities or values.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing protocol operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class ProtocolPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public ProtocolPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        /**
         * Time all public application service methods.
         */
        @Around("execution(public * com.confidentialpayroll.application.*Service.*(..))")
        public Object timeProtocolOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "protocol.operation", "Protocol operation timing",
                "success", "failure", joinPoint);
        }
    }

    /**
     * Aspect for timing capability checks.
     */
    @Aspect
    @Component
    @Slf4j
    public static class SecurityPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public SecurityPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.confidentialpayroll.infrastructure.security.AccessControl.require*(..))")
        public Object timeSecurityCheck(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "security.authorization", "Authorization check timing",
                "granted", "denied", joinPoint);
        }
    }

    /**
     * Aspect for timing homomorphic operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class FhePerformanceAspect {

        private final MeterRegistry meterRegistry;

        public FhePerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.confidentialpayroll.infrastructure.fhe.HomomorphicLibrary.*(..))")
        public Object timeFheOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "fhe.operation", "Homomorphic operation timing",
                "success", "failure", joinPoint);
        }
    }

    private static Object timed(
            MeterRegistry meterRegistry,
            String name,
            String description,
            String successOutcome,
            String failureOutcome,
            ProceedingJoinPoint joinPoint) throws Throwable {

        String methodName = joinPoint.getSignature().toShortString();
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Object result = joinPoint.proceed();

            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", successOutcome)
                .description(description)
                .register(meterRegistry));

            return result;

        } catch (Exception e) {
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", failureOutcome)
                .description(description)
                .register(meterRegistry));

            throw e;
        }
    }

    /**
     * Custom metrics for business operations.
     */
    @Component
    @Slf4j
    public static class BusinessMetrics {

        private final MeterRegistry meterRegistry;

        public BusinessMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized business metrics");
        }

        public void recordBatchOpened() {
            meterRegistry.counter("business.batches.opened").increment();
        }

        public void recordBatchClosed(int contributors) {
            meterRegistry.counter("business.batches.closed").increment();
            meterRegistry.summary("business.batches.contributors").record(contributors);
        }

        public void recordContribution(boolean coerced) {
            meterRegistry.counter("business.contributions.accepted",
                "coerced", Boolean.toString(coerced)).increment();
        }

        public void recordDecryptionRequested() {
            meterRegistry.counter("business.decryptions.requested").increment();
        }

        public void recordDecryptionCompleted() {
            meterRegistry.counter("business.decryptions.completed").increment();
        }

        /**
         * Record a rejected oracle callback.
         *
         * @param reason Error code name
         */
        public void recordCallbackRejected(String reason) {
            meterRegistry.counter("business.decryptions.rejected", "reason", reason).increment();
        }
    }
}
