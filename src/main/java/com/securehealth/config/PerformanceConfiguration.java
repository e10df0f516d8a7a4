package com.securehealth.config;

import com.securehealth.infrastructure.crypto.EncryptionAlgorithm;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Performance Monitoring Configuration.
 *
 * Tracks:
 * - Crypto and key vault latency ({@code phi.crypto.operation})
 * - Encrypted repository latency ({@code phi.repository.operation})
 * - Encrypted fields, decryption failures, schema drift and key creation counts
 *
 * Security: No PHI, plaintext or key identifiers in metric tags.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing encrypted repository operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class RepositoryPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public RepositoryPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.securehealth.domain.repository.*Repository.*(..))")
        public Object timeRepositoryMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "phi.repository.operation", "Encrypted repository operation timing",
                joinPoint);
        }
    }

    /**
     * Aspect for timing crypto and key vault operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class CryptoPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public CryptoPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.securehealth.infrastructure.crypto.CryptoService.*(..))"
            + " || execution(* com.securehealth.infrastructure.keyvault.KeyVault.*(..))")
        public Object timeCryptoOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "phi.crypto.operation", "Cryptographic operation timing", joinPoint);
        }
    }

    static Object timed(MeterRegistry meterRegistry, String name, String description,
                        ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();

        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Object result = joinPoint.proceed();

            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", "success")
                .description(description)
                .register(meterRegistry));

            return result;

        } catch (Exception e) {
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", "failure")
                .description(description)
                .register(meterRegistry));

            throw e;
        }
    }

    /**
     * Counters for PHI field handling.
     */
    @Component
    @Slf4j
    public static class PhiMetrics {

        private final MeterRegistry meterRegistry;

        public PhiMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized PHI metrics");
        }

        public void recordFieldEncrypted(String entityKind, EncryptionAlgorithm algorithm) {
            meterRegistry.counter("phi.fields.encrypted",
                "entity", entityKind,
                "algorithm", algorithm.name().toLowerCase(Locale.ROOT)).increment();
        }

        public void recordDecryptionFailure(String entityKind) {
            meterRegistry.counter("phi.fields.decryption_failures", "entity", entityKind).increment();
        }

        public void recordSchemaDrift(String entityKind) {
            meterRegistry.counter("phi.fields.schema_drift", "entity", entityKind).increment();
        }

        public void recordKeyCreated() {
            meterRegistry.counter("phi.keys.created").increment();
        }
    }
}
