package com.familyconnections.config;

import com.familyconnections.domain.model.ConfidenceTier;
import com.familyconnections.domain.signal.SignalDetector;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Performance and business metrics for the scoring engine.
 *
 * Tracks:
 * - time spent per detector category
 * - pairs scored, by confidence tier
 * - pairs skipped because a record was malformed
 * - duration of whole group analyses
 *
 * No officer data is ever used as a tag.
 */
@Configuration
public class PerformanceConfiguration {

    /**
     * Aspect for timing detector runs.
     */
    @Aspect
    @Component
    public static class DetectorPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public DetectorPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.familyconnections.domain.signal.SignalDetector+.detect(..))")
        public Object timeDetector(ProceedingJoinPoint joinPoint) throws Throwable {
            String category = joinPoint.getTarget() instanceof SignalDetector
                ? ((SignalDetector) joinPoint.getTarget()).category().name().toLowerCase(Locale.ROOT)
                : "unknown";

            Timer.Sample sample = Timer.start(meterRegistry);

            try {
                Object result = joinPoint.proceed();

                sample.stop(Timer.builder("signal.detector")
                    .tag("category", category)
                    .tag("outcome", "success")
                    .description("Signal detector timing")
                    .register(meterRegistry));

                return result;

            } catch (Exception e) {
                sample.stop(Timer.builder("signal.detector")
                    .tag("category", category)
                    .tag("outcome", "failure")
                    .description("Signal detector timing")
                    .register(meterRegistry));

                throw e;
            }
        }
    }

    /**
     * Counters and timers for scoring operations.
     */
    @Component
    @Slf4j
    public static class ScoringMetrics {

        private final MeterRegistry meterRegistry;

        public ScoringMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized scoring metrics");
        }

        public void recordPairScored(ConfidenceTier confidence) {
            meterRegistry.counter("family.connections.pairs.scored",
                "confidence", confidence.name().toLowerCase(Locale.ROOT)).increment();
        }

        public void recordPairFailed() {
            meterRegistry.counter("family.connections.pairs.failed").increment();
        }

        public <T> T timeGroupAnalysis(Supplier<T> analysis) {
            return Timer.builder("family.connections.group.analysis")
                .description("Group analysis timing")
                .register(meterRegistry)
                .record(analysis);
        }
    }
}
