package com.cladgateway.service;

import com.cladgateway.config.GatewayProperties;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Process-wide token bucket gating every inbound request.
 * <p>
 * One bucket for all callers: capacity {@code burst}, refilled greedily at
 * {@code rate} tokens per second. Bucket4j updates its state with CAS, so
 * concurrent admissions are linearizable.
 */
@Slf4j
@Service
public class RateLimitService {

    private final Bucket bucket;
    private final GatewayProperties.RateLimitSettings settings;
    private final MeterRegistry meterRegistry;

    public RateLimitService(GatewayProperties properties, MeterRegistry meterRegistry) {
        this.settings = properties.getRateLimit();
        this.meterRegistry = meterRegistry;
        if (settings.getRate() <= 0 || settings.getBurst() <= 0) {
            throw new IllegalStateException("Rate limit rate and burst must be positive, got rate="
                    + settings.getRate() + ", burst=" + settings.getBurst());
        }
        this.bucket = createBucket(settings.getRate(), settings.getBurst());
        log.info("Rate limiting enabled: {} requests/second, burst {}", settings.getRate(), settings.getBurst());
    }

    /**
     * Try to admit one request.
     */
    public Admission tryConsume() {
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        if (!probe.isConsumed()) {
            meterRegistry.counter("gateway.ratelimit", "status", "exceeded").increment();
            log.warn("Rate limit exceeded");
            long retryAfterSeconds = Math.max(1, ceilSeconds(probe.getNanosToWaitForRefill()));
            return new Admission(false, 0, retryAfterSeconds);
        }

        meterRegistry.counter("gateway.ratelimit", "status", "allowed").increment();
        return new Admission(true, probe.getRemainingTokens(), 0);
    }

    public long getLimit() {
        return settings.getBurst();
    }

    static long ceilSeconds(long nanos) {
        long second = Duration.ofSeconds(1).toNanos();
        return (nanos + second - 1) / second;
    }

    private Bucket createBucket(long rate, long burst) {
        Bandwidth limit = Bandwidth.classic(burst, Refill.greedy(rate, Duration.ofSeconds(1)));
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }

    public record Admission(boolean allowed, long remaining, long retryAfterSeconds) {}
}
