package com.flagship.split_ledger.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Health of the Redis fast path for transfer reference lookups.
 *
 * Redis being down only degrades lookups to the database, so this never reports DOWN.
 */
@Component("referenceCacheHealth")
public class ReferenceCacheHealthIndicator implements HealthIndicator {

    private static final String FALLBACK_NOTE = "Reference lookups fall back to the database";

    private final Optional<StringRedisTemplate> redisTemplate;

    public ReferenceCacheHealthIndicator(Optional<StringRedisTemplate> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Health health() {
        if (redisTemplate.isEmpty() || redisTemplate.get().getConnectionFactory() == null) {
            return Health.status("DEGRADED")
                    .withDetail("error", "No Redis connection factory configured")
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
        }
        try (var connection = redisTemplate.get().getConnectionFactory().getConnection()) {
            String result = connection.ping();
            if ("PONG".equals(result)) {
                return Health.up().withDetail("response", result).build();
            }
            return Health.status("DEGRADED")
                    .withDetail("response", result != null ? result : "null")
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
        } catch (Exception e) {
            return Health.status("DEGRADED")
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .withDetail("note", FALLBACK_NOTE)
                    .build();
        }
    }
}
