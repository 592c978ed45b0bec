package com.flagship.split_ledger.settlement;

import com.flagship.split_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Index of external transfer references already recorded in the ledger.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the settlements table (slower, always authoritative)
 * 3. Warm Redis from the database on a fallback hit
 *
 * The database unique constraint remains the real guarantee; this index only saves a
 * round trip and a failed insert for the common replay case.
 */
@Service
@Slf4j
public class SettlementReferenceCache {

    private static final String REDIS_KEY_PREFIX = "settlement-ref:";

    private final SettlementRepository settlementRepository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final LedgerMetrics ledgerMetrics;
    private final boolean enabled;
    private final Duration ttl;

    public SettlementReferenceCache(SettlementRepository settlementRepository,
                                    Optional<StringRedisTemplate> redisTemplate,
                                    LedgerMetrics ledgerMetrics,
                                    @Value("${ledger.reference-cache.enabled:true}") boolean enabled,
                                    @Value("${ledger.reference-cache.ttl:P7D}") Duration ttl) {
        this.settlementRepository = settlementRepository;
        this.redisTemplate = redisTemplate;
        this.ledgerMetrics = ledgerMetrics;
        this.enabled = enabled;
        this.ttl = ttl;
    }

    /**
     * Looks up the settlement already recorded for a reference.
     *
     * @return the settlement id if the reference is known, empty otherwise
     */
    public Optional<UUID> findSettlementId(String externalRef) {
        if (externalRef == null || externalRef.isBlank()) {
            throw new IllegalArgumentException("External reference cannot be null or blank");
        }

        if (redisAvailable()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + externalRef);
                if (cached != null) {
                    log.debug("Transfer reference found in Redis: {}", externalRef);
                    ledgerMetrics.recordReferenceLookup("redis_hit");
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for transfer reference: {}. Falling back to database. Error: {}",
                        externalRef, e.getMessage());
            }
        }

        Optional<UUID> stored = settlementRepository.findByExternalRef(externalRef)
            .map(SettlementEntity::getId);
        if (stored.isPresent()) {
            log.debug("Transfer reference found in database: {}", externalRef);
            ledgerMetrics.recordReferenceLookup("db_hit");
            remember(externalRef, stored.get());
        } else {
            ledgerMetrics.recordReferenceLookup("miss");
        }
        return stored;
    }

    /**
     * Caches a recorded reference. Best effort: a Redis failure is logged and ignored
     * because the database already holds the reference.
     */
    public void remember(String externalRef, UUID settlementId) {
        if (externalRef == null || settlementId == null || !redisAvailable()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + externalRef, settlementId.toString(), ttl);
            log.debug("Cached transfer reference in Redis: {} -> {}", externalRef, settlementId);
        } catch (Exception e) {
            log.warn("Failed to cache transfer reference in Redis: {}. Error: {}", externalRef, e.getMessage());
        }
    }

    private boolean redisAvailable() {
        return enabled && redisTemplate.isPresent();
    }
}
