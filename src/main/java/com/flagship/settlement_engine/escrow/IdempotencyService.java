package com.flagship.settlement_engine.escrow;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Idempotency keys for escrow creation.
 *
 * Keys are scoped to the buyer that sent them: the same key from two buyers names two
 * different agreements.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the escrows table (the source of truth)
 * 3. Cache database hits in Redis for future lookups
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:escrow:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final EscrowRepository escrowRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(EscrowRepository escrowRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.escrowRepository = escrowRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the id of the escrow created with this key, if any
     */
    public Optional<Long> checkIdempotencyKey(String buyer, String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String escrowId = redisTemplate.get().opsForValue().get(redisKey(buyer, idempotencyKey));
                if (escrowId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(Long.valueOf(escrowId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<Long> existing = escrowRepository.findByBuyerIdAndIdempotencyKey(buyer, idempotencyKey)
                .map(EscrowEntity::getId);
        existing.ifPresent(escrowId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(buyer, idempotencyKey, escrowId);
        });
        return existing;
    }

    /**
     * Caches the key in Redis. The escrow row itself already stores it.
     */
    public void storeIdempotencyKey(String buyer, String idempotencyKey, long escrowId) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        cache(buyer, idempotencyKey, escrowId);
    }

    private static String redisKey(String buyer, String idempotencyKey) {
        return REDIS_KEY_PREFIX + buyer + ":" + idempotencyKey;
    }

    private void cache(String buyer, String idempotencyKey, long escrowId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey(buyer, idempotencyKey),
                    String.valueOf(escrowId), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }
}
