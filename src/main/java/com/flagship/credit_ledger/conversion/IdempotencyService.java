package com.flagship.credit_ledger.conversion;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps client Idempotency-Key headers to conversion request ids.
 *
 * Redis is a fast path only. The conversion_debits table, with its unique
 * idempotency_key column, is the source of truth and is consulted whenever
 * Redis is absent, misses, or fails.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:conversion:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final ConversionDebitRepository debitRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(ConversionDebitRepository debitRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.debitRepository = debitRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the request id previously recorded for the key, if any
     */
    public Optional<UUID> lookup(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String requestId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (requestId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(requestId));
                }
            } catch (RuntimeException e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = debitRepository.findByIdempotencyKey(idempotencyKey)
            .map(ConversionDebitEntity::getRequestId);
        stored.ifPresent(requestId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, requestId);
        });
        return stored;
    }

    /**
     * Caches the mapping in Redis. The database row written with the reservation
     * already carries the key.
     */
    public void remember(String idempotencyKey, UUID requestId) {
        requireKey(idempotencyKey);
        if (requestId == null) {
            throw new IllegalArgumentException("Request id cannot be null");
        }
        cache(idempotencyKey, requestId);
    }

    private void cache(String idempotencyKey, UUID requestId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, requestId.toString(), REDIS_TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
