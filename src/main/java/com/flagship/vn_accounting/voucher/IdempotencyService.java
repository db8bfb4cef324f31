package com.flagship.vn_accounting.voucher;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency keys for voucher creation.
 *
 * Redis is the fast path; the unique idempotency_key column on vouchers is
 * the source of truth, so a Redis outage only costs a database lookup.
 * A Redis entry is only trusted while the voucher it names exists.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:voucher:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final VoucherPersistenceService voucherPersistenceService;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(VoucherPersistenceService voucherPersistenceService,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.voucherPersistenceService = voucherPersistenceService;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the voucher created earlier under this key, if any
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<UUID> cached = readCached(idempotencyKey);
        if (cached.isPresent()) {
            if (voucherPersistenceService.existsById(cached.get())) {
                log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                return cached;
            }
            log.warn("Idempotency key {} points to missing voucher {}, evicting it", idempotencyKey, cached.get());
            evict(idempotencyKey);
        }

        Optional<UUID> existing = voucherPersistenceService.findByIdempotencyKey(idempotencyKey)
                .map(AccountingVoucher::getId);
        existing.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return existing;
    }

    public void storeIdempotencyKey(String idempotencyKey, UUID voucherId) {
        requireKey(idempotencyKey);
        if (voucherId == null) {
            throw new IllegalArgumentException("Voucher ID cannot be null");
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            // rows only exist once the creating transaction commits
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(idempotencyKey, voucherId);
                }
            });
        } else {
            cache(idempotencyKey, voucherId);
        }
    }

    private Optional<UUID> readCached(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String voucherId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return Optional.ofNullable(voucherId).map(UUID::fromString);
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void evict(String idempotencyKey) {
        try {
            redisTemplate.get().delete(REDIS_KEY_PREFIX + idempotencyKey);
        } catch (Exception e) {
            log.warn("Failed to evict idempotency key {} from Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private void cache(String idempotencyKey, UUID voucherId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, voucherId.toString(), REDIS_TTL);
            log.debug("Cached idempotency key in Redis: {} -> {}", idempotencyKey, voucherId);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
