package com.example.authservice.revocation;

import com.example.authservice.exception.UpstreamUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.function.Supplier;

/**
 * {@link RevocationStore} on Redis.
 *
 * Every command goes through the {@code revocationStore} circuit breaker and the
 * client command timeout ({@code spring.data.redis.timeout}).
 */
@Component
public class RedisRevocationStore implements RevocationStore {

    private static final Logger log = LoggerFactory.getLogger(RedisRevocationStore.class);

    static final String MARKER = "revoked";
    private static final Duration MIN_TTL = Duration.ofSeconds(1);

    private final StringRedisTemplate redisTemplate;
    private final CircuitBreaker circuitBreaker;

    public RedisRevocationStore(StringRedisTemplate redisTemplate, CircuitBreaker revocationStoreCircuitBreaker) {
        this.redisTemplate = redisTemplate;
        this.circuitBreaker = revocationStoreCircuitBreaker;
    }

    @Override
    public void put(String key, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            log.debug("Skipping blacklist entry {}: token already expired", key);
            return;
        }
        execute(() -> {
            redisTemplate.opsForValue().set(key, MARKER, ttl);
            return null;
        });
    }

    @Override
    public boolean putIfAbsent(String key, Duration ttl) {
        // a consumed marker must exist for at least a moment even if the token is about to expire
        Duration effectiveTtl = ttl == null || ttl.compareTo(MIN_TTL) < 0 ? MIN_TTL : ttl;
        Boolean inserted = execute(() -> redisTemplate.opsForValue().setIfAbsent(key, MARKER, effectiveTtl));
        return Boolean.TRUE.equals(inserted);
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(execute(() -> redisTemplate.hasKey(key)));
    }

    @Override
    public boolean anyExists(Collection<String> keys) {
        if (keys.isEmpty()) {
            return false;
        }
        Long count = execute(() -> redisTemplate.countExistingKeys(keys));
        return count != null && count > 0;
    }

    private <T> T execute(Supplier<T> command) {
        try {
            return circuitBreaker.executeSupplier(command);
        } catch (CallNotPermittedException e) {
            throw new UpstreamUnavailableException("Revocation store circuit open", e);
        } catch (DataAccessException e) {
            log.error("Revocation store command failed: {}", e.getMessage());
            throw new UpstreamUnavailableException("Revocation store unavailable", e);
        }
    }
}
