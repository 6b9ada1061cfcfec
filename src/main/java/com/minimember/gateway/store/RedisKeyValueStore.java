package com.minimember.gateway.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.minimember.config.MembershipCacheProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Base64;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Redis 持久化 + 本机 Caffeine 副本。
 *
 * <p>Redis 故障时 fail-fast 一段时间，读走本机副本，写只落本机；值按 Base64 存成字符串。</p>
 */
@Slf4j
public class RedisKeyValueStore implements KeyValueStore {

    private static final long REDIS_FAIL_FAST_MS = 10_000;
    private final AtomicLong redisUnavailableUntilMs = new AtomicLong(0);

    private final MembershipCacheProperties props;
    private final StringRedisTemplate redis;
    private final Cache<String, byte[]> local;

    public RedisKeyValueStore(MembershipCacheProperties props, StringRedisTemplate redis) {
        this.props = props;
        this.redis = redis;
        this.local = Caffeine.newBuilder()
                .maximumSize(Math.max(1, props.getLocalStoreMaxEntries()))
                .build();
    }

    @Override
    public byte[] get(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        byte[] localHit = local.getIfPresent(key);
        if (localHit != null) {
            return localHit;
        }
        if (shouldFailFast()) {
            return null;
        }
        try {
            String raw = redis.opsForValue().get(redisKey(key));
            if (raw == null || raw.isBlank()) {
                return null;
            }
            byte[] value = Base64.getDecoder().decode(raw);
            local.put(key, value);
            return value;
        } catch (IllegalArgumentException e) {
            log.warn("stored value is not base64, dropped: key={}", key);
            erase(key);
            return null;
        } catch (Exception e) {
            log.debug("redis store get failed: key={}, err={}", key, e.toString());
            markRedisDown();
            return null;
        }
    }

    @Override
    public void set(String key, byte[] value) {
        if (key == null || key.isBlank() || value == null) {
            return;
        }
        local.put(key, value);
        if (shouldFailFast()) {
            return;
        }
        try {
            redis.opsForValue().set(redisKey(key), Base64.getEncoder().encodeToString(value));
        } catch (Exception e) {
            log.debug("redis store set failed: key={}, err={}", key, e.toString());
            markRedisDown();
        }
    }

    @Override
    public void erase(String key) {
        if (key == null || key.isBlank()) {
            return;
        }
        local.invalidate(key);
        if (shouldFailFast()) {
            return;
        }
        try {
            redis.delete(redisKey(key));
        } catch (Exception e) {
            log.debug("redis store erase failed: key={}, err={}", key, e.toString());
            markRedisDown();
        }
    }

    private String redisKey(String key) {
        String prefix = props.getStoreKeyPrefix();
        return (prefix == null ? "" : prefix) + key;
    }

    private boolean shouldFailFast() {
        return System.currentTimeMillis() < redisUnavailableUntilMs.get();
    }

    private void markRedisDown() {
        long until = System.currentTimeMillis() + REDIS_FAIL_FAST_MS;
        while (true) {
            long prev = redisUnavailableUntilMs.get();
            if (prev >= until) {
                return;
            }
            if (redisUnavailableUntilMs.compareAndSet(prev, until)) {
                return;
            }
        }
    }
}
