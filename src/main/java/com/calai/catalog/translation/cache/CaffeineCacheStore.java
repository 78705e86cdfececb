package com.calai.catalog.translation.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 單機 in-process 後端（預設）。
 * 每筆自帶 TTL（variable expiry），asMap 視圖不含已過期的 entry，所以 listKeys 可信。
 */
public class CaffeineCacheStore implements KeyListingCacheStore {

    private record Stored(String value, long ttlNanos) {}

    private final Cache<String, Stored> cache;

    public CaffeineCacheStore(long maxSize) {
        this(maxSize, Ticker.systemTicker());
    }

    /** ticker 可注入，測試用假時鐘推進 TTL */
    public CaffeineCacheStore(long maxSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maxSize))
                .ticker(ticker)
                .expireAfter(new Expiry<String, Stored>() {
                    @Override
                    public long expireAfterCreate(String key, Stored v, long currentTime) {
                        return v.ttlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Stored v, long currentTime, long currentDuration) {
                        return v.ttlNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Stored v, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        Stored s = cache.getIfPresent(key);
        return (s == null) ? Optional.empty() : Optional.of(s.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        long nanos = (ttl == null || ttl.isZero() || ttl.isNegative()) ? Long.MAX_VALUE : ttl.toNanos();
        cache.put(key, new Stored(value, nanos));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public Set<String> listKeys(String prefix) {
        return cache.asMap().keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .collect(Collectors.toSet());
    }
}
