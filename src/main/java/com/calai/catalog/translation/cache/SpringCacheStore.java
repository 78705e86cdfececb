package com.calai.catalog.translation.cache;

import org.springframework.cache.Cache;

import java.time.Duration;
import java.util.Optional;

/**
 * 包一層 Spring {@link Cache}：只有 get / put / evict，不能列 key。
 * 用這個後端時 invalidate 會走降級模式；TTL 由 CacheManager 統一設定，per-key ttl 參數忽略。
 */
public class SpringCacheStore implements CacheStore {

    private final Cache cache;

    public SpringCacheStore(Cache cache) {
        this.cache = cache;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(cache.get(key, String.class));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        cache.put(key, value);
    }

    @Override
    public void delete(String key) {
        cache.evict(key);
    }
}
