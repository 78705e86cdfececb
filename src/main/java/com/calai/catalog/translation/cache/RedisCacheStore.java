package com.calai.catalog.translation.cache;

import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 多機共用的 Redis 後端。
 * listKeys 用 SCAN（非阻塞分批），不用 KEYS，避免大 keyspace 時卡住 Redis。
 */
public class RedisCacheStore implements KeyListingCacheStore {

    private static final long SCAN_BATCH = 500;

    private final StringRedisTemplate redis;

    public RedisCacheStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redis.opsForValue().set(key, value);
        } else {
            redis.opsForValue().set(key, value, ttl);
        }
    }

    @Override
    public void delete(String key) {
        redis.delete(key);
    }

    @Override
    public Set<String> listKeys(String prefix) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(escapeGlob(prefix) + "*")
                .count(SCAN_BATCH)
                .build();

        Set<String> out = new HashSet<>();
        try (Cursor<String> cursor = redis.scan(options)) {
            while (cursor.hasNext()) {
                out.add(cursor.next());
            }
        }
        return out;
    }

    /** 前綴當字面值比對：glob 特殊字元要跳脫 */
    static String escapeGlob(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (char c : s.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }
}
