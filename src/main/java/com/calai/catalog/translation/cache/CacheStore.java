package com.calai.catalog.translation.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * export 快取後端（Caffeine / Redis / Spring Cache）。
 * 值一律是 JSON 字串，單一 key 的 get / set / delete 各自是原子的。
 * 傳輸失敗直接丟 RuntimeException，由 {@link ExportCacheManager} 決定怎麼降級。
 */
public interface CacheStore {

    Optional<String> get(String key);

    /** ttl 為 null 或非正數代表不過期 */
    void set(String key, String value, Duration ttl);

    void delete(String key);
}
