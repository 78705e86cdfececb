package com.calai.catalog.config;

import com.calai.catalog.translation.cache.CacheStore;
import com.calai.catalog.translation.cache.CaffeineCacheStore;
import com.calai.catalog.translation.cache.ExportCacheProperties;
import com.calai.catalog.translation.cache.RedisCacheStore;
import com.calai.catalog.translation.cache.SpringCacheStore;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 依 app.catalog.cache.store 建立唯一一個 CacheStore bean，生命週期跟著 application context。
 */
@Configuration
public class CacheStoreConfig {

    static final String SPRING_CACHE_NAME = "catalogExport";

    @Bean
    @ConditionalOnProperty(name = "app.catalog.cache.store", havingValue = "caffeine", matchIfMissing = true)
    public CacheStore caffeineCacheStore(ExportCacheProperties props) {
        return new CaffeineCacheStore(props.getMaxSize());
    }

    @Bean
    @ConditionalOnProperty(name = "app.catalog.cache.store", havingValue = "redis")
    public CacheStore redisCacheStore(StringRedisTemplate redis) {
        return new RedisCacheStore(redis);
    }

    /**
     * Spring Cache 沒有列 key 的能力 → ExportCacheManager 會走降級失效。
     * TTL 只能整個 cache 一個值，這裡用 export TTL。
     */
    @Bean
    @ConditionalOnProperty(name = "app.catalog.cache.store", havingValue = "spring")
    public CacheStore springCacheStore(ExportCacheProperties props) {
        CaffeineCacheManager mgr = new CaffeineCacheManager(SPRING_CACHE_NAME);
        mgr.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(props.getExportTtl())
                .maximumSize(props.getMaxSize())
        );
        return new SpringCacheStore(mgr.getCache(SPRING_CACHE_NAME));
    }
}
