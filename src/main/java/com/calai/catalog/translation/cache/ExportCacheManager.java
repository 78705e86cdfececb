package com.calai.catalog.translation.cache;

import com.calai.catalog.translation.entity.TranslationEntity;
import com.calai.catalog.translation.query.TranslationQuery;
import com.calai.catalog.translation.query.TranslationQueryBuilder;
import com.calai.catalog.translation.repo.TagRepository;
import com.calai.catalog.translation.repo.TranslationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.function.Supplier;

/**
 * export 的 read-through 快取 + 失效。
 *
 * 讀：key 命中就原樣回傳；沒命中（或快取壞掉）就查 DB、寫回快取、回傳。
 * 快取任何錯誤都當 miss，不會讓讀取失敗。命中時不碰 DB（不開交易、不拿連線）。
 *
 * 失效 {@link #invalidate(String)}：
 * <ul>
 *   <li>後端能列 key：base key + 該 locale 所有帶標籤的 key 全刪</li>
 *   <li>後端不能列 key（降級）：只刪 base key，帶標籤的 export 最多再舊一個 export TTL</li>
 *   <li>兩種模式都會刪 available_locales / available_tags</li>
 * </ul>
 * 失效失敗只記 log，不往外丟（呼叫時 DB 已經 commit）。
 *
 * <p>已知的舊資料窗口：讀取端在寫入 commit 前 miss、查到舊資料，
 * 卻在 afterCommit 失效之後才寫回快取，這份舊 export 會留到 export TTL 到期。
 * 沒有版本號 / compare-and-set，窗口上限就是 app.catalog.cache.export-ttl。</p>
 */
@Slf4j
@Service
public class ExportCacheManager {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final CacheStore store;
    private final TranslationRepository translations;
    private final TagRepository tags;
    private final TranslationQueryBuilder queries;
    private final ObjectMapper om;
    private final ExportCacheProperties props;

    public ExportCacheManager(
            CacheStore store,
            TranslationRepository translations,
            TagRepository tags,
            TranslationQueryBuilder queries,
            ObjectMapper om,
            ExportCacheProperties props
    ) {
        this.store = store;
        this.translations = translations;
        this.tags = tags;
        this.queries = queries;
        this.om = om;
        this.props = props;
    }

    @PostConstruct
    void announceMode() {
        if (supportsKeyListing()) {
            log.info("[ExportCache] store={} invalidation=prefix", store.getClass().getSimpleName());
        } else {
            log.warn("[ExportCache] store={} cannot list keys: tag-filtered exports may stay stale up to {} after a write",
                    store.getClass().getSimpleName(), props.getExportTtl());
        }
    }

    public boolean supportsKeyListing() {
        return store instanceof KeyListingCacheStore;
    }

    // ===== read =====

    public ExportCacheEntry get(String locale, Collection<String> tagNames) {
        String key = ExportCacheKeys.deriveKey(locale, tagNames);

        ExportCacheEntry cached = readCached(key, ExportCacheEntry.class);
        if (cached != null) return cached;

        log.debug("export_cache_miss key={}", key);
        ExportCacheEntry fresh = load(locale, ExportCacheKeys.normalizeTags(tagNames));
        writeCached(key, fresh, props.getExportTtl());
        return fresh;
    }

    public List<String> availableLocales() {
        return cachedList(ExportCacheKeys.AVAILABLE_LOCALES_KEY, translations::findDistinctLocales);
    }

    public List<String> availableTags() {
        return cachedList(ExportCacheKeys.AVAILABLE_TAGS_KEY, tags::findAllNamesSorted);
    }

    private ExportCacheEntry load(String locale, SortedSet<String> tagNames) {
        TranslationQuery q = queries.buildExport(locale, tagNames);
        List<TranslationEntity> rows = translations.findAll(q.where(), q.pageable().getSort());

        Map<String, String> map = new LinkedHashMap<>(Math.max(16, rows.size() * 2));
        for (TranslationEntity t : rows) {
            map.put(t.getKey(), t.getValue());
        }
        return new ExportCacheEntry(locale, Collections.unmodifiableMap(map), map.size(), Instant.now());
    }

    private List<String> cachedList(String key, Supplier<List<String>> loader) {
        List<String> cached = readCached(key, STRING_LIST);
        if (cached != null) return cached;

        List<String> fresh = List.copyOf(loader.get());
        writeCached(key, fresh, props.getListsTtl());
        return fresh;
    }

    // ===== invalidate =====

    /** 一次寫入可能動到兩個 locale（update 改 locale） */
    public void invalidate(Collection<String> locales) {
        if (locales == null) return;
        new LinkedHashSet<>(locales).stream()
                .filter(Objects::nonNull)
                .forEach(this::invalidate);
    }

    public void invalidate(String locale) {
        if (locale == null) return;

        Set<String> keys = new LinkedHashSet<>();
        keys.add(ExportCacheKeys.localePrefix(locale));

        if (store instanceof KeyListingCacheStore listing) {
            try {
                keys.addAll(listing.listKeys(ExportCacheKeys.taggedPrefix(locale)));
            } catch (RuntimeException e) {
                // 列不出來就退回降級範圍，base key 仍會刪
                log.warn("export_cache_list_failed locale={} err={}", locale, e.toString());
            }
        }

        keys.add(ExportCacheKeys.AVAILABLE_LOCALES_KEY);
        keys.add(ExportCacheKeys.AVAILABLE_TAGS_KEY);

        int failed = 0;
        for (String k : keys) {
            if (!deleteQuietly(k)) failed++;
        }
        if (failed > 0) {
            log.warn("export_cache_invalidate_partial locale={} keys={} failed={}", locale, keys.size(), failed);
        } else {
            log.debug("export_cache_invalidated locale={} keys={}", locale, keys.size());
        }
    }

    /** 只清 locales / tags 清單（例如批次匯入後） */
    public void evictLists() {
        deleteQuietly(ExportCacheKeys.AVAILABLE_LOCALES_KEY);
        deleteQuietly(ExportCacheKeys.AVAILABLE_TAGS_KEY);
    }

    // ===== cache io helpers =====

    private <T> T readCached(String key, Class<T> type) {
        String raw = rawGet(key);
        if (raw == null) return null;
        try {
            return om.readValue(raw, type);
        } catch (JsonProcessingException e) {
            log.warn("export_cache_decode_failed key={} err={}", key, e.getOriginalMessage());
            deleteQuietly(key);
            return null;
        }
    }

    private <T> T readCached(String key, TypeReference<T> type) {
        String raw = rawGet(key);
        if (raw == null) return null;
        try {
            return om.readValue(raw, type);
        } catch (JsonProcessingException e) {
            log.warn("export_cache_decode_failed key={} err={}", key, e.getOriginalMessage());
            deleteQuietly(key);
            return null;
        }
    }

    private String rawGet(String key) {
        try {
            return store.get(key).orElse(null);
        } catch (RuntimeException e) {
            log.warn("export_cache_get_failed key={} err={}", key, e.toString());
            return null;
        }
    }

    private void writeCached(String key, Object value, Duration ttl) {
        try {
            store.set(key, om.writeValueAsString(value), ttl);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("export_cache_set_failed key={} err={}", key, e.toString());
        }
    }

    private boolean deleteQuietly(String key) {
        try {
            store.delete(key);
            return true;
        } catch (RuntimeException e) {
            log.warn("export_cache_delete_failed key={} err={}", key, e.toString());
            return false;
        }
    }
}
