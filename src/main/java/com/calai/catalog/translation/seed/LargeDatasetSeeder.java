package com.calai.catalog.translation.seed;

import com.calai.catalog.translation.cache.ExportCacheManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * 啟動時灌大量資料（app.catalog.seed.enabled=true 才會註冊）。
 * - 先建 N 個標籤，再分批 insert translations
 * - 每筆掛 1~3 個不重複標籤
 * - 表裡已經有 translation 就整個跳過（idempotent）
 * 走 JDBC batch，不經過 JPA / 快取；結束時清 locales / tags 清單快取。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.catalog.seed.enabled", havingValue = "true")
public class LargeDatasetSeeder implements ApplicationRunner {

    private static final String[] WORDS = {
            "welcome", "login", "logout", "profile", "settings", "save", "cancel", "delete",
            "error", "success", "title", "subtitle", "button", "label", "message", "hint"
    };

    private final JdbcTemplate jdbc;
    private final SeedProperties props;
    private final ExportCacheManager exportCache;

    @Override
    public void run(ApplicationArguments args) {
        Long existing = jdbc.queryForObject("select count(*) from translations", Long.class);
        if (existing != null && existing > 0) {
            log.info("[Seed] skipped: translations already has {} rows", existing);
            return;
        }

        Random rnd = new Random(42);
        int chunk = Math.max(1, props.getChunkSize());

        List<Long> tagIds = seedTags();
        int inserted = seedTranslations(rnd, chunk);
        int pivots = seedPivots(rnd, chunk, tagIds);

        exportCache.evictLists();
        log.info("[Seed] complete: tags={} translations={} pivots={}", tagIds.size(), inserted, pivots);
    }

    /** 只補缺的：translations 清空後重灌時，舊的 seed 標籤還在 */
    private List<Long> seedTags() {
        Set<String> existing = new HashSet<>(
                jdbc.queryForList("select name from tags where name like 'seed-tag-%'", String.class)
        );

        List<Object[]> rows = new ArrayList<>();
        for (int i = 1; i <= Math.max(1, props.getTags()); i++) {
            String name = "seed-tag-" + i;
            if (!existing.contains(name)) rows.add(new Object[]{name});
        }
        if (!rows.isEmpty()) {
            jdbc.batchUpdate("insert into tags (name) values (?)", rows);
        }
        log.info("[Seed] tags: {} existing, {} inserted", existing.size(), rows.size());
        return jdbc.queryForList("select id from tags where name like 'seed-tag-%' order by id", Long.class);
    }

    private int seedTranslations(Random rnd, int chunk) {
        List<String> locales = props.getLocales();
        Timestamp now = Timestamp.from(Instant.now());
        int total = Math.max(0, props.getTranslations());

        List<Object[]> batch = new ArrayList<>(chunk);
        for (int i = 0; i < total; i++) {
            String locale = locales.get(i % locales.size());
            // 序號保證 (key, locale) 不重複
            String key = WORDS[rnd.nextInt(WORDS.length)] + "." + WORDS[rnd.nextInt(WORDS.length)] + "." + i;
            String value = WORDS[rnd.nextInt(WORDS.length)] + " " + WORDS[rnd.nextInt(WORDS.length)] + " #" + i;
            batch.add(new Object[]{key, value, locale, now, now});

            if (batch.size() >= chunk) {
                flushTranslations(batch);
                log.info("[Seed] translations {}/{}", i + 1, total);
            }
        }
        flushTranslations(batch);
        return total;
    }

    private void flushTranslations(List<Object[]> batch) {
        if (batch.isEmpty()) return;
        jdbc.batchUpdate("""
                insert into translations (translation_key, translation_value, locale, created_at, updated_at)
                values (?, ?, ?, ?, ?)
                """, batch);
        batch.clear();
    }

    private int seedPivots(Random rnd, int chunk, List<Long> tagIds) {
        if (tagIds.isEmpty()) return 0;
        List<Long> translationIds = jdbc.queryForList("select id from translations order by id", Long.class);

        int count = 0;
        List<Object[]> batch = new ArrayList<>(chunk);
        for (Long tid : translationIds) {
            int n = 1 + rnd.nextInt(Math.min(3, tagIds.size()));
            Set<Long> picked = new LinkedHashSet<>();
            while (picked.size() < n) {
                picked.add(tagIds.get(rnd.nextInt(tagIds.size())));
            }
            for (Long tagId : picked) {
                batch.add(new Object[]{tagId, tid});
            }

            if (batch.size() >= chunk) {
                count += flushPivots(batch);
            }
        }
        count += flushPivots(batch);
        return count;
    }

    private int flushPivots(List<Object[]> batch) {
        if (batch.isEmpty()) return 0;
        int n = batch.size();
        jdbc.batchUpdate("insert into tag_translation (tag_id, translation_id) values (?, ?)", batch);
        batch.clear();
        return n;
    }
}
