package com.calai.catalog.translation.query;

import com.calai.catalog.translation.cache.ExportCacheKeys;

import java.util.Collection;
import java.util.List;
import java.util.SortedSet;

/**
 * 列表 / export 共用的過濾條件，全部可選。
 * 空白字串視同沒給。
 */
public record TranslationFilter(
        String key,        // key 子字串（不分大小寫）
        String content,    // value 子字串（不分大小寫）
        String locale,     // 完全相等
        Collection<String> tags  // 至少帶其中一個（OR）
) {
    public static TranslationFilter empty() {
        return new TranslationFilter(null, null, null, List.of());
    }

    public static TranslationFilter forExport(String locale, Collection<String> tags) {
        return new TranslationFilter(null, null, locale, tags);
    }

    public boolean hasKey() { return hasText(key); }

    public boolean hasContent() { return hasText(content); }

    public boolean hasLocale() { return hasText(locale); }

    public SortedSet<String> tagNames() {
        return ExportCacheKeys.normalizeTags(tags);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
