package com.calai.catalog.translation.cache;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * export 快取 key 推導（純函式）。
 *
 * <pre>
 * translations_export:{locale}                  無標籤過濾
 * translations_export:{locale}:tags:{a},{b}     標籤去重、字典序排序後串接
 * </pre>
 *
 * 呼叫端給的標籤順序不影響結果；標籤名稱做 URL encode，分隔字元不會出現在名稱內。
 * {@link #taggedPrefix(String)} 只會是同一個 locale 的帶標籤 key 的前綴，
 * 不會誤中 "en" 對 "en-US" 這種 locale。
 */
public final class ExportCacheKeys {

    public static final String EXPORT_NAMESPACE = "translations_export:";
    public static final String TAG_SEGMENT = ":tags:";
    public static final String TAG_DELIMITER = ",";

    public static final String AVAILABLE_LOCALES_KEY = "translations:available_locales";
    public static final String AVAILABLE_TAGS_KEY = "translations:available_tags";

    private ExportCacheKeys() {}

    public static String deriveKey(String locale, Collection<String> tagNames) {
        SortedSet<String> tags = normalizeTags(tagNames);
        if (tags.isEmpty()) return localePrefix(locale);

        return taggedPrefix(locale) + tags.stream()
                .map(t -> URLEncoder.encode(t, StandardCharsets.UTF_8))
                .collect(Collectors.joining(TAG_DELIMITER));
    }

    /** 該 locale 無標籤 export 的 key */
    public static String localePrefix(String locale) {
        return EXPORT_NAMESPACE + locale;
    }

    /** 該 locale 所有帶標籤 export key 的共同前綴 */
    public static String taggedPrefix(String locale) {
        return localePrefix(locale) + TAG_SEGMENT;
    }

    /**
     * null / 空白名稱丟掉，大小寫敏感去重，字典序排序。
     * null 或全空白的輸入視為「沒有標籤過濾」。
     */
    public static SortedSet<String> normalizeTags(Collection<String> tagNames) {
        if (tagNames == null || tagNames.isEmpty()) return Collections.emptySortedSet();
        TreeSet<String> out = new TreeSet<>();
        for (String t : tagNames) {
            if (t == null || t.isBlank()) continue;
            out.add(t);
        }
        return out;
    }
}
