package com.calai.catalog.translation.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * 某 locale（可選標籤過濾）的 key → value 全量匯出。
 * 這個 record 同時是快取 payload 與 API 回應，JSON 形狀兩邊一致。
 */
public record ExportCacheEntry(
        String locale,
        Map<String, String> translations,
        int count,
        @JsonProperty("generated_at") Instant generatedAt
) {}
