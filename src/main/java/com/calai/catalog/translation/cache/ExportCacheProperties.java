package com.calai.catalog.translation.cache;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "app.catalog.cache")
public class ExportCacheProperties {

    /** caffeine（預設，單機） / redis（多機共用） / spring（不能列 key，降級失效） */
    private String store = "caffeine";

    /** export 快取 TTL（預設 300 秒） */
    private Duration exportTtl = Duration.ofSeconds(300);

    /** locales / tags 清單快取 TTL */
    private Duration listsTtl = Duration.ofHours(1);

    /** caffeine / spring 後端的筆數上限 */
    private long maxSize = 10_000;
}
