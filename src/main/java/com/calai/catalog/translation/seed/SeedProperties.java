package com.calai.catalog.translation.seed;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "app.catalog.seed")
public class SeedProperties {

    /** 總開關：只給效能測試 / 本機壓測用 */
    private boolean enabled = false;

    private int translations = 100_000;

    private int tags = 10;

    /** 每批 insert 筆數 */
    private int chunkSize = 1_000;

    private List<String> locales = List.of("en", "fr", "es", "de", "zh-TW");
}
