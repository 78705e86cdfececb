package com.calai.catalog.translation.cache;

import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCache;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SpringCacheStoreTest {

    @Test
    void get_set_delete_delegate_to_spring_cache() {
        ConcurrentMapCache cache = new ConcurrentMapCache("catalogExport");
        SpringCacheStore store = new SpringCacheStore(cache);

        store.set("k", "v", Duration.ofSeconds(5));
        assertThat(store.get("k")).contains("v");
        assertThat(cache.get("k", String.class)).isEqualTo("v");

        store.delete("k");
        assertThat(store.get("k")).isEmpty();
    }

    @Test
    void is_not_a_key_listing_store() {
        assertThat(new SpringCacheStore(new ConcurrentMapCache("x")))
                .isNotInstanceOf(KeyListingCacheStore.class);
    }
}
