package com.calai.catalog.translation.cache;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RedisCacheStoreTest {

    @SuppressWarnings("unchecked")
    @Test
    void set_with_ttl_uses_expiring_write() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redis.opsForValue()).thenReturn(ops);

        new RedisCacheStore(redis).set("k", "v", Duration.ofSeconds(300));

        verify(ops).set("k", "v", Duration.ofSeconds(300));
    }

    @SuppressWarnings("unchecked")
    @Test
    void list_keys_scans_with_escaped_prefix_and_closes_cursor() {
        StringRedisTemplate redis = mock(StringRedisTemplate.class);
        Cursor<String> cursor = mock(Cursor.class);
        when(cursor.hasNext()).thenReturn(true, true, false);
        when(cursor.next()).thenReturn("translations_export:en:tags:a", "translations_export:en:tags:b");
        when(redis.scan(any(ScanOptions.class))).thenReturn(cursor);

        var keys = new RedisCacheStore(redis).listKeys("translations_export:en:tags:");

        assertThat(keys).containsExactlyInAnyOrder("translations_export:en:tags:a", "translations_export:en:tags:b");

        ArgumentCaptor<ScanOptions> captor = ArgumentCaptor.forClass(ScanOptions.class);
        verify(redis).scan(captor.capture());
        assertThat(captor.getValue().getPattern()).isEqualTo("translations_export:en:tags:*");
        verify(cursor).close();
    }

    @Test
    void glob_characters_in_prefix_are_escaped() {
        assertThat(RedisCacheStore.escapeGlob("a*b?c[d]")).isEqualTo("a\\*b\\?c\\[d\\]");
    }
}
