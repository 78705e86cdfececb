package com.calai.catalog.translation.cache;

import java.util.Set;

/**
 * 能依前綴列出 key 的後端。
 * 有這個能力，invalidate 才能把某 locale 所有帶標籤的 export 一次清掉；
 * 沒有就退回只清 base key（帶標籤的等 TTL 自然過期）。
 */
public interface KeyListingCacheStore extends CacheStore {

    Set<String> listKeys(String prefix);
}
