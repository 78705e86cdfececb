package com.calai.catalog.translation.service;

import com.calai.catalog.translation.cache.ExportCacheKeys;
import com.calai.catalog.translation.entity.TagEntity;
import com.calai.catalog.translation.repo.TagRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 標籤 find-or-create，一律跑在呼叫端（translation 寫入）的交易裡：
 * translation 寫入失敗 rollback 時，本次新建的標籤也一起撤回。
 * 並行建同名標籤靠 uq_tags_name + INSERT IGNORE：晚到的那個等先到的 commit 後變成 0 rows。
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class TagService {

    private final TagRepository tags;

    /**
     * 確保每個名稱都有一列 tags；回傳正規化（去重、排序）後的名稱。
     * 依字典序插入，並行交易取鎖順序一致。
     */
    public SortedSet<String> ensureExist(Collection<String> rawNames) {
        SortedSet<String> names = ExportCacheKeys.normalizeTags(rawNames);
        if (names.isEmpty()) return names;

        Set<String> missing = new TreeSet<>(names);
        tags.findByNameIn(names).forEach(t -> missing.remove(t.getName()));

        for (String name : missing) {
            int inserted = tags.insertIgnore(name);
            if (inserted == 1) {
                log.debug("tag_created name={}", name);
            } else {
                // 併發：另一個請求先建好了
                log.debug("tag_create_raced name={}", name);
            }
        }
        return names;
    }

    /**
     * 載入 managed entity 給關聯 sync 用（locking read，並行交易剛建的也讀得到）。
     * 名稱比對依 DB collation（MySQL 預設不分大小寫時 "Web" 與 "web" 會是同一列）。
     */
    public List<TagEntity> loadAll(Collection<String> names) {
        if (names == null || names.isEmpty()) return List.of();
        return tags.findByNameInForShare(names);
    }
}
