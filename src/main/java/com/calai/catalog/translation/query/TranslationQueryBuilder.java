package com.calai.catalog.translation.query;

import com.calai.catalog.translation.entity.TagEntity;
import com.calai.catalog.translation.entity.TranslationEntity;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * TranslationFilter → JPA Specification + 分頁。
 * - key / content：lower(col) like %x%（使用者輸入的 % _ 當字面值）
 * - locale：等於
 * - tags：id in (帶任一標籤的 translation)，用子查詢避免多標籤命中時重複列
 * - 一律 order by id，跨頁結果穩定
 * 不丟錯：條件互相矛盾就是 0 筆。
 */
@Component
public class TranslationQueryBuilder {

    static final char LIKE_ESCAPE = '!';
    static final Sort STABLE_SORT = Sort.by(Sort.Direction.ASC, "id");

    private final int defaultPerPage;
    private final int maxPerPage;

    public TranslationQueryBuilder(
            @Value("${app.catalog.pagination.default-per-page:15}") int defaultPerPage,
            @Value("${app.catalog.pagination.max-per-page:100}") int maxPerPage
    ) {
        this.maxPerPage = Math.max(1, maxPerPage);
        this.defaultPerPage = clamp(defaultPerPage, 1, this.maxPerPage);
    }

    /** page 從 1 開始（對外 API 的習慣），超出範圍直接夾住不報錯 */
    public TranslationQuery build(TranslationFilter filter, Integer page, Integer perPage) {
        int size = clampPerPage(perPage);
        int p = clampPage(page, size);
        return new TranslationQuery(where(filter), PageRequest.of(p - 1, size, STABLE_SORT));
    }

    /**
     * 下限 1；上限讓 offset = (p - 1) * size 不超過 Integer.MAX_VALUE
     * （JPA setFirstResult 只吃 int），超過的頁數一律是空頁。
     */
    static int clampPage(Integer page, int size) {
        if (page == null || page < 1) return 1;
        int maxPage = Integer.MAX_VALUE / size + 1;
        return Math.min(page, maxPage);
    }

    /** export：只限 locale（+ 可選標籤），不分頁 */
    public TranslationQuery buildExport(String locale, Iterable<String> tags) {
        List<String> list = new ArrayList<>();
        if (tags != null) tags.forEach(list::add);
        return new TranslationQuery(where(TranslationFilter.forExport(locale, list)), Pageable.unpaged(STABLE_SORT));
    }

    public int clampPerPage(Integer perPage) {
        if (perPage == null) return defaultPerPage;
        return clamp(perPage, 1, maxPerPage);
    }

    public Specification<TranslationEntity> where(TranslationFilter filter) {
        final TranslationFilter f = (filter == null) ? TranslationFilter.empty() : filter;
        final Set<String> tagNames = f.tagNames();

        return (root, query, cb) -> {
            List<Predicate> ps = new ArrayList<>(4);

            if (f.hasKey()) {
                ps.add(cb.like(cb.lower(root.get("key")), containsPattern(f.key()), LIKE_ESCAPE));
            }
            if (f.hasContent()) {
                ps.add(cb.like(cb.lower(root.get("value")), containsPattern(f.content()), LIKE_ESCAPE));
            }
            if (f.hasLocale()) {
                ps.add(cb.equal(root.get("locale"), f.locale()));
            }
            if (!tagNames.isEmpty()) {
                if (query == null) {
                    // 沒有 CriteriaQuery 就建不了子查詢；不能默默放寬條件
                    throw new IllegalStateException("tag filter requires a CriteriaQuery");
                }
                Subquery<Long> sq = query.subquery(Long.class);
                Root<TranslationEntity> t = sq.from(TranslationEntity.class);
                Join<TranslationEntity, TagEntity> g = t.join("tags");
                sq.select(t.get("id")).where(g.get("name").in(tagNames));
                ps.add(root.get("id").in(sq));
            }

            return cb.and(ps.toArray(new Predicate[0]));
        };
    }

    static String containsPattern(String raw) {
        String lower = raw.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length() + 4).append('%');
        for (char c : lower.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) sb.append(LIKE_ESCAPE);
            sb.append(c);
        }
        return sb.append('%').toString();
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
