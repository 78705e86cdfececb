package com.calai.catalog.translation.service;

import com.calai.catalog.translation.cache.ExportCacheManager;
import com.calai.catalog.translation.dto.TranslationConstraints;
import com.calai.catalog.translation.dto.TranslationDto;
import com.calai.catalog.translation.dto.TranslationPageResponse;
import com.calai.catalog.translation.entity.TranslationEntity;
import com.calai.catalog.translation.query.TranslationFilter;
import com.calai.catalog.translation.query.TranslationQuery;
import com.calai.catalog.translation.query.TranslationQueryBuilder;
import com.calai.catalog.translation.repo.TranslationRepository;
import com.calai.catalog.translation.web.StoreUnavailableException;
import com.calai.catalog.translation.web.TranslationConflictException;
import com.calai.catalog.translation.web.TranslationNotFoundException;
import com.calai.catalog.translation.web.TranslationValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.function.Supplier;

/**
 * translation 的寫入協調，一次寫入 = 一個交易：
 * 1) 欄位驗證（交易外，不碰 DB）
 * 2) (key, locale) 衝突預檢（交易內、任何寫入之前）
 * 3) 標籤 find-or-create + translation 寫入 + 關聯整組取代，flush 讓 unique constraint 當場生效
 * 4) commit 之後、回傳之前：失效該 locale（改 locale 時新舊都清）的 export 快取
 * 任何一步失敗整個 rollback（含新建的標籤），也不會觸發失效。
 */
@Slf4j
@Service
public class TranslationService {

    private final TranslationRepository translations;
    private final TagService tagService;
    private final ExportCacheManager exportCache;
    private final TranslationQueryBuilder queries;
    private final TransactionTemplate tx;
    private final int storeRetryAfterSec;

    public TranslationService(
            TranslationRepository translations,
            TagService tagService,
            ExportCacheManager exportCache,
            TranslationQueryBuilder queries,
            PlatformTransactionManager txManager,
            @Value("${app.catalog.store.retry-after-sec:5}") int storeRetryAfterSec
    ) {
        this.translations = translations;
        this.tagService = tagService;
        this.exportCache = exportCache;
        this.queries = queries;
        this.tx = new TransactionTemplate(txManager);
        this.storeRetryAfterSec = Math.max(1, storeRetryAfterSec);
    }

    // ===== read（不走快取，永遠查 DB） =====

    @Transactional(readOnly = true)
    public TranslationDto get(Long id) {
        return TranslationDto.from(find(id));
    }

    @Transactional(readOnly = true)
    public TranslationPageResponse search(TranslationFilter filter, Integer page, Integer perPage) {
        TranslationQuery q = queries.build(filter, page, perPage);
        return TranslationPageResponse.of(
                translations.findAll(q.where(), q.pageable()).map(TranslationDto::from)
        );
    }

    // ===== write =====

    public TranslationDto create(String key, String value, String locale, Collection<String> tagNames) {
        requireKey(key);
        requireValue(value);
        requireLocale(locale);
        requireTags(tagNames);

        return withStore(() -> conflictOnViolation(key, locale, () -> tx.execute(status -> {
            if (translations.existsByKeyAndLocale(key, locale)) {
                throw new TranslationConflictException(key, locale);
            }
            SortedSet<String> names = tagService.ensureExist(tagNames);

            TranslationEntity t = new TranslationEntity();
            t.setKey(key);
            t.setValue(value);
            t.setLocale(locale);
            t.replaceTags(tagService.loadAll(names));
            translations.saveAndFlush(t);

            invalidateAfterCommit(List.of(locale));
            log.info("translation_created id={} locale={} tags={}", t.getId(), locale, names.size());
            return TranslationDto.from(t);
        })));
    }

    /**
     * key / value / locale 為 null 表示不改；tagNames 為 null 表示關聯不動。
     */
    public TranslationDto update(Long id, String key, String value, String locale, Collection<String> tagNames) {
        if (key != null) requireKey(key);
        if (value != null) requireValue(value);
        if (locale != null) requireLocale(locale);
        if (tagNames != null) requireTags(tagNames);

        return withStore(() -> tx.execute(status -> {
            TranslationEntity t = find(id);
            String previousLocale = t.getLocale();

            String nextKey = (key != null) ? key : t.getKey();
            String nextLocale = (locale != null) ? locale : previousLocale;
            if ((key != null || locale != null)
                    && translations.existsByKeyAndLocaleAndIdNot(nextKey, nextLocale, id)) {
                throw new TranslationConflictException(nextKey, nextLocale);
            }

            return conflictOnViolation(nextKey, nextLocale, () -> {
                if (tagNames != null) t.replaceTags(tagService.loadAll(tagService.ensureExist(tagNames)));
                if (key != null) t.setKey(key);
                if (value != null) t.setValue(value);
                if (locale != null) t.setLocale(locale);
                translations.saveAndFlush(t);

                invalidateAfterCommit(List.of(previousLocale, t.getLocale()));
                return TranslationDto.from(t);
            });
        }));
    }

    public void delete(Long id) {
        withStore(() -> {
            tx.executeWithoutResult(status -> {
                TranslationEntity t = find(id);
                String locale = t.getLocale();
                translations.delete(t);
                translations.flush();

                invalidateAfterCommit(List.of(locale));
                log.info("translation_deleted id={} locale={}", id, locale);
            });
            return null;
        });
    }

    // ===== helpers =====

    private TranslationEntity find(Long id) {
        if (id == null) throw new TranslationNotFoundException(null);
        return translations.findById(id).orElseThrow(() -> new TranslationNotFoundException(id));
    }

    /**
     * 有交易就掛 afterCommit（commit 成功才跑，且在 execute 回傳前跑完）；
     * 沒有交易（例如單元測試直接呼叫）就當場失效。
     */
    private void invalidateAfterCommit(Collection<String> locales) {
        Set<String> targets = new LinkedHashSet<>(locales);
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            invalidateQuietly(targets);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override public void afterCommit() {
                invalidateQuietly(targets);
            }
        });
    }

    private void invalidateQuietly(Set<String> locales) {
        try {
            exportCache.invalidate(locales);
        } catch (RuntimeException e) {
            // 寫入已經 commit：寧可快取舊一點，也不要回報假的失敗
            log.warn("export_cache_invalidate_failed locales={} err={}", locales, e.toString());
        }
    }

    private <T> T conflictOnViolation(String key, String locale, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataIntegrityViolationException e) {
            // 預檢之後被並行寫入搶先：uq_translations_key_locale 擋下
            throw new TranslationConflictException(key, locale, e);
        }
    }

    private <T> T withStore(Supplier<T> work) {
        try {
            return work.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException | CannotCreateTransactionException e) {
            log.warn("translation_store_unavailable err={}", e.toString());
            throw new StoreUnavailableException(e, storeRetryAfterSec);
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) throw new TranslationValidationException("key", "must not be blank");
        if (key.length() > TranslationConstraints.KEY_MAX) {
            throw new TranslationValidationException("key", "size must be between 0 and " + TranslationConstraints.KEY_MAX);
        }
    }

    private static void requireValue(String value) {
        if (value == null || value.isBlank()) throw new TranslationValidationException("value", "must not be blank");
        if (value.length() > TranslationConstraints.VALUE_MAX) {
            throw new TranslationValidationException("value", "size must be between 0 and " + TranslationConstraints.VALUE_MAX);
        }
    }

    private static void requireLocale(String locale) {
        if (!TranslationConstraints.isValidLocale(locale)) {
            throw new TranslationValidationException("locale", TranslationConstraints.LOCALE_MESSAGE);
        }
    }

    private static void requireTags(Collection<String> tagNames) {
        if (tagNames == null) return;
        for (String t : tagNames) {
            if (t == null || t.isBlank()) throw new TranslationValidationException("tags", "must not contain blank names");
            if (t.length() > TranslationConstraints.TAG_MAX) {
                throw new TranslationValidationException("tags", "names must be at most " + TranslationConstraints.TAG_MAX + " characters");
            }
        }
    }
}
