package com.calai.catalog.translation.controller;

import com.calai.catalog.translation.cache.ExportCacheEntry;
import com.calai.catalog.translation.cache.ExportCacheManager;
import com.calai.catalog.translation.dto.CatalogListResponses;
import com.calai.catalog.translation.dto.CreateTranslationRequest;
import com.calai.catalog.translation.dto.TranslationConstraints;
import com.calai.catalog.translation.dto.TranslationDto;
import com.calai.catalog.translation.dto.TranslationPageResponse;
import com.calai.catalog.translation.dto.UpdateTranslationRequest;
import com.calai.catalog.translation.query.TranslationFilter;
import com.calai.catalog.translation.service.TranslationService;
import com.calai.catalog.translation.web.TranslationValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "translations")
@RestController
@RequestMapping(value = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
public class TranslationController {

    private final TranslationService svc;
    private final ExportCacheManager exportCache;

    public TranslationController(TranslationService svc, ExportCacheManager exportCache) {
        this.svc = svc;
        this.exportCache = exportCache;
    }

    // ===== 固定路徑先宣告（export / locales / tags 不會被當成 {id}） =====

    @Operation(summary = "Key -> value export for one locale, optionally restricted to any of the given tags (cached)")
    @GetMapping("/translations/export")
    public ResponseEntity<ExportCacheEntry> export(
            @RequestParam(value = "locale", required = false, defaultValue = "en") String locale,
            @RequestParam(value = "tags", required = false) List<String> tags
    ) {
        if (!TranslationConstraints.isValidLocale(locale)) {
            throw new TranslationValidationException("locale", TranslationConstraints.LOCALE_MESSAGE);
        }
        return ResponseEntity.ok(exportCache.get(locale, tags));
    }

    @GetMapping("/translations/locales")
    public ResponseEntity<CatalogListResponses.Locales> locales() {
        return ResponseEntity.ok(new CatalogListResponses.Locales(exportCache.availableLocales()));
    }

    @GetMapping("/translations/tags")
    public ResponseEntity<CatalogListResponses.Tags> tags() {
        return ResponseEntity.ok(new CatalogListResponses.Tags(exportCache.availableTags()));
    }

    // ===== 列表 / 搜尋（不快取） =====

    @Operation(summary = "Filtered, paginated listing (per_page clamped to 1..100)")
    @GetMapping({"/translations", "/search/translations"})
    public ResponseEntity<TranslationPageResponse> search(
            @RequestParam(value = "key", required = false) String key,
            @RequestParam(value = "content", required = false) String content,
            @RequestParam(value = "locale", required = false) String locale,
            @RequestParam(value = "tags", required = false) List<String> tags,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "per_page", required = false) Integer perPage
    ) {
        var filter = new TranslationFilter(key, content, locale, tags);
        return ResponseEntity.ok(svc.search(filter, page, perPage));
    }

    // ===== CRUD =====

    @GetMapping("/translations/{id:\\d+}")
    public ResponseEntity<TranslationDto> show(@PathVariable("id") Long id) {
        return ResponseEntity.ok(svc.get(id));
    }

    @PostMapping(value = "/translations", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TranslationDto> create(@Valid @RequestBody CreateTranslationRequest req) {
        var dto = svc.create(req.key(), req.value(), req.locale(), req.tags());
        return ResponseEntity.status(HttpStatus.CREATED).body(dto);
    }

    @RequestMapping(
            value = "/translations/{id:\\d+}",
            method = {RequestMethod.PUT, RequestMethod.PATCH},
            consumes = MediaType.APPLICATION_JSON_VALUE
    )
    public ResponseEntity<TranslationDto> update(
            @PathVariable("id") Long id,
            @Valid @RequestBody UpdateTranslationRequest req
    ) {
        return ResponseEntity.ok(svc.update(id, req.key(), req.value(), req.locale(), req.tags()));
    }

    @DeleteMapping("/translations/{id:\\d+}")
    public ResponseEntity<CatalogListResponses.Message> destroy(@PathVariable("id") Long id) {
        svc.delete(id);
        return ResponseEntity.ok(new CatalogListResponses.Message("Translation deleted successfully"));
    }
}
