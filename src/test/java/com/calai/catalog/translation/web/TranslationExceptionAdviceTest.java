package com.calai.catalog.translation.web;

import com.calai.catalog.common.web.ApiExceptionHandler;
import com.calai.catalog.common.web.RequestIdFilter;
import com.calai.catalog.translation.cache.ExportCacheManager;
import com.calai.catalog.translation.controller.TranslationController;
import com.calai.catalog.translation.service.TranslationService;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(controllers = TranslationController.class)
@Import({TranslationExceptionAdvice.class, ApiExceptionHandler.class, RequestIdFilter.class})
@TestPropertySource(properties = "app.catalog.store.retry-after-sec=9")
class TranslationExceptionAdviceTest {

    @Autowired MockMvc mvc;

    @MockitoBean TranslationService service;
    @MockitoBean ExportCacheManager exportCache;

    @Test
    void missing_translation_should_404_with_requestId() throws Exception {
        Mockito.when(service.get(99L)).thenThrow(new TranslationNotFoundException(99L));

        mvc.perform(get("/api/v1/translations/99").header("X-Request-Id", "RID-404"))
                .andExpect(status().isNotFound())
                .andExpect(header().string("X-Request-Id", "RID-404"))
                .andExpect(jsonPath("$.code").value("TRANSLATION_NOT_FOUND"))
                .andExpect(jsonPath("$.requestId").value("RID-404"));
    }

    @Test
    void duplicate_pair_should_409() throws Exception {
        Mockito.when(service.create(eq("welcome.msg"), eq("Hi"), eq("en"), any()))
                .thenThrow(new TranslationConflictException("welcome.msg", "en"));

        mvc.perform(post("/api/v1/translations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"key":"welcome.msg","value":"Hi","locale":"en"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("TRANSLATION_CONFLICT"))
                .andExpect(jsonPath("$.message").value("Translation with this key and locale already exists"));
    }

    @Test
    void invalid_body_should_422_with_field_errors() throws Exception {
        mvc.perform(post("/api/v1/translations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"key":"","value":"Hi","locale":"en:US","tags":["web",""]}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.errors.key").exists())
                .andExpect(jsonPath("$.errors.locale").exists())
                .andExpect(jsonPath("$.errors.tags").exists());

        Mockito.verifyNoInteractions(service);
    }

    @Test
    void blank_update_value_should_422() throws Exception {
        mvc.perform(put("/api/v1/translations/5")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"value":"   "}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors.value").value("must not be blank"));
    }

    @Test
    void export_with_bad_locale_should_422() throws Exception {
        mvc.perform(get("/api/v1/translations/export").param("locale", "en:tags:x"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors.locale").exists());

        Mockito.verifyNoInteractions(exportCache);
    }

    @Test
    void store_outage_should_503_with_retry_after() throws Exception {
        Mockito.doThrow(new StoreUnavailableException(new RuntimeException("down"), 5)).when(service).delete(anyLong());

        mvc.perform(delete("/api/v1/translations/5"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "5"))
                .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"))
                .andExpect(jsonPath("$.retryAfterSec").value(5));
    }

    @Test
    void read_path_db_timeout_should_503_with_configured_retry_after() throws Exception {
        Mockito.when(service.search(any(), any(), any())).thenThrow(new QueryTimeoutException("slow"));

        // 秒數來自 app.catalog.store.retry-after-sec，不是寫死的 5
        mvc.perform(get("/api/v1/translations").param("key", "a"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "9"))
                .andExpect(jsonPath("$.retryAfterSec").value(9));
    }

    @Test
    void non_numeric_per_page_should_400() throws Exception {
        mvc.perform(get("/api/v1/translations").param("per_page", "lots"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void unexpected_error_should_500_without_leaking_message() throws Exception {
        Mockito.when(service.get(1L)).thenThrow(new IllegalStateException("secret detail"));

        mvc.perform(get("/api/v1/translations/1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("INTERNAL_ERROR"));
    }
}
