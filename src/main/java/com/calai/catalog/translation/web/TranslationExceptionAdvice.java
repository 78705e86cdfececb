package com.calai.catalog.translation.web;

import com.calai.catalog.common.web.ApiErrorResponse;
import com.calai.catalog.common.web.RequestIdFilter;
import com.calai.catalog.translation.controller.TranslationController;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * translation API 專屬錯誤映射：
 * - 404 TRANSLATION_NOT_FOUND
 * - 409 TRANSLATION_CONFLICT（(key, locale) 重複）
 * - 422 VALIDATION_FAILED（含 field → message）
 * - 503 STORE_UNAVAILABLE（+ Retry-After，可重試）
 * 其他交給 ApiExceptionHandler 兜底。
 */
@Slf4j
@RestControllerAdvice(assignableTypes = TranslationController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TranslationExceptionAdvice {

    /** 讀取路徑沒有 StoreUnavailableException 可帶秒數，跟寫入路徑用同一個設定 */
    private final int storeRetryAfterSec;

    public TranslationExceptionAdvice(@Value("${app.catalog.store.retry-after-sec:5}") int storeRetryAfterSec) {
        this.storeRetryAfterSec = Math.max(1, storeRetryAfterSec);
    }

    @ExceptionHandler(TranslationNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(TranslationNotFoundException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ApiErrorResponse("TRANSLATION_NOT_FOUND", "Translation not found", rid(req)));
    }

    @ExceptionHandler(TranslationConflictException.class)
    public ResponseEntity<ApiErrorResponse> handleConflict(TranslationConflictException e, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ApiErrorResponse("TRANSLATION_CONFLICT", e.getMessage(), rid(req)));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException e, HttpServletRequest req) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fe : e.getBindingResult().getFieldErrors()) {
            // tags[0] → tags，跟 service 端驗證的欄位名一致
            String field = fe.getField().replaceAll("\\[\\d+]$", "");
            errors.putIfAbsent(field, fe.getDefaultMessage());
        }
        return unprocessable(errors, req);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidParams(HandlerMethodValidationException e, HttpServletRequest req) {
        return unprocessable(Map.of("request", String.valueOf(e.getReason())), req);
    }

    @ExceptionHandler(TranslationValidationException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(TranslationValidationException e, HttpServletRequest req) {
        return unprocessable(Map.of(e.field(), e.reason()), req);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiErrorResponse> handleStoreUnavailable(StoreUnavailableException e, HttpServletRequest req) {
        return storeUnavailable(e.retryAfterSec(), req);
    }

    /** 讀取路徑（@Transactional 代理外層）直接丟出的 DB 連線錯誤 */
    @ExceptionHandler({
            TransientDataAccessException.class,
            DataAccessResourceFailureException.class,
            CannotCreateTransactionException.class
    })
    public ResponseEntity<ApiErrorResponse> handleStoreFailure(Exception e, HttpServletRequest req) {
        log.warn("RID={} store unavailable on {} {}: {}", rid(req), req.getMethod(), req.getRequestURI(), e.toString());
        return storeUnavailable(storeRetryAfterSec, req);
    }

    // ===== helpers =====

    private static ResponseEntity<ApiErrorResponse> unprocessable(Map<String, String> errors, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ApiErrorResponse("VALIDATION_FAILED", "The given data was invalid.", rid(req), errors, null));
    }

    private static ResponseEntity<ApiErrorResponse> storeUnavailable(int retryAfterSec, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSec))
                .body(new ApiErrorResponse("STORE_UNAVAILABLE", "STORE_UNAVAILABLE", rid(req), null, retryAfterSec));
    }

    private static String rid(HttpServletRequest req) {
        return RequestIdFilter.getOrCreate(req);
    }
}
