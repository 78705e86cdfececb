package com.calai.catalog.common.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
        String errorCode,
        String message,
        String requestId,
        Map<String, String> errors,   // field -> message（只有 422 會有）
        Integer retryAfterSec
) {
    // ✅ 舊相容：同時輸出 code 欄位
    @JsonProperty("code")
    public String code() {
        return errorCode;
    }

    public ApiErrorResponse(String errorCode, String message, String requestId) {
        this(errorCode, message, requestId, null, null);
    }
}
