package com.calai.catalog.translation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * 全部欄位可選：沒給的不動。
 * tags：null = 關聯不動；[] = 清空；其他 = 整組取代
 */
public record UpdateTranslationRequest(
        @Size(max = 255) @Pattern(regexp = TranslationConstraints.NOT_BLANK_REGEX, message = "must not be blank")
        String key,
        @Size(max = 4096) @Pattern(regexp = TranslationConstraints.NOT_BLANK_REGEX, message = "must not be blank")
        String value,
        @Pattern(regexp = TranslationConstraints.LOCALE_REGEX, message = TranslationConstraints.LOCALE_MESSAGE)
        String locale,
        List<@NotBlank @Size(max = 255) String> tags
) {}
