package com.calai.catalog.translation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CreateTranslationRequest(
        @NotBlank @Size(max = 255) String key,
        @NotBlank @Size(max = 4096) String value,
        @NotBlank @Pattern(regexp = TranslationConstraints.LOCALE_REGEX, message = TranslationConstraints.LOCALE_MESSAGE)
        String locale,
        List<@NotBlank @Size(max = 255) String> tags
) {}
