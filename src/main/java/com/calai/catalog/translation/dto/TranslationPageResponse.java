package com.calai.catalog.translation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.data.domain.Page;

import java.util.List;

/** page 從 1 開始 */
public record TranslationPageResponse(
        List<TranslationDto> data,
        @JsonProperty("current_page") int currentPage,
        @JsonProperty("per_page") int perPage,
        long total,
        @JsonProperty("last_page") int lastPage
) {
    public static TranslationPageResponse of(Page<TranslationDto> p) {
        return new TranslationPageResponse(
                p.getContent(),
                p.getNumber() + 1,
                p.getSize(),
                p.getTotalElements(),
                Math.max(1, p.getTotalPages())
        );
    }
}
