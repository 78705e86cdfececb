package com.calai.catalog.translation.dto;

import com.calai.catalog.translation.entity.TagEntity;
import com.calai.catalog.translation.entity.TranslationEntity;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

public record TranslationDto(
        Long id,
        String key,
        String value,
        String locale,
        List<String> tags,   // 名稱字典序
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt
) {
    /** 需在交易內呼叫（tags 是 lazy） */
    public static TranslationDto from(TranslationEntity e) {
        List<String> tagNames = e.getTags().stream()
                .map(TagEntity::getName)
                .sorted()
                .toList();
        return new TranslationDto(
                e.getId(), e.getKey(), e.getValue(), e.getLocale(),
                tagNames, e.getCreatedAt(), e.getUpdatedAt()
        );
    }
}
