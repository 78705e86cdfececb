package com.calai.catalog.translation.query;

import com.calai.catalog.translation.entity.TranslationEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;

/** 可直接丟給 TranslationRepository 執行的查詢：條件 + 分頁（排序一定含 id） */
public record TranslationQuery(
        Specification<TranslationEntity> where,
        Pageable pageable
) {}
