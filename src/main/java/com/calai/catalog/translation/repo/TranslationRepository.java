package com.calai.catalog.translation.repo;

import com.calai.catalog.translation.entity.TranslationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TranslationRepository
        extends JpaRepository<TranslationEntity, Long>, JpaSpecificationExecutor<TranslationEntity> {

    boolean existsByKeyAndLocale(String key, String locale);

    boolean existsByKeyAndLocaleAndIdNot(String key, String locale, Long id);

    @Query("""
        select distinct t.locale
        from TranslationEntity t
        order by t.locale
    """)
    List<String> findDistinctLocales();
}
