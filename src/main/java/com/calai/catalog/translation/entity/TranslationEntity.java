package com.calai.catalog.translation.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

@Getter @Setter @NoArgsConstructor
@Entity @Table(
        name = "translations",
        uniqueConstraints = @UniqueConstraint(name = "uq_translations_key_locale", columnNames = {"translation_key", "locale"}),
        indexes = @Index(name = "idx_translations_locale", columnList = "locale")
)
public class TranslationEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** key / value 在 MySQL、H2 都是保留字，欄位名加前綴 */
    @Column(name = "translation_key", nullable = false, length = 255)
    private String key;

    @Column(name = "translation_value", nullable = false, length = 4096)
    private String value;

    @Column(name = "locale", nullable = false, length = 10)
    private String locale;

    // join table 只有兩個 FK，(tag_id, translation_id) 唯一
    @ManyToMany
    @JoinTable(
            name = "tag_translation",
            joinColumns = @JoinColumn(name = "translation_id"),
            inverseJoinColumns = @JoinColumn(name = "tag_id"),
            uniqueConstraints = @UniqueConstraint(name = "uq_tag_translation", columnNames = {"tag_id", "translation_id"})
    )
    @BatchSize(size = 100)
    private Set<TagEntity> tags = new HashSet<>();

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now(ZoneOffset.UTC);
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now(ZoneOffset.UTC);

    @PreUpdate void onUpdate() { updatedAt = OffsetDateTime.now(ZoneOffset.UTC); }

    /**
     * 整組取代（不是合併）。
     * 用 retainAll + addAll 只動差異，同一組標籤重複 sync 不會產生任何 join row 變更。
     */
    public void replaceTags(Collection<TagEntity> next) {
        tags.retainAll(next);
        tags.addAll(next);
    }
}
