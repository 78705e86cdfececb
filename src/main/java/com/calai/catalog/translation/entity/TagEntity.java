package com.calai.catalog.translation.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** 標籤：只由 find-or-create 產生，本服務不刪除 */
@Getter @Setter @NoArgsConstructor
@Entity @Table(
        name = "tags",
        uniqueConstraints = @UniqueConstraint(name = "uq_tags_name", columnNames = "name")
)
public class TagEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    public TagEntity(String name) {
        this.name = name;
    }
}
