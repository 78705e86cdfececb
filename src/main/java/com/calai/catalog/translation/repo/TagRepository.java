package com.calai.catalog.translation.repo;

import com.calai.catalog.translation.entity.TagEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TagRepository extends JpaRepository<TagEntity, Long> {

    List<TagEntity> findByNameIn(Collection<String> names);

    /**
     * 名稱不存在就插入；已存在（或被並行交易搶先）則 0 rows，不丟 unique violation。
     * 跟呼叫端同一個交易：rollback 時一起撤回。
     */
    @Modifying
    @Query(
            value = """
        INSERT IGNORE INTO tags(name)
        VALUES (:name)
        """,
            nativeQuery = true
    )
    int insertIgnore(@Param("name") String name);

    /**
     * locking read：看得到其他交易剛 commit 的列（MySQL REPEATABLE READ 的 snapshot 看不到），
     * 同時擋住這些標籤在本交易結束前被改名 / 刪除。
     */
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("select g from TagEntity g where g.name in :names")
    List<TagEntity> findByNameInForShare(@Param("names") Collection<String> names);

    @Query("""
        select g.name
        from TagEntity g
        order by g.name
    """)
    List<String> findAllNamesSorted();
}
