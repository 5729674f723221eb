package com.example.roadcare.entity;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.UUID;

@Repository
public interface ImageRowRepository extends ReactiveCrudRepository<ImageRow, UUID> {

    String ACTIVE_COLUMNS = "SELECT id, axe, session_id, cumuld, cumuld_session, sens, \"index\", \"captureDate\", "
            + "note_globale, obsolette FROM image WHERE obsolette = false AND axe IS NOT NULL AND cumuld IS NOT NULL";

    // 所有未过时记录
    @Query(ACTIVE_COLUMNS)
    Flux<ImageRow> findActive();

    // 指定轴线的未过时记录
    @Query(ACTIVE_COLUMNS + " AND axe IN (:axes)")
    Flux<ImageRow> findActiveByAxes(@Param("axes") Collection<String> axes);

    // 重置全部过时标记（null 一并归为 false）
    @Modifying
    @Query("UPDATE image SET obsolette = false WHERE obsolette IS NULL OR obsolette = true")
    Mono<Integer> resetAll();

    @Modifying
    @Query("UPDATE image SET obsolette = false WHERE (obsolette IS NULL OR obsolette = true) AND axe IN (:axes)")
    Mono<Integer> resetByAxes(@Param("axes") Collection<String> axes);

    // 批量标记过时
    @Modifying
    @Query("UPDATE image SET obsolette = true WHERE id IN (:ids)")
    Mono<Integer> markObsolete(@Param("ids") Collection<UUID> ids);

    // 限定轴线，重复ID落在范围外轴线上的行不受影响
    @Modifying
    @Query("UPDATE image SET obsolette = true WHERE id IN (:ids) AND axe IN (:axes)")
    Mono<Integer> markObsoleteInAxes(@Param("ids") Collection<UUID> ids, @Param("axes") Collection<String> axes);
}
