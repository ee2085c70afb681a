package com.riskledger.repository.jpa;

import com.riskledger.entity.TransactionEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Fill journal queries. Paging is newest first. */
@Repository
public interface TransactionJpaRepository extends JpaRepository<TransactionEntity, Long> {

    List<TransactionEntity> findBySessionIdOrderByTimestampDescIdDesc(String sessionId, Pageable pageable);

    List<TransactionEntity> findBySessionIdOrderByIdAsc(String sessionId);

    @Query("select t.fillId from TransactionEntity t"
            + " where t.sessionId = :sessionId and t.fillId is not null order by t.id desc")
    List<String> findRecentFillIds(@Param("sessionId") String sessionId, Pageable pageable);

    void deleteBySessionId(String sessionId);
}
