package com.riskledger.repository.jpa;

import com.riskledger.entity.PortfolioSnapshotEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PortfolioSnapshotJpaRepository extends JpaRepository<PortfolioSnapshotEntity, Long> {

    List<PortfolioSnapshotEntity> findBySessionIdOrderBySnapshotTimeDesc(String sessionId, Pageable pageable);

    void deleteBySessionId(String sessionId);
}
