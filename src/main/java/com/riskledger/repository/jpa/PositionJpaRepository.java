package com.riskledger.repository.jpa;

import com.riskledger.entity.PositionEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, Long> {

    List<PositionEntity> findBySessionId(String sessionId);

    Optional<PositionEntity> findBySessionIdAndSymbol(String sessionId, String symbol);

    void deleteBySessionId(String sessionId);
}
