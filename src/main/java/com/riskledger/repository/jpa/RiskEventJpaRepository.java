package com.riskledger.repository.jpa;

import com.riskledger.domain.enums.SignalState;
import com.riskledger.entity.RiskEventEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RiskEventJpaRepository extends JpaRepository<RiskEventEntity, Long> {

    List<RiskEventEntity> findAllByOrderByEvaluatedAtDesc(Pageable pageable);

    List<RiskEventEntity> findByDecisionOrderByEvaluatedAtDesc(SignalState decision, Pageable pageable);
}
