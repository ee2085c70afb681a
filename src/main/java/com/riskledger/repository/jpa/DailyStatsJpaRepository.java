package com.riskledger.repository.jpa;

import com.riskledger.entity.DailyStatsEntity;
import java.time.LocalDate;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DailyStatsJpaRepository extends JpaRepository<DailyStatsEntity, Long> {

    Optional<DailyStatsEntity> findBySessionIdAndTradingDay(String sessionId, LocalDate tradingDay);
}
