package com.riskledger.repository.jpa;

import com.riskledger.entity.PortfolioStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PortfolioStateJpaRepository extends JpaRepository<PortfolioStateEntity, String> {}
