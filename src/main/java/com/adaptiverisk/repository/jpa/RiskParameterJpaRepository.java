package com.adaptiverisk.repository.jpa;

import com.adaptiverisk.entity.RiskParameterEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the risk_parameters table, keyed by parameter name.
 */
@Repository
public interface RiskParameterJpaRepository extends JpaRepository<RiskParameterEntity, String> {}
