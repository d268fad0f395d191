package com.adaptiverisk.repository.jpa;

import com.adaptiverisk.entity.RiskParameterHistoryEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the risk_parameter_history table. Rows are append-only.
 */
@Repository
public interface RiskParameterHistoryJpaRepository extends JpaRepository<RiskParameterHistoryEntity, Long> {

    List<RiskParameterHistoryEntity> findByNameOrderByTimestampDesc(String name);

    /** Inclusive on both ends. */
    List<RiskParameterHistoryEntity> findByTimestampBetweenOrderByTimestampDesc(LocalDateTime from, LocalDateTime to);
}
