package com.adaptiverisk.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the risk_parameters table.
 * One row per named parameter holding its current value and the last change.
 */
@Entity
@Table(name = "risk_parameters")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskParameterEntity {

    /** Snake_case parameter key, e.g. auto_trade_confidence_threshold. */
    @Id
    @Column(length = 64)
    private String name;

    @Column(name = "param_value", precision = 19, scale = 6, nullable = false)
    private BigDecimal value;

    @Column(name = "previous_value", precision = 19, scale = 6)
    private BigDecimal previousValue;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
