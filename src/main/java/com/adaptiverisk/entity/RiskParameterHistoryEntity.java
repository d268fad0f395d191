package com.adaptiverisk.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
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
 * JPA entity for the risk_parameter_history table.
 * Append-only audit trail of every accepted risk parameter change, including changes
 * made automatically by threshold calibration.
 */
@Entity
@Table(name = "risk_parameter_history")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskParameterHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "parameter_name", length = 64, nullable = false)
    private String name;

    @Column(name = "old_value", precision = 19, scale = 6)
    private BigDecimal oldValue;

    @Column(name = "new_value", precision = 19, scale = 6)
    private BigDecimal newValue;

    /** API, CALIBRATION or SYSTEM. */
    @Column(name = "changed_by", length = 32)
    private String changedBy;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "changed_at")
    private LocalDateTime timestamp;
}
