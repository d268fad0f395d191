package com.adaptiverisk.risk;

import com.adaptiverisk.domain.model.RiskParameter;
import com.adaptiverisk.domain.model.RiskParameterHistory;
import com.adaptiverisk.entity.RiskParameterHistoryEntity;
import com.adaptiverisk.mapper.RiskParameterHistoryMapper;
import com.adaptiverisk.mapper.RiskParameterMapper;
import com.adaptiverisk.repository.jpa.RiskParameterHistoryJpaRepository;
import com.adaptiverisk.repository.jpa.RiskParameterJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists risk parameter values and their audit trail to H2.
 *
 * <p>Read one value, write a value together with its history row, read the audit trail
 * by parameter or by time range. {@link RiskParameterStore} owns defaults, validation
 * and atomicity; this class only moves rows.
 */
@Service
public class RiskParameterPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(RiskParameterPersistenceService.class);

    private final RiskParameterJpaRepository riskParameterJpaRepository;
    private final RiskParameterHistoryJpaRepository riskParameterHistoryJpaRepository;
    private final RiskParameterMapper riskParameterMapper;
    private final RiskParameterHistoryMapper riskParameterHistoryMapper;

    public RiskParameterPersistenceService(
            RiskParameterJpaRepository riskParameterJpaRepository,
            RiskParameterHistoryJpaRepository riskParameterHistoryJpaRepository,
            RiskParameterMapper riskParameterMapper,
            RiskParameterHistoryMapper riskParameterHistoryMapper) {
        this.riskParameterJpaRepository = riskParameterJpaRepository;
        this.riskParameterHistoryJpaRepository = riskParameterHistoryJpaRepository;
        this.riskParameterMapper = riskParameterMapper;
        this.riskParameterHistoryMapper = riskParameterHistoryMapper;
    }

    /**
     * Stored state of a parameter, empty if it was never written.
     */
    public Optional<RiskParameter> find(String name) {
        return riskParameterJpaRepository.findById(name).map(riskParameterMapper::toDomain);
    }

    /**
     * Writes the new current value and appends one history row.
     *
     * @param parameter the parameter as it should now read
     * @param oldValue  value before this change (null for the first write)
     * @param changedBy API, CALIBRATION or SYSTEM
     */
    @Transactional
    public void save(RiskParameter parameter, BigDecimal oldValue, String changedBy) {
        riskParameterJpaRepository.save(riskParameterMapper.toEntity(parameter));

        RiskParameterHistoryEntity history = RiskParameterHistoryEntity.builder()
                .name(parameter.getName())
                .oldValue(oldValue)
                .newValue(parameter.getValue())
                .changedBy(changedBy)
                .reason(parameter.getReason())
                .timestamp(parameter.getUpdatedAt() != null ? parameter.getUpdatedAt() : LocalDateTime.now())
                .build();
        riskParameterHistoryJpaRepository.save(history);

        log.debug("Persisted {} = {} (was {}, by {})", parameter.getName(), parameter.getValue(), oldValue, changedBy);
    }

    /**
     * Change history for one parameter, newest first.
     */
    public List<RiskParameterHistory> history(String name) {
        return riskParameterHistoryMapper.toDomainList(
                riskParameterHistoryJpaRepository.findByNameOrderByTimestampDesc(name));
    }

    /**
     * Changes to any parameter with a timestamp in [from, to], newest first.
     */
    public List<RiskParameterHistory> historyBetween(LocalDateTime from, LocalDateTime to) {
        return riskParameterHistoryMapper.toDomainList(
                riskParameterHistoryJpaRepository.findByTimestampBetweenOrderByTimestampDesc(from, to));
    }
}
