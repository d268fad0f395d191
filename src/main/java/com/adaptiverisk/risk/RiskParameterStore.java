package com.adaptiverisk.risk;

import com.adaptiverisk.domain.enums.RiskParameterName;
import com.adaptiverisk.domain.model.RiskParameter;
import com.adaptiverisk.domain.model.RiskParameterHistory;
import com.adaptiverisk.exception.BusinessException;
import com.adaptiverisk.exception.ErrorCode;
import com.adaptiverisk.exception.InvalidParameterValueException;
import com.adaptiverisk.exception.ResourceNotFoundException;
import com.adaptiverisk.observability.EngineMetricsService;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Named risk parameters with an audit trail.
 *
 * <p>Every read goes through {@link #get(RiskParameterName)}: a parameter that was never
 * written resolves to its documented default, which is persisted on first access so the
 * history starts with a SYSTEM entry. Parameters are never deleted.
 *
 * <p>Writes are atomic read-modify-write per parameter name: {@link ConcurrentHashMap#compute}
 * holds the entry for the duration of validate, persist and publish, so two calibration
 * passes racing on the same threshold cannot lose an update. Different parameters never
 * contend with each other.
 *
 * <p>A rejected value leaves both the in-memory and the stored value untouched.
 */
@Service
public class RiskParameterStore {

    private static final Logger log = LoggerFactory.getLogger(RiskParameterStore.class);

    public static final String CHANGED_BY_API = "API";
    public static final String CHANGED_BY_CALIBRATION = "CALIBRATION";
    public static final String CHANGED_BY_SYSTEM = "SYSTEM";

    private final RiskParameterPersistenceService persistenceService;
    private final EngineMetricsService engineMetricsService;

    private final ConcurrentHashMap<RiskParameterName, RiskParameter> parameters = new ConcurrentHashMap<>();

    public RiskParameterStore(
            RiskParameterPersistenceService persistenceService, EngineMetricsService engineMetricsService) {
        this.persistenceService = persistenceService;
        this.engineMetricsService = engineMetricsService;
    }

    /**
     * Current value, or the documented default if the parameter was never set.
     */
    public BigDecimal get(RiskParameterName name) {
        return current(name).getValue();
    }

    /**
     * Full current state of a parameter including its last change.
     */
    public RiskParameter current(RiskParameterName name) {
        return parameters.computeIfAbsent(name, this::loadOrDefault);
    }

    /**
     * Sets a parameter to an explicit value.
     *
     * @throws InvalidParameterValueException if the value is out of range for the parameter
     */
    public RiskParameter set(RiskParameterName name, BigDecimal value, String reason, String changedBy) {
        validate(name, value);
        return adjust(name, current -> value, reason, changedBy);
    }

    /**
     * Atomically derives a new value from the current one and stores it.
     *
     * <p>The function sees the latest committed value; no other write to the same
     * parameter can interleave between the read and the write. A result equal to the
     * current value writes no history row and returns the current state unchanged.
     *
     * @throws InvalidParameterValueException if the derived value is out of range
     */
    public RiskParameter adjust(
            RiskParameterName name, UnaryOperator<BigDecimal> adjustment, String reason, String changedBy) {
        return parameters.compute(name, (key, existing) -> {
            RiskParameter current = existing != null ? existing : loadOrDefault(key);
            BigDecimal oldValue = current.getValue();
            BigDecimal newValue = adjustment.apply(oldValue);
            validate(key, newValue);
            if (newValue.compareTo(oldValue) == 0) {
                log.debug("Risk parameter {} already {}, nothing recorded", key.getKey(), oldValue);
                return current;
            }

            RiskParameter updated = RiskParameter.builder()
                    .name(key.getKey())
                    .value(newValue)
                    .previousValue(oldValue)
                    .reason(reason)
                    .updatedAt(LocalDateTime.now())
                    .build();
            persistenceService.save(updated, oldValue, changedBy);
            engineMetricsService.recordParameterUpdate(key.getKey(), changedBy);

            log.info("Risk parameter {} changed {} -> {} by {}: {}", key.getKey(), oldValue, newValue, changedBy, reason);
            return updated;
        });
    }

    /**
     * Current values of every recognized parameter, defaults included, in declaration order.
     */
    public Map<String, BigDecimal> getAll() {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        for (RiskParameterName name : RiskParameterName.values()) {
            values.put(name.getKey(), get(name));
        }
        return values;
    }

    /**
     * Full state of every recognized parameter.
     */
    public List<RiskParameter> list() {
        List<RiskParameter> result = new ArrayList<>();
        for (RiskParameterName name : RiskParameterName.values()) {
            result.add(current(name));
        }
        return result;
    }

    /**
     * Audit trail for one parameter, newest first.
     */
    public List<RiskParameterHistory> history(RiskParameterName name) {
        return persistenceService.history(name.getKey());
    }

    /**
     * Audit trail across all parameters for changes in [from, to], newest first.
     *
     * @throws BusinessException BAD_REQUEST if {@code to} is before {@code from}
     */
    public List<RiskParameterHistory> historyBetween(LocalDateTime from, LocalDateTime to) {
        if (to.isBefore(from)) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "History range ends before it starts: " + from + " > " + to);
        }
        return persistenceService.historyBetween(from, to);
    }

    /**
     * Resolves an external parameter key.
     *
     * @throws ResourceNotFoundException if the key names no recognized parameter
     */
    public RiskParameterName resolve(String key) {
        RiskParameterName name = RiskParameterName.fromKey(key);
        if (name == null) {
            throw new ResourceNotFoundException("Risk parameter", key);
        }
        return name;
    }

    /**
     * Fraction parameters stay within [0, 1]; every other limit must be non-negative.
     */
    void validate(RiskParameterName name, BigDecimal value) {
        if (value == null) {
            throw new InvalidParameterValueException(name.getKey(), null, "value is required");
        }
        if (value.signum() < 0) {
            throw new InvalidParameterValueException(name.getKey(), value, "must not be negative");
        }
        if (name.isUnitInterval() && value.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidParameterValueException(name.getKey(), value, "must be between 0 and 1");
        }
    }

    private RiskParameter loadOrDefault(RiskParameterName name) {
        return persistenceService.find(name.getKey()).orElseGet(() -> {
            RiskParameter initial = RiskParameter.builder()
                    .name(name.getKey())
                    .value(name.getDefaultValue())
                    .reason("Default")
                    .updatedAt(LocalDateTime.now())
                    .build();
            persistenceService.save(initial, null, CHANGED_BY_SYSTEM);
            log.info("Risk parameter {} initialised to default {}", name.getKey(), name.getDefaultValue());
            return initial;
        });
    }
}
