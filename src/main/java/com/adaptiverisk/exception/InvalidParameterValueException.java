package com.adaptiverisk.exception;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A risk parameter update was refused (threshold outside [0, 1], negative limit).
 * The stored value is left untouched.
 */
public class InvalidParameterValueException extends BaseException {

    public InvalidParameterValueException(String name, BigDecimal value, String constraint) {
        super(
                ErrorCode.INVALID_PARAMETER_VALUE,
                "Invalid value " + value + " for " + name + ": " + constraint,
                Map.of("parameter", name, "value", String.valueOf(value), "constraint", constraint));
    }
}
