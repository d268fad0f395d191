package com.adaptiverisk.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    INVALID_PARAMETER_VALUE("INVALID_PARAMETER_VALUE", 400),
    NOT_FOUND("NOT_FOUND", 404),
    DATA_UNAVAILABLE("DATA_UNAVAILABLE", 404),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    COLLABORATOR_UNAVAILABLE("COLLABORATOR_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
