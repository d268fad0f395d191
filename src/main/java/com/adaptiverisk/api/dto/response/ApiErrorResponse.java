package com.adaptiverisk.api.dto.response;

import com.adaptiverisk.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Value;

/**
 * Failure envelope: {@code {"success": false, "error": {...}}}.
 *
 * <p>{@code details} carries the machine-readable part of the failure, e.g. the offending
 * field for validation errors or the parameter and constraint for a refused risk update.
 * It is omitted when empty.
 */
@Value
@JsonPropertyOrder({"success", "error"})
public class ApiErrorResponse {

    boolean success = false;
    Failure error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Map<String, Object> copy = details == null || details.isEmpty()
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        return new ApiErrorResponse(
                new Failure(errorCode.getCode(), errorCode.getHttpStatus(), message, copy, path, Instant.now()));
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Failure {
        String code;
        int status;
        String message;
        Map<String, Object> details;
        String path;
        Instant timestamp;
    }
}
