package com.adaptiverisk.calibration;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/**
 * Confidence calibration over one set of closed trades.
 *
 * <p>Well calibrated means the HIGH bucket wins more often than the LOW bucket.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CalibrationReport {

    BucketStatistics highConfidence;
    BucketStatistics mediumConfidence;
    BucketStatistics lowConfidence;

    @JsonProperty("is_well_calibrated")
    boolean wellCalibrated;
}
