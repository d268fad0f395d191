package com.adaptiverisk.calibration;

import com.adaptiverisk.domain.enums.ConfidenceBucket;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Outcome of the closed trades whose entry confidence fell in one bucket. */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BucketStatistics {

    ConfidenceBucket bucket;
    int count;

    /** 0 for an empty bucket. */
    double winRate;

    BigDecimal avgPnl;

    public static BucketStatistics empty(ConfidenceBucket bucket) {
        return BucketStatistics.builder()
                .bucket(bucket)
                .count(0)
                .winRate(0.0)
                .avgPnl(BigDecimal.ZERO)
                .build();
    }
}
