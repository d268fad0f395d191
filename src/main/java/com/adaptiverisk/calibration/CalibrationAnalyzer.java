package com.adaptiverisk.calibration;

import com.adaptiverisk.config.CalibrationConfig;
import com.adaptiverisk.domain.enums.ConfidenceBucket;
import com.adaptiverisk.domain.enums.LookbackWindow;
import com.adaptiverisk.domain.model.ClosedTrade;
import com.adaptiverisk.domain.model.ThresholdSuggestion;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Measures whether stated confidence tracks realized outcomes and turns that into a
 * proposed auto-trade threshold.
 *
 * <p>Trades are bucketed by entry confidence (HIGH / MEDIUM / LOW). Only the HIGH bucket
 * drives the suggestion: a strong win rate over enough trades lowers the threshold by one
 * step (not below the floor), a weak one raises it (not above the ceiling), anything else
 * leaves it where it is. Trades without a recorded confidence are left out of every bucket.
 */
@Component
public class CalibrationAnalyzer {

    private static final BigDecimal CONFIDENCE_LOWERING = new BigDecimal("0.8");
    private static final BigDecimal CONFIDENCE_RAISING = new BigDecimal("0.9");
    private static final BigDecimal CONFIDENCE_UNCHANGED = new BigDecimal("0.5");

    private final CalibrationConfig calibrationConfig;

    public CalibrationAnalyzer(CalibrationConfig calibrationConfig) {
        this.calibrationConfig = calibrationConfig;
    }

    public CalibrationReport calibration(List<ClosedTrade> closedTrades) {
        Map<ConfidenceBucket, List<ClosedTrade>> buckets = new EnumMap<>(ConfidenceBucket.class);
        for (ConfidenceBucket bucket : ConfidenceBucket.values()) {
            buckets.put(bucket, new ArrayList<>());
        }
        for (ClosedTrade trade : closedTrades) {
            if (trade.getEntryConfidence() == null) {
                continue;
            }
            ConfidenceBucket bucket = ConfidenceBucket.of(
                    trade.getEntryConfidence(),
                    calibrationConfig.getHighConfidenceFloor(),
                    calibrationConfig.getMediumConfidenceFloor());
            buckets.get(bucket).add(trade);
        }

        BucketStatistics high = statistics(ConfidenceBucket.HIGH, buckets.get(ConfidenceBucket.HIGH));
        BucketStatistics medium = statistics(ConfidenceBucket.MEDIUM, buckets.get(ConfidenceBucket.MEDIUM));
        BucketStatistics low = statistics(ConfidenceBucket.LOW, buckets.get(ConfidenceBucket.LOW));

        return CalibrationReport.builder()
                .highConfidence(high)
                .mediumConfidence(medium)
                .lowConfidence(low)
                .wellCalibrated(high.getWinRate() > low.getWinRate())
                .build();
    }

    /**
     * Proposes a threshold for {@code window} from its calibration report.
     *
     * @param currentThreshold the threshold in force now
     */
    public ThresholdSuggestion suggestThreshold(
            CalibrationReport report, BigDecimal currentThreshold, LookbackWindow window) {
        BucketStatistics high = report.getHighConfidence();
        boolean enoughTrades = high.getCount() >= calibrationConfig.getMinSampleSize();
        BigDecimal highWinRate = BigDecimal.valueOf(high.getWinRate());

        BigDecimal suggested;
        String reason;
        BigDecimal confidence;
        if (enoughTrades && highWinRate.compareTo(calibrationConfig.getStrongWinRate()) > 0) {
            suggested = currentThreshold.subtract(calibrationConfig.getStep()).max(calibrationConfig.getFloor());
            reason = "High-confidence trades winning " + percent(high.getWinRate())
                    + " over " + high.getCount() + " trades, threshold can be lowered";
            confidence = CONFIDENCE_LOWERING;
        } else if (enoughTrades && highWinRate.compareTo(calibrationConfig.getWeakWinRate()) < 0) {
            suggested = currentThreshold.add(calibrationConfig.getStep()).min(calibrationConfig.getCeiling());
            reason = "High-confidence trades winning only " + percent(high.getWinRate())
                    + " over " + high.getCount() + " trades, threshold should be raised";
            confidence = CONFIDENCE_RAISING;
        } else {
            suggested = currentThreshold;
            reason = enoughTrades
                    ? "High-confidence win rate " + percent(high.getWinRate()) + " is within the expected range"
                    : "Only " + high.getCount() + " high-confidence trades, not enough to adjust";
            confidence = CONFIDENCE_UNCHANGED;
        }

        boolean shouldChange =
                suggested.subtract(currentThreshold).abs().compareTo(calibrationConfig.getMinimumChange()) > 0;
        return ThresholdSuggestion.builder()
                .window(window)
                .currentThreshold(currentThreshold)
                .suggestedThreshold(suggested)
                .reason(reason)
                .confidence(confidence)
                .shouldChange(shouldChange)
                .build();
    }

    private BucketStatistics statistics(ConfidenceBucket bucket, List<ClosedTrade> trades) {
        if (trades.isEmpty()) {
            return BucketStatistics.empty(bucket);
        }
        long wins = trades.stream().filter(ClosedTrade::isWin).count();
        BigDecimal totalPnl = trades.stream().map(ClosedTrade::getPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
        return BucketStatistics.builder()
                .bucket(bucket)
                .count(trades.size())
                .winRate((double) wins / trades.size())
                .avgPnl(totalPnl.divide(BigDecimal.valueOf(trades.size()), 10, RoundingMode.HALF_UP))
                .build();
    }

    private static String percent(double rate) {
        return String.format("%.1f%%", rate * 100);
    }
}
