package com.adaptiverisk.calibration;

import com.adaptiverisk.domain.enums.LookbackWindow;
import com.adaptiverisk.domain.enums.RiskParameterName;
import com.adaptiverisk.domain.model.ClosedTrade;
import com.adaptiverisk.domain.model.ThresholdSuggestion;
import com.adaptiverisk.risk.RiskParameterStore;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Closes the feedback loop from realized outcomes to the auto-trade threshold.
 *
 * <p>Each lookback window is calibrated on its own trade subset and yields its own
 * suggestion; nothing is averaged across windows. Applying a suggestion goes through
 * {@link RiskParameterStore#adjust}, and the suggestion is recomputed against the value
 * current at write time so concurrent passes step from each other's result.
 */
@Service
public class ThresholdCalibrationService {

    private static final Logger log = LoggerFactory.getLogger(ThresholdCalibrationService.class);

    private final CalibrationAnalyzer calibrationAnalyzer;
    private final RiskParameterStore riskParameterStore;

    public ThresholdCalibrationService(CalibrationAnalyzer calibrationAnalyzer, RiskParameterStore riskParameterStore) {
        this.calibrationAnalyzer = calibrationAnalyzer;
        this.riskParameterStore = riskParameterStore;
    }

    /**
     * One suggestion per lookback window, SHORT to LONG.
     */
    public Map<LookbackWindow, ThresholdSuggestion> review(List<ClosedTrade> closedTrades, LocalDateTime asOf) {
        BigDecimal current = riskParameterStore.get(RiskParameterName.AUTO_TRADE_CONFIDENCE_THRESHOLD);
        Map<LookbackWindow, ThresholdSuggestion> suggestions = new EnumMap<>(LookbackWindow.class);
        for (LookbackWindow window : LookbackWindow.values()) {
            suggestions.put(window, suggest(window, closedTrades, asOf, current));
        }
        return suggestions;
    }

    /**
     * Applies the suggestion for {@code window} when it says the threshold should move.
     *
     * @return the suggestion as evaluated against the threshold in force before the write
     */
    public ThresholdSuggestion apply(LookbackWindow window, List<ClosedTrade> closedTrades, LocalDateTime asOf) {
        CalibrationReport report = calibrationAnalyzer.calibration(inWindow(window, closedTrades, asOf));

        BigDecimal current = riskParameterStore.get(RiskParameterName.AUTO_TRADE_CONFIDENCE_THRESHOLD);
        ThresholdSuggestion preview = calibrationAnalyzer.suggestThreshold(report, current, window);
        if (!preview.isShouldChange()) {
            log.info("Calibration [{}]: threshold stays at {} ({})", window.getLabel(), current, preview.getReason());
            return preview;
        }

        AtomicReference<ThresholdSuggestion> applied = new AtomicReference<>(preview);
        riskParameterStore.adjust(
                RiskParameterName.AUTO_TRADE_CONFIDENCE_THRESHOLD,
                latest -> {
                    ThresholdSuggestion suggestion = calibrationAnalyzer.suggestThreshold(report, latest, window);
                    applied.set(suggestion);
                    return suggestion.isShouldChange() ? suggestion.getSuggestedThreshold() : latest;
                },
                "Calibration " + window.getLabel() + ": " + preview.getReason(),
                RiskParameterStore.CHANGED_BY_CALIBRATION);

        log.info(
                "Calibration [{}]: threshold {} -> {}",
                window.getLabel(),
                applied.get().getCurrentThreshold(),
                applied.get().getSuggestedThreshold());
        return applied.get();
    }

    private ThresholdSuggestion suggest(
            LookbackWindow window, List<ClosedTrade> closedTrades, LocalDateTime asOf, BigDecimal current) {
        CalibrationReport report = calibrationAnalyzer.calibration(inWindow(window, closedTrades, asOf));
        return calibrationAnalyzer.suggestThreshold(report, current, window);
    }

    private static List<ClosedTrade> inWindow(LookbackWindow window, List<ClosedTrade> closedTrades, LocalDateTime asOf) {
        return closedTrades.stream()
                .filter(t -> window.includes(t.getExitTime(), asOf))
                .toList();
    }
}
