package com.adaptiverisk.unit.calibration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.adaptiverisk.calibration.CalibrationAnalyzer;
import com.adaptiverisk.calibration.ThresholdCalibrationService;
import com.adaptiverisk.config.CalibrationConfig;
import com.adaptiverisk.domain.enums.LookbackWindow;
import com.adaptiverisk.domain.enums.RiskParameterName;
import com.adaptiverisk.domain.model.ClosedTrade;
import com.adaptiverisk.domain.model.RiskParameter;
import com.adaptiverisk.domain.model.ThresholdSuggestion;
import com.adaptiverisk.observability.EngineMetricsService;
import com.adaptiverisk.risk.RiskParameterPersistenceService;
import com.adaptiverisk.risk.RiskParameterStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for ThresholdCalibrationService with a real parameter store over mocked
 * persistence.
 */
@ExtendWith(MockitoExtension.class)
class ThresholdCalibrationServiceTest {

    private static final LocalDateTime AS_OF = LocalDateTime.of(2024, 4, 30, 16, 0);

    @Mock
    private RiskParameterPersistenceService persistenceService;

    private RiskParameterStore riskParameterStore;
    private ThresholdCalibrationService service;

    @BeforeEach
    void setUp() {
        riskParameterStore =
                new RiskParameterStore(persistenceService, new EngineMetricsService(new SimpleMeterRegistry()));
        service = new ThresholdCalibrationService(new CalibrationAnalyzer(new CalibrationConfig()), riskParameterStore);
    }

    @Test
    @DisplayName("Review suggests per window from each window's own trades")
    void reviewPerWindow() {
        List<ClosedTrade> trades = new ArrayList<>();
        // strong high-confidence run 20 days ago: visible to MEDIUM and LONG only
        trades.addAll(batch(20, 9, 1));

        Map<LookbackWindow, ThresholdSuggestion> suggestions = service.review(trades, AS_OF);

        assertThat(suggestions).containsOnlyKeys(LookbackWindow.values());
        assertThat(suggestions.get(LookbackWindow.SHORT).isShouldChange()).isFalse();
        assertThat(suggestions.get(LookbackWindow.MEDIUM).isShouldChange()).isTrue();
        assertThat(suggestions.get(LookbackWindow.MEDIUM).getSuggestedThreshold()).isEqualByComparingTo("0.90");
        assertThat(suggestions.get(LookbackWindow.LONG).isShouldChange()).isTrue();
    }

    @Test
    @DisplayName("Review does not touch the stored threshold")
    void reviewIsReadOnly() {
        service.review(batch(1, 10, 0), AS_OF);

        assertThat(riskParameterStore.get(RiskParameterName.AUTO_TRADE_CONFIDENCE_THRESHOLD))
                .isEqualByComparingTo("0.95");
    }

    @Test
    @DisplayName("Applying a change writes through the store with the calibration source")
    void applyWrites() {
        ThresholdSuggestion applied = service.apply(LookbackWindow.SHORT, batch(1, 9, 1), AS_OF);

        assertThat(applied.getCurrentThreshold()).isEqualByComparingTo("0.95");
        assertThat(applied.getSuggestedThreshold()).isEqualByComparingTo("0.90");
        assertThat(riskParameterStore.get(RiskParameterName.AUTO_TRADE_CONFIDENCE_THRESHOLD))
                .isEqualByComparingTo("0.90");
        verify(persistenceService)
                .save(
                        argThat((RiskParameter p) -> p.getReason().startsWith("Calibration short:")),
                        eq(new BigDecimal("0.95")),
                        eq(RiskParameterStore.CHANGED_BY_CALIBRATION));
    }

    @Test
    @DisplayName("Repeated applies keep stepping down until the floor")
    void applyStepsToFloor() {
        List<ClosedTrade> trades = batch(1, 9, 1);
        for (int i = 0; i < 6; i++) {
            service.apply(LookbackWindow.SHORT, trades, AS_OF);
        }

        assertThat(riskParameterStore.get(RiskParameterName.AUTO_TRADE_CONFIDENCE_THRESHOLD))
                .isEqualByComparingTo("0.75");
    }

    @Test
    @DisplayName("No change needed means no write")
    void applyNoop() {
        ThresholdSuggestion result = service.apply(LookbackWindow.SHORT, List.of(), AS_OF);

        assertThat(result.isShouldChange()).isFalse();
        verify(persistenceService, never()).save(any(), any(), eq(RiskParameterStore.CHANGED_BY_CALIBRATION));
    }

    private static List<ClosedTrade> batch(int daysAgo, int wins, int losses) {
        List<ClosedTrade> trades = new ArrayList<>();
        for (int i = 0; i < wins + losses; i++) {
            String pnl = i < wins ? "30" : "-30";
            trades.add(ClosedTrade.builder()
                    .symbol("MSFT")
                    .quantity(1)
                    .entryPrice(new BigDecimal("300"))
                    .exitPrice(new BigDecimal("300").add(new BigDecimal(pnl)))
                    .pnl(new BigDecimal(pnl))
                    .pnlPct(BigDecimal.ZERO)
                    .entryTime(AS_OF.minusDays(daysAgo + 1L))
                    .exitTime(AS_OF.minusDays(daysAgo))
                    .entryConfidence(new BigDecimal("0.9"))
                    .strategyName("Test")
                    .build());
        }
        return trades;
    }
}
