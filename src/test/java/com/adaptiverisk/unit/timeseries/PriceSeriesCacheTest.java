package com.adaptiverisk.unit.timeseries;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.adaptiverisk.domain.enums.PriceField;
import com.adaptiverisk.domain.model.PriceBar;
import com.adaptiverisk.exception.DataUnavailableException;
import com.adaptiverisk.timeseries.BarInterval;
import com.adaptiverisk.timeseries.HistoricalDataProvider;
import com.adaptiverisk.timeseries.PriceSeriesCache;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PriceSeriesCache covering as-of lookup (exact, between bars, before the
 * first bar), trailing windows and batch loading.
 */
class PriceSeriesCacheTest {

    private static final LocalDateTime DAY_1 = LocalDateTime.of(2024, 3, 1, 0, 0);
    private static final LocalDateTime DAY_2 = DAY_1.plusDays(1);
    private static final LocalDateTime DAY_5 = DAY_1.plusDays(4);

    private PriceSeriesCache cache;

    @BeforeEach
    void setUp() {
        cache = PriceSeriesCache.of(Map.of(
                "AAPL",
                List.of(bar("AAPL", DAY_1, "100"), bar("AAPL", DAY_2, "102"), bar("AAPL", DAY_5, "108"))));
    }

    @Nested
    @DisplayName("As-of lookup")
    class AsOfLookup {

        @Test
        @DisplayName("Exact timestamp returns that bar's price")
        void exactTimestamp() {
            assertThat(cache.priceAt("AAPL", DAY_2, PriceField.CLOSE)).isEqualByComparingTo("102");
        }

        @Test
        @DisplayName("Timestamp between bars returns the latest earlier bar, never a later one")
        void betweenBars_usesPreviousBar() {
            LocalDateTime day4 = DAY_1.plusDays(3);

            assertThat(cache.priceAt("AAPL", day4, PriceField.CLOSE)).isEqualByComparingTo("102");
        }

        @Test
        @DisplayName("Other fields come from the same bar")
        void otherFields() {
            assertThat(cache.priceAt("AAPL", DAY_1, PriceField.HIGH)).isEqualByComparingTo("101");
            assertThat(cache.priceAt("AAPL", DAY_1, PriceField.LOW)).isEqualByComparingTo("99");
            assertThat(cache.priceAt("AAPL", DAY_1, PriceField.OPEN)).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("Before the first bar throws DataUnavailableException")
        void beforeFirstBar_throws() {
            assertThatThrownBy(() -> cache.priceAt("AAPL", DAY_1.minusMinutes(1), PriceField.CLOSE))
                    .isInstanceOf(DataUnavailableException.class)
                    .hasMessageContaining("AAPL");
        }

        @Test
        @DisplayName("Unknown symbol yields an empty Optional from findPrice")
        void unknownSymbol_empty() {
            assertThat(cache.findPrice("MSFT", DAY_5, PriceField.CLOSE)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Windows and timeline")
    class Windows {

        @Test
        @DisplayName("barsUpTo returns trailing bars oldest first, including the current one")
        void barsUpTo_trailingWindow() {
            List<PriceBar> window = cache.barsUpTo("AAPL", DAY_5, 2);

            assertThat(window).extracting(PriceBar::getTimestamp).containsExactly(DAY_2, DAY_5);
        }

        @Test
        @DisplayName("barsUpTo never includes bars after the timestamp")
        void barsUpTo_noLookahead() {
            List<PriceBar> window = cache.barsUpTo("AAPL", DAY_2, 10);

            assertThat(window).extracting(PriceBar::getTimestamp).containsExactly(DAY_1, DAY_2);
        }

        @Test
        @DisplayName("timeline lists timestamps in ascending order")
        void timeline_sorted() {
            assertThat(cache.timeline("AAPL")).containsExactly(DAY_1, DAY_2, DAY_5);
            assertThat(cache.hasBarAt("AAPL", DAY_2)).isTrue();
            assertThat(cache.hasBarAt("AAPL", DAY_2.plusHours(1))).isFalse();
        }
    }

    @Test
    @DisplayName("load fetches the whole range from the provider exactly once")
    void load_singleBatchFetch() {
        HistoricalDataProvider provider = mock(HistoricalDataProvider.class);
        when(provider.fetchBars(anyList(), any(), any(), eq(BarInterval.ONE_DAY)))
                .thenReturn(Map.of("MSFT", List.of(bar("MSFT", DAY_1, "300"))));

        PriceSeriesCache loaded =
                PriceSeriesCache.load(provider, List.of("MSFT"), DAY_1, DAY_5, BarInterval.ONE_DAY);
        loaded.priceAt("MSFT", DAY_5, PriceField.CLOSE);
        loaded.priceAt("MSFT", DAY_2, PriceField.CLOSE);

        verify(provider, times(1)).fetchBars(List.of("MSFT"), DAY_1, DAY_5, BarInterval.ONE_DAY);
        assertThat(loaded.symbols()).containsExactly("MSFT");
        assertThat(loaded.size()).isEqualTo(1);
    }

    static PriceBar bar(String symbol, LocalDateTime timestamp, String close) {
        BigDecimal price = new BigDecimal(close);
        return PriceBar.builder()
                .symbol(symbol)
                .timestamp(timestamp)
                .open(price)
                .high(price.add(BigDecimal.ONE))
                .low(price.subtract(BigDecimal.ONE))
                .close(price)
                .volume(1_000)
                .build();
    }
}
