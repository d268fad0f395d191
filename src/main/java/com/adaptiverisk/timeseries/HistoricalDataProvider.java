package com.adaptiverisk.timeseries;

import com.adaptiverisk.domain.model.PriceBar;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Source of historical OHLCV bars. Called once per backtest to fill a
 * {@link PriceSeriesCache}; nothing refetches during the simulation itself.
 */
public interface HistoricalDataProvider {

    /**
     * Fetches bars for the given symbols within [from, to].
     *
     * @return bars per symbol in any order; symbols with no data may be absent
     */
    Map<String, List<PriceBar>> fetchBars(
            List<String> symbols, LocalDateTime from, LocalDateTime to, BarInterval interval);
}
