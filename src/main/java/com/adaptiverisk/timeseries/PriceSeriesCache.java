package com.adaptiverisk.timeseries;

import com.adaptiverisk.domain.enums.PriceField;
import com.adaptiverisk.domain.model.PriceBar;
import com.adaptiverisk.exception.DataUnavailableException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-symbol, time-indexed OHLCV store with as-of lookup.
 *
 * <p>A lookup returns the bar at the exact timestamp when present, otherwise the most
 * recent bar strictly before it. It never looks ahead, so a simulation cannot peek at
 * future prices. The cache is filled once at construction and is read-only afterwards,
 * which makes it safe to share across threads.
 */
public class PriceSeriesCache {

    private static final Logger log = LoggerFactory.getLogger(PriceSeriesCache.class);

    private final Map<String, NavigableMap<LocalDateTime, PriceBar>> series;

    private PriceSeriesCache(Map<String, NavigableMap<LocalDateTime, PriceBar>> series) {
        this.series = series;
    }

    public static PriceSeriesCache empty() {
        return new PriceSeriesCache(Map.of());
    }

    /**
     * Builds a cache from already-fetched bars. A later bar with a duplicate timestamp
     * replaces the earlier one.
     */
    public static PriceSeriesCache of(Map<String, List<PriceBar>> barsBySymbol) {
        Map<String, NavigableMap<LocalDateTime, PriceBar>> series = new HashMap<>();
        barsBySymbol.forEach((symbol, bars) -> {
            NavigableMap<LocalDateTime, PriceBar> bySymbol = new TreeMap<>();
            for (PriceBar bar : bars) {
                bySymbol.put(bar.getTimestamp(), bar);
            }
            if (!bySymbol.isEmpty()) {
                series.put(symbol, Collections.unmodifiableNavigableMap(bySymbol));
            }
        });
        return new PriceSeriesCache(Collections.unmodifiableMap(series));
    }

    /**
     * Fetches the whole symbol/date range from the provider in one batch.
     */
    public static PriceSeriesCache load(
            HistoricalDataProvider provider,
            List<String> symbols,
            LocalDateTime from,
            LocalDateTime to,
            BarInterval interval) {
        Map<String, List<PriceBar>> bars = provider.fetchBars(symbols, from, to, interval);
        PriceSeriesCache cache = of(bars);
        log.info(
                "Loaded {} bars for {}/{} symbols ({} to {}, {})",
                cache.size(),
                cache.symbols().size(),
                symbols.size(),
                from,
                to,
                interval.getLabel());
        return cache;
    }

    /**
     * As-of price lookup.
     *
     * @throws DataUnavailableException if no bar exists at or before {@code timestamp}
     */
    public BigDecimal priceAt(String symbol, LocalDateTime timestamp, PriceField field) {
        return findPrice(symbol, timestamp, field).orElseThrow(() -> new DataUnavailableException(symbol, timestamp));
    }

    public Optional<BigDecimal> findPrice(String symbol, LocalDateTime timestamp, PriceField field) {
        return findBar(symbol, timestamp).map(bar -> bar.get(field));
    }

    /** The bar at {@code timestamp}, or the latest bar before it. */
    public Optional<PriceBar> findBar(String symbol, LocalDateTime timestamp) {
        NavigableMap<LocalDateTime, PriceBar> bars = series.get(symbol);
        if (bars == null) {
            return Optional.empty();
        }
        Map.Entry<LocalDateTime, PriceBar> entry = bars.floorEntry(timestamp);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    public boolean hasBarAt(String symbol, LocalDateTime timestamp) {
        NavigableMap<LocalDateTime, PriceBar> bars = series.get(symbol);
        return bars != null && bars.containsKey(timestamp);
    }

    /**
     * Up to {@code count} most recent bars at or before {@code timestamp}, oldest first.
     */
    public List<PriceBar> barsUpTo(String symbol, LocalDateTime timestamp, int count) {
        NavigableMap<LocalDateTime, PriceBar> bars = series.get(symbol);
        if (bars == null || count <= 0) {
            return List.of();
        }
        List<PriceBar> window = new ArrayList<>(count);
        for (PriceBar bar : bars.headMap(timestamp, true).descendingMap().values()) {
            if (window.size() == count) {
                break;
            }
            window.add(bar);
        }
        Collections.reverse(window);
        return window;
    }

    /** All bar timestamps for the symbol in ascending order. */
    public List<LocalDateTime> timeline(String symbol) {
        NavigableMap<LocalDateTime, PriceBar> bars = series.get(symbol);
        return bars == null ? List.of() : List.copyOf(bars.keySet());
    }

    public List<PriceBar> bars(String symbol) {
        NavigableMap<LocalDateTime, PriceBar> bars = series.get(symbol);
        return bars == null ? List.of() : List.copyOf(bars.values());
    }

    public Set<String> symbols() {
        return series.keySet();
    }

    public int size() {
        return series.values().stream().mapToInt(Map::size).sum();
    }
}
