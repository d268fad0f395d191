package com.adaptiverisk.timeseries;

import com.adaptiverisk.config.SimulationConfig;
import com.adaptiverisk.domain.model.PriceBar;
import com.adaptiverisk.exception.BusinessException;
import com.adaptiverisk.exception.ErrorCode;
import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads bars from {@code <dataDirectory>/<SYMBOL>.csv}.
 *
 * <p>File format, one bar per line, optional header:
 * {@code timestamp,open,high,low,close,volume}. The timestamp is either an ISO date
 * ({@code 2024-03-01}, read as start of day) or an ISO date-time. Malformed lines are
 * skipped with a warning; a missing file means the symbol has no data.
 *
 * <p>The interval is not resampled: files are expected to already hold bars of the
 * requested size.
 */
@Component
public class CsvHistoricalDataProvider implements HistoricalDataProvider {

    private static final Logger log = LoggerFactory.getLogger(CsvHistoricalDataProvider.class);

    private final SimulationConfig simulationConfig;

    public CsvHistoricalDataProvider(SimulationConfig simulationConfig) {
        this.simulationConfig = simulationConfig;
    }

    @Override
    public Map<String, List<PriceBar>> fetchBars(
            List<String> symbols, LocalDateTime from, LocalDateTime to, BarInterval interval) {
        Path directory = Paths.get(simulationConfig.getDataDirectory());
        Map<String, List<PriceBar>> result = new LinkedHashMap<>();

        for (String symbol : symbols) {
            Path file = directory.resolve(symbol + ".csv");
            if (!Files.isRegularFile(file)) {
                log.warn("No bar file for {} at {}", symbol, file);
                continue;
            }
            List<PriceBar> bars = readFile(symbol, file, from, to);
            log.debug("Read {} {} bars for {} from {}", bars.size(), interval.getLabel(), symbol, file);
            result.put(symbol, bars);
        }
        return result;
    }

    private List<PriceBar> readFile(String symbol, Path file, LocalDateTime from, LocalDateTime to) {
        List<PriceBar> bars = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank() || line.startsWith("timestamp")) {
                    continue;
                }
                PriceBar bar = parseLine(symbol, line, lineNumber, file);
                if (bar != null && !bar.getTimestamp().isBefore(from) && !bar.getTimestamp().isAfter(to)) {
                    bars.add(bar);
                }
            }
        } catch (IOException e) {
            throw new BusinessException(
                    ErrorCode.COLLABORATOR_UNAVAILABLE, "Failed to read bar file " + file + ": " + e.getMessage(), e);
        }
        return bars;
    }

    private PriceBar parseLine(String symbol, String line, int lineNumber, Path file) {
        String[] fields = line.split(",");
        if (fields.length < 6) {
            log.warn("Skipping malformed line {} in {}: expected 6 fields", lineNumber, file);
            return null;
        }
        try {
            return PriceBar.builder()
                    .symbol(symbol)
                    .timestamp(parseTimestamp(fields[0].trim()))
                    .open(new BigDecimal(fields[1].trim()))
                    .high(new BigDecimal(fields[2].trim()))
                    .low(new BigDecimal(fields[3].trim()))
                    .close(new BigDecimal(fields[4].trim()))
                    .volume(Long.parseLong(fields[5].trim()))
                    .build();
        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("Skipping malformed line {} in {}: {}", lineNumber, file, e.getMessage());
            return null;
        }
    }

    static LocalDateTime parseTimestamp(String raw) {
        if (raw.length() == 10) {
            return LocalDate.parse(raw).atStartOfDay();
        }
        return LocalDateTime.parse(raw);
    }
}
