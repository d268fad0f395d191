package com.adaptiverisk.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.adaptiverisk.api.controller.BacktestController;
import com.adaptiverisk.api.dto.request.BacktestRequest;
import com.adaptiverisk.config.ApiResponseAdvice;
import com.adaptiverisk.domain.enums.TradeSide;
import com.adaptiverisk.domain.model.ClosedTrade;
import com.adaptiverisk.domain.model.SimulatedTrade;
import com.adaptiverisk.exception.BusinessException;
import com.adaptiverisk.exception.ErrorCode;
import com.adaptiverisk.exception.GlobalExceptionHandler;
import com.adaptiverisk.exception.ResourceNotFoundException;
import com.adaptiverisk.simulator.BacktestReport;
import com.adaptiverisk.simulator.BacktestService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the BacktestController.
 */
@ExtendWith(MockitoExtension.class)
class BacktestControllerTest {

    private MockMvc mockMvc;

    @Mock
    private BacktestService backtestService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new BacktestController(backtestService))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    private static BacktestReport report(String id) {
        return BacktestReport.builder()
                .backtestId(id)
                .strategyName("Custom Strategy")
                .symbols(List.of("AAPL"))
                .initialCapital(new BigDecimal("100000"))
                .finalValue(new BigDecimal("103330"))
                .totalReturnPct(new BigDecimal("3.33"))
                .sharpeRatio(1.25)
                .maxDrawdown(-4.5)
                .winRate(1.0)
                .profitFactor(Double.POSITIVE_INFINITY)
                .totalTrades(1)
                .equityCurve(List.of())
                .tradeHistory(List.of())
                .closedTrades(List.of())
                .build();
    }

    @Test
    @DisplayName("POST /api/backtests runs and returns 201 with snake_case fields")
    void runBacktest() throws Exception {
        when(backtestService.run(any())).thenReturn(report("bt_20240101_120000_abcdef12"));

        mockMvc.perform(post("/api/backtests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbols\": [\"AAPL\"], \"start_date\": \"2023-01-01\","
                                + " \"end_date\": \"2023-12-31\", \"initial_capital\": 100000}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.backtest_id").value("bt_20240101_120000_abcdef12"))
                .andExpect(jsonPath("$.data.total_trades").value(1))
                .andExpect(jsonPath("$.data.max_drawdown").value(-4.5))
                .andExpect(jsonPath("$.data.profit_factor").value("Infinity"));

        verify(backtestService)
                .run(argThat((BacktestRequest r) -> r.getStartDate().equals(LocalDate.of(2023, 1, 1))
                        && r.getTimeframe().equals("1day")
                        && r.getLookbackBars() == 5));
    }

    @Test
    @DisplayName("POST /api/backtests without symbols fails validation")
    void missingSymbols() throws Exception {
        mockMvc.perform(post("/api/backtests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbols\": [], \"start_date\": \"2023-01-01\", \"end_date\": \"2023-12-31\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verify(backtestService, never()).run(any());
    }

    @Test
    @DisplayName("Inverted date range is a bad request")
    void invertedRange() throws Exception {
        when(backtestService.run(any()))
                .thenThrow(new BusinessException(ErrorCode.BAD_REQUEST, "End date is before start date"));

        mockMvc.perform(post("/api/backtests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbols\": [\"AAPL\"], \"start_date\": \"2023-12-31\","
                                + " \"end_date\": \"2023-01-01\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("GET /api/backtests/{id} returns 404 for an unknown id")
    void unknownBacktest() throws Exception {
        when(backtestService.find("bt_missing")).thenThrow(new ResourceNotFoundException("Backtest", "bt_missing"));

        mockMvc.perform(get("/api/backtests/bt_missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Trades serialize their fields without derived side or outcome flags")
    void tradesWithoutDerivedFlags() throws Exception {
        LocalDateTime opened = LocalDateTime.of(2023, 3, 1, 16, 0);
        SimulatedTrade buy = SimulatedTrade.builder()
                .tradeId("trade_1")
                .timestamp(opened)
                .symbol("AAPL")
                .side(TradeSide.BUY)
                .quantity(10)
                .fillPrice(new BigDecimal("100.10"))
                .grossValue(new BigDecimal("1001.00"))
                .commission(BigDecimal.ONE)
                .netValue(new BigDecimal("1002.00"))
                .confidence(new BigDecimal("0.8"))
                .cashAfter(new BigDecimal("98998.00"))
                .build();
        ClosedTrade roundTrip = ClosedTrade.builder()
                .symbol("AAPL")
                .quantity(10)
                .entryPrice(new BigDecimal("100.10"))
                .exitPrice(new BigDecimal("104.90"))
                .pnl(new BigDecimal("48.00"))
                .pnlPct(new BigDecimal("4.80"))
                .entryTime(opened)
                .exitTime(opened.plusDays(5))
                .entryConfidence(new BigDecimal("0.8"))
                .build();
        BacktestReport withTrades = BacktestReport.builder()
                .backtestId("bt_trades")
                .symbols(List.of("AAPL"))
                .initialCapital(new BigDecimal("100000"))
                .finalValue(new BigDecimal("100046"))
                .totalTrades(1)
                .equityCurve(List.of())
                .tradeHistory(List.of(buy))
                .closedTrades(List.of(roundTrip))
                .build();
        when(backtestService.find("bt_trades")).thenReturn(withTrades);

        mockMvc.perform(get("/api/backtests/bt_trades"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.trade_history[0].side").value("BUY"))
                .andExpect(jsonPath("$.data.trade_history[0].fill_price").value(100.10))
                .andExpect(jsonPath("$.data.trade_history[0].buy").doesNotExist())
                .andExpect(jsonPath("$.data.closed_trades[0].pnl").value(48.00))
                .andExpect(jsonPath("$.data.closed_trades[0].win").doesNotExist())
                .andExpect(jsonPath("$.data.closed_trades[0].loss").doesNotExist());
    }

    @Test
    @DisplayName("GET /api/backtests passes the limit through")
    void listRecent() throws Exception {
        when(backtestService.recent(2)).thenReturn(List.of(report("bt_b"), report("bt_a")));

        mockMvc.perform(get("/api/backtests").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].backtest_id").value("bt_b"));
    }

    @Test
    @DisplayName("Non-numeric limit is a bad request naming the parameter")
    void nonNumericLimit() throws Exception {
        mockMvc.perform(get("/api/backtests").param("limit", "ten"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.details.parameter").value("limit"))
                .andExpect(jsonPath("$.error.details.value").value("ten"));
    }
}
