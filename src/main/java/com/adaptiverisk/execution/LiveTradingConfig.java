package com.adaptiverisk.execution;

import com.adaptiverisk.config.SimulationConfig;
import com.adaptiverisk.simulator.PositionLedger;
import com.adaptiverisk.simulator.TradeSimulator;
import com.adaptiverisk.timeseries.PriceSeriesCache;
import java.math.BigDecimal;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the live ledger. Live fills arrive with a broker price, so the simulator gets no
 * price cache and no slippage; commission and ledger constraints still apply.
 */
@Configuration
public class LiveTradingConfig {

    @Bean
    public TradeSimulator liveTradeSimulator(SimulationConfig simulationConfig) {
        return new TradeSimulator(
                PriceSeriesCache.empty(),
                new PositionLedger(simulationConfig.getInitialCapital()),
                BigDecimal.ZERO,
                simulationConfig.getCommission());
    }
}
