package com.adaptiverisk.domain.model;

import com.adaptiverisk.domain.enums.PriceField;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One OHLCV bar for a symbol. Immutable once ingested into the price cache.
 */
@Value
@Builder
public class PriceBar {

    String symbol;
    LocalDateTime timestamp;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    long volume;

    public BigDecimal get(PriceField field) {
        switch (field) {
            case OPEN:
                return open;
            case HIGH:
                return high;
            case LOW:
                return low;
            default:
                return close;
        }
    }
}
