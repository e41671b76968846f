package com.crypto.rebalance.market;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One OHLCV row as returned by the price-history collaborator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceBar {
    private String symbol;
    private LocalDateTime openTime;
    private BigDecimal openPrice;
    private BigDecimal highPrice;
    private BigDecimal lowPrice;
    private BigDecimal closePrice;
    private BigDecimal volume;
    private LocalDateTime closeTime;
}
