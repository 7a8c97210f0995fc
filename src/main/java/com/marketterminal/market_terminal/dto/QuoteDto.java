package com.marketterminal.market_terminal.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Price snapshot for one watchlist symbol, either live from the broker or synthesized.
 * Never persisted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QuoteDto {
    private String symbol;
    private BigDecimal ltp;
    private BigDecimal change;
    private BigDecimal changePercent;
    private Long volume;
    private String sector;
}
