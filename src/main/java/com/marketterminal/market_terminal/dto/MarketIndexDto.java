package com.marketterminal.market_terminal.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MarketIndexDto {
    private String name;
    private BigDecimal value;
    private BigDecimal change;
    private BigDecimal changePercent;
}
