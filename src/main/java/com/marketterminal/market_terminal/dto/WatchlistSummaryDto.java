package com.marketterminal.market_terminal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WatchlistSummaryDto {
    private Long id;
    private String name;

    @JsonProperty("stock_count")
    private Long stockCount;
}
