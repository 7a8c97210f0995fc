package com.marketterminal.market_terminal.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddStockRequestDto {
    @NotBlank(message = "Symbol is required")
    private String symbol;
}
