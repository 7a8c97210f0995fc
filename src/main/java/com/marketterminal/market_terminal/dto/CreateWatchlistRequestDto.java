package com.marketterminal.market_terminal.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateWatchlistRequestDto {
    @NotBlank(message = "Watchlist name is required")
    @Size(max = 100, message = "Watchlist name must be at most 100 characters")
    private String name;

    private List<@NotBlank(message = "Symbol must not be blank") String> symbols = new ArrayList<>();
}
