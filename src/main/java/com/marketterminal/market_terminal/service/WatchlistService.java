package com.marketterminal.market_terminal.service;

import com.marketterminal.market_terminal.dto.WatchlistSummaryDto;

import java.util.List;

public interface WatchlistService {
    Long createWatchlist(String name, List<String> symbols);
    List<WatchlistSummaryDto> listWatchlists();
    String addStock(Long watchlistId, String symbol);
    String removeStock(Long watchlistId, String symbol);
    List<String> getWatchlistSymbols(Long watchlistId);
}
