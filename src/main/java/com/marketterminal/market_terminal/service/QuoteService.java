package com.marketterminal.market_terminal.service;

import com.marketterminal.market_terminal.dto.QuoteDto;

import java.util.List;

public interface QuoteService {
    List<QuoteDto> getWatchlistQuotes(Long watchlistId);
    QuoteDto getQuote(String symbol);
}
