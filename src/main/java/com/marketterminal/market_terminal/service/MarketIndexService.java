package com.marketterminal.market_terminal.service;

import com.marketterminal.market_terminal.dto.MarketIndexDto;

import java.util.List;

public interface MarketIndexService {
    List<MarketIndexDto> getIndices();
}
