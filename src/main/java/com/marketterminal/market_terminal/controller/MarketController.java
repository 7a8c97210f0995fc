package com.marketterminal.market_terminal.controller;

import com.marketterminal.market_terminal.dto.MarketIndexDto;
import com.marketterminal.market_terminal.service.MarketIndexService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/market")
@RequiredArgsConstructor
public class MarketController {

    private final MarketIndexService marketIndexService;

    /**
     * Returns { indices: [ { name, value, change, changePercent } ] }.
     */
    @GetMapping("/indices")
    public Map<String, List<MarketIndexDto>> indices() {
        return Map.of("indices", marketIndexService.getIndices());
    }
}
