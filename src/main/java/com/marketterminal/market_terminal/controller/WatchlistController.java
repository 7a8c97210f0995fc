package com.marketterminal.market_terminal.controller;

import com.marketterminal.market_terminal.dto.AddStockRequestDto;
import com.marketterminal.market_terminal.dto.CreateWatchlistRequestDto;
import com.marketterminal.market_terminal.dto.QuoteDto;
import com.marketterminal.market_terminal.dto.WatchlistSummaryDto;
import com.marketterminal.market_terminal.service.QuoteService;
import com.marketterminal.market_terminal.service.WatchlistService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/watchlists")
@RequiredArgsConstructor
@Slf4j
public class WatchlistController {

    private final WatchlistService watchlistService;
    private final QuoteService quoteService;

    @GetMapping
    public ResponseEntity<Map<String, List<WatchlistSummaryDto>>> getWatchlists() {
        log.info("Fetching all watchlists");
        return ResponseEntity.ok(Map.of("watchlists", watchlistService.listWatchlists()));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> createWatchlist(@Valid @RequestBody CreateWatchlistRequestDto request) {
        log.info("Creating watchlist '{}' with symbols {}", request.getName(), request.getSymbols());
        Long id = watchlistService.createWatchlist(request.getName(), request.getSymbols());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", id);
        body.put("message", "Watchlist '" + request.getName() + "' created");
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{watchlistId}/add-stock")
    public ResponseEntity<Map<String, String>> addStock(
            @PathVariable Long watchlistId,
            @Valid @RequestBody AddStockRequestDto request) {
        log.info("Adding {} to watchlist {}", request.getSymbol(), watchlistId);
        String symbol = watchlistService.addStock(watchlistId, request.getSymbol());

        return ResponseEntity.ok(Map.of("message", "Stock " + symbol + " added to watchlist"));
    }

    @DeleteMapping("/{watchlistId}/stocks/{symbol}")
    public ResponseEntity<Map<String, String>> removeStock(
            @PathVariable Long watchlistId,
            @PathVariable String symbol) {
        log.info("Removing {} from watchlist {}", symbol, watchlistId);
        String removed = watchlistService.removeStock(watchlistId, symbol);

        return ResponseEntity.ok(Map.of("message", "Stock " + removed + " removed from watchlist"));
    }

    @GetMapping("/{watchlistId}/stocks")
    public ResponseEntity<Map<String, List<QuoteDto>>> getWatchlistStocks(@PathVariable Long watchlistId) {
        log.info("Fetching quotes for watchlist {}", watchlistId);
        return ResponseEntity.ok(Map.of("stocks", quoteService.getWatchlistQuotes(watchlistId)));
    }
}
