package com.marketterminal.market_terminal.bootstrap;

import com.marketterminal.market_terminal.repository.WatchlistRepository;
import com.marketterminal.market_terminal.repository.WatchlistStockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Inserts the built-in watchlists. Rows are keyed by watchlist id and by (watchlist, symbol),
 * so running it again adds nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WatchlistSeeder {

    public static final long DEFAULT_WATCHLIST_ID = 1L;
    public static final String DEFAULT_WATCHLIST_NAME = "My Portfolio";
    public static final List<String> DEFAULT_SYMBOLS = List.of("RELIANCE", "TCS", "HDFCBANK", "INFY");

    private final WatchlistRepository watchlistRepository;
    private final WatchlistStockRepository watchlistStockRepository;

    /**
     * @return number of rows inserted by this run
     */
    @Transactional
    public int seed() {
        int inserted = 0;
        inserted += watchlistRepository.insertIfAbsent(DEFAULT_WATCHLIST_ID, DEFAULT_WATCHLIST_NAME);
        inserted += watchlistRepository.insertIfAbsent(2L, "Growth Stocks");
        inserted += watchlistRepository.insertIfAbsent(3L, "Value Picks");

        for (String symbol : DEFAULT_SYMBOLS) {
            inserted += watchlistStockRepository.insertIfAbsent(DEFAULT_WATCHLIST_ID, symbol);
        }

        if (inserted > 0) {
            log.info("Seeded {} default watchlist rows", inserted);
        } else {
            log.debug("Default watchlists already present");
        }
        return inserted;
    }
}
