package com.marketterminal.market_terminal.exception;

public class WatchlistNotFoundException extends RuntimeException {
    public WatchlistNotFoundException(Long watchlistId) {
        super("Watchlist not found: " + watchlistId);
    }
}
