package com.marketterminal.market_terminal.service.impl;

import com.marketterminal.market_terminal.dto.WatchlistSummaryDto;
import com.marketterminal.market_terminal.exception.DuplicateMembershipException;
import com.marketterminal.market_terminal.exception.WatchlistNotFoundException;
import com.marketterminal.market_terminal.model.entity.Watchlist;
import com.marketterminal.market_terminal.model.entity.WatchlistStock;
import com.marketterminal.market_terminal.repository.WatchlistRepository;
import com.marketterminal.market_terminal.repository.WatchlistStockRepository;
import com.marketterminal.market_terminal.service.WatchlistService;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@Slf4j
public class WatchlistServiceImpl implements WatchlistService {

    static final String DUPLICATE_MESSAGE = "Stock already exists in watchlist";
    static final int MAX_SYMBOL_LENGTH = 20;

    // Unique (watchlist_id, symbol) constraint from schema.sql
    private static final String MEMBERSHIP_CONSTRAINT = "UQ_WATCHLIST_STOCKS_SYMBOL";

    private final WatchlistRepository watchlistRepository;
    private final WatchlistStockRepository watchlistStockRepository;

    public WatchlistServiceImpl(WatchlistRepository watchlistRepository,
                                WatchlistStockRepository watchlistStockRepository) {
        this.watchlistRepository = watchlistRepository;
        this.watchlistStockRepository = watchlistStockRepository;
    }

    /**
     * Creates the watchlist and its initial members in one transaction; a failed member insert
     * leaves nothing behind.
     */
    @Override
    @Transactional
    public Long createWatchlist(String name, List<String> symbols) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Watchlist name is required");
        }

        // Normalize everything up front so a bad symbol fails before the first insert
        Set<String> normalized = new LinkedHashSet<>();
        if (symbols != null) {
            for (String symbol : symbols) {
                normalized.add(normalize(symbol));
            }
        }

        Watchlist watchlist = watchlistRepository.save(Watchlist.builder()
                .name(name.trim())
                .build());

        List<WatchlistStock> members = normalized.stream()
                .map(symbol -> WatchlistStock.builder()
                        .watchlist(watchlist)
                        .symbol(symbol)
                        .build())
                .collect(Collectors.toList());
        watchlistStockRepository.saveAllAndFlush(members);

        log.info("Created watchlist {} '{}' with {} symbols", watchlist.getId(), watchlist.getName(), members.size());
        return watchlist.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public List<WatchlistSummaryDto> listWatchlists() {
        return watchlistRepository.findAllSummaries();
    }

    @Override
    @Transactional
    public String addStock(Long watchlistId, String symbol) {
        Watchlist watchlist = findWatchlist(watchlistId);
        String normalized = normalize(symbol);

        if (watchlistStockRepository.existsByWatchlistIdAndSymbol(watchlistId, normalized)) {
            throw new DuplicateMembershipException(DUPLICATE_MESSAGE);
        }

        try {
            watchlistStockRepository.saveAndFlush(WatchlistStock.builder()
                    .watchlist(watchlist)
                    .symbol(normalized)
                    .build());
        } catch (DataIntegrityViolationException e) {
            if (!violatesMembershipConstraint(e)) {
                throw e;
            }
            // A concurrent add won the race to the unique constraint
            throw new DuplicateMembershipException(DUPLICATE_MESSAGE, e);
        }

        log.info("Added {} to watchlist {}", normalized, watchlistId);
        return normalized;
    }

    @Override
    @Transactional
    public String removeStock(Long watchlistId, String symbol) {
        findWatchlist(watchlistId);
        String normalized = normalize(symbol);

        int removed = watchlistStockRepository.deleteByWatchlistIdAndSymbol(watchlistId, normalized);
        if (removed == 0) {
            log.debug("{} was not in watchlist {}, nothing to remove", normalized, watchlistId);
        } else {
            log.info("Removed {} from watchlist {}", normalized, watchlistId);
        }
        return normalized;
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> getWatchlistSymbols(Long watchlistId) {
        findWatchlist(watchlistId);
        return watchlistStockRepository.findByWatchlistIdOrderByAddedAtAscIdAsc(watchlistId).stream()
                .map(WatchlistStock::getSymbol)
                .collect(Collectors.toList());
    }

    private Watchlist findWatchlist(Long watchlistId) {
        return watchlistRepository.findById(watchlistId)
                .orElseThrow(() -> new WatchlistNotFoundException(watchlistId));
    }

    static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol must not be blank");
        }
        // Uppercasing can lengthen a symbol ("ß" becomes "SS"), so the limit applies afterwards
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        if (normalized.length() > MAX_SYMBOL_LENGTH) {
            throw new IllegalArgumentException("Symbol must be at most " + MAX_SYMBOL_LENGTH + " characters");
        }
        return normalized;
    }

    private static boolean violatesMembershipConstraint(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String constraintName = ((ConstraintViolationException) cause).getConstraintName();
                if (mentionsMembershipConstraint(constraintName)) {
                    return true;
                }
            }
            if (mentionsMembershipConstraint(cause.getMessage())) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    private static boolean mentionsMembershipConstraint(String text) {
        return text != null && text.toUpperCase(Locale.ROOT).contains(MEMBERSHIP_CONSTRAINT);
    }
}
