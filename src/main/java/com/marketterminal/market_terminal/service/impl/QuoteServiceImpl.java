package com.marketterminal.market_terminal.service.impl;

import com.marketterminal.market_terminal.dto.BrokerQuoteDto;
import com.marketterminal.market_terminal.dto.QuoteDto;
import com.marketterminal.market_terminal.service.QuoteService;
import com.marketterminal.market_terminal.service.WatchlistService;
import com.marketterminal.market_terminal.service.api.BrokerClient;
import com.marketterminal.market_terminal.service.pricing.MockPricer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Prices watchlist members, live from the broker where possible and from {@link MockPricer} otherwise.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuoteServiceImpl implements QuoteService {

    public static final String LIVE_SECTOR = "Live Data";

    private final WatchlistService watchlistService;
    private final BrokerClient brokerClient;
    private final MockPricer mockPricer;

    @Override
    public List<QuoteDto> getWatchlistQuotes(Long watchlistId) {
        List<String> symbols = watchlistService.getWatchlistSymbols(watchlistId);
        log.debug("Pricing {} symbols of watchlist {}", symbols.size(), watchlistId);

        return symbols.stream()
                .map(this::getQuote)
                .collect(Collectors.toList());
    }

    @Override
    public QuoteDto getQuote(String symbol) {
        return lookupLive(symbol)
                .map(this::fromBroker)
                .orElseGet(() -> mockPricer.quote(symbol));
    }

    private Optional<BrokerQuoteDto> lookupLive(String symbol) {
        try {
            return brokerClient.getQuote(symbol);
        } catch (RuntimeException e) {
            log.warn("Broker lookup for {} failed, using mock price: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    // The LTP endpoint reports neither volume nor sector
    private QuoteDto fromBroker(BrokerQuoteDto live) {
        return QuoteDto.builder()
                .symbol(live.getSymbol())
                .ltp(live.getLtp())
                .change(live.getChange())
                .changePercent(live.getChangePercent())
                .volume(0L)
                .sector(LIVE_SECTOR)
                .build();
    }
}
