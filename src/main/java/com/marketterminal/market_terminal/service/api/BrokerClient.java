package com.marketterminal.market_terminal.service.api;

import com.marketterminal.market_terminal.dto.BrokerQuoteDto;

import java.util.Optional;

/**
 * Session-based access to a brokerage's live quotes.
 */
public interface BrokerClient {

    /**
     * Establishes a fresh session, replacing any existing one.
     * @return true if the broker accepted the login
     */
    boolean login();

    /**
     * Looks up the last traded price of one symbol.
     * Empty when there is no session, the symbol is unknown to the broker, or the call fails.
     */
    Optional<BrokerQuoteDto> getQuote(String symbol);

    boolean isConnected();
}
