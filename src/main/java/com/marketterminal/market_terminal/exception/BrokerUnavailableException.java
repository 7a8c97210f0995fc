package com.marketterminal.market_terminal.exception;

/**
 * Raised inside the broker client for any failed SmartAPI interaction.
 * Callers outside the client only ever see an empty result.
 */
public class BrokerUnavailableException extends RuntimeException {
    public BrokerUnavailableException(String message) {
        super(message);
    }

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
