package com.marketterminal.market_terminal.service.api;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * NSE cash-segment instrument tokens for the symbols the terminal can price live.
 */
public final class NseSymbolTokens {

    private static final Map<String, String> TOKENS = Map.ofEntries(
            Map.entry("RELIANCE", "2885"),
            Map.entry("TCS", "11536"),
            Map.entry("INFY", "1594"),
            Map.entry("HDFCBANK", "1333"),
            Map.entry("ICICIBANK", "4963"),
            Map.entry("SBIN", "3045"),
            Map.entry("ITC", "1660"),
            Map.entry("WIPRO", "3787"),
            Map.entry("BHARTIARTL", "10604"),
            Map.entry("LT", "11483")
    );

    private NseSymbolTokens() {
    }

    public static Optional<String> tokenFor(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TOKENS.get(symbol.toUpperCase(Locale.ROOT)));
    }

    public static String tradingSymbol(String symbol) {
        return symbol.toUpperCase(Locale.ROOT) + "-EQ";
    }
}
