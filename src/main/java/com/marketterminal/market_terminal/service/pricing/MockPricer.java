package com.marketterminal.market_terminal.service.pricing;

import com.marketterminal.market_terminal.dto.QuoteDto;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;

/**
 * Synthesizes a believable quote from nothing but the symbol text.
 *
 * <p>Values are derived from the 32-bit FNV-1a hash of the symbol's UTF-8 bytes, so the same
 * symbol always prices the same, across calls and across restarts:
 * <pre>
 *   base          = 1000 + h % 2000
 *   delta         = h % 200 - 100
 *   ltp           = base + delta
 *   changePercent = delta / base * 100, 2 places, half-up
 *   volume        = 100000 + h % 1000000
 * </pre>
 */
@Component
public class MockPricer {

    public static final String SECTOR = "Technology";

    private static final int FNV_OFFSET_BASIS = 0x811C9DC5;
    private static final int FNV_PRIME = 0x01000193;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    public QuoteDto quote(String symbol) {
        long h = stableHash(symbol);

        long base = 1000 + h % 2000;
        long delta = h % 200 - 100;

        BigDecimal changePercent = BigDecimal.valueOf(delta)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(base), 2, RoundingMode.HALF_UP);

        return QuoteDto.builder()
                .symbol(symbol)
                .ltp(BigDecimal.valueOf(base + delta).setScale(2, RoundingMode.UNNECESSARY))
                .change(BigDecimal.valueOf(delta).setScale(2, RoundingMode.UNNECESSARY))
                .changePercent(changePercent)
                .volume(100_000 + h % 1_000_000)
                .sector(SECTOR)
                .build();
    }

    /**
     * 32-bit FNV-1a over UTF-8, returned as an unsigned value.
     */
    static long stableHash(String symbol) {
        int hash = FNV_OFFSET_BASIS;
        for (byte b : symbol.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return Integer.toUnsignedLong(hash);
    }
}
