package com.marketterminal.market_terminal.service.impl;

import com.marketterminal.market_terminal.dto.MarketIndexDto;
import com.marketterminal.market_terminal.service.MarketIndexService;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Fixed index snapshot shown on the terminal header.
 */
@Service
public class MarketIndexServiceImpl implements MarketIndexService {

    private static final List<MarketIndexDto> INDICES = List.of(
            index("NIFTY 50", "19674.25", "156.80", "0.80"),
            index("SENSEX", "66023.69", "525.42", "0.80"),
            index("BANK NIFTY", "44258.75", "-125.30", "-0.28")
    );

    @Override
    public List<MarketIndexDto> getIndices() {
        return INDICES;
    }

    private static MarketIndexDto index(String name, String value, String change, String changePercent) {
        return MarketIndexDto.builder()
                .name(name)
                .value(new BigDecimal(value))
                .change(new BigDecimal(change))
                .changePercent(new BigDecimal(changePercent))
                .build();
    }
}
