package com.marketterminal.market_terminal;

import com.jayway.jsonpath.JsonPath;
import com.marketterminal.market_terminal.bootstrap.WatchlistSeeder;
import com.marketterminal.market_terminal.service.WatchlistService;
import com.marketterminal.market_terminal.service.api.BrokerClient;
import com.marketterminal.market_terminal.service.pricing.MockPricer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end flows over the real stack: H2, JPA, MVC and the SmartAPI client without credentials.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class MarketTerminalApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private WatchlistSeeder watchlistSeeder;

    @Autowired
    private WatchlistService watchlistService;

    @Autowired
    private BrokerClient brokerClient;

    @Test
    void createdWatchlistServesNormalizedQuotesInOrder() throws Exception {
        String response = mockMvc.perform(post("/api/watchlists")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Tech\",\"symbols\":[\"tcs\",\"infy\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Watchlist 'Tech' created"))
                .andReturn().getResponse().getContentAsString();
        long id = ((Number) JsonPath.read(response, "$.id")).longValue();

        mockMvc.perform(get("/api/watchlists/" + id + "/stocks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stocks.length()").value(2))
                .andExpect(jsonPath("$.stocks[0].symbol").value("TCS"))
                .andExpect(jsonPath("$.stocks[1].symbol").value("INFY"))
                .andExpect(jsonPath("$.stocks[0].ltp").value(1878.0))
                .andExpect(jsonPath("$.stocks[1].ltp").value(3010.0));
    }

    @Test
    void failedBrokerLoginStillServesMockQuotes() throws Exception {
        watchlistSeeder.seed();
        assertThat(brokerClient.login()).isFalse();

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.broker_status").value("Mock Data"));

        mockMvc.perform(get("/api/watchlists/1/stocks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stocks.length()").value(WatchlistSeeder.DEFAULT_SYMBOLS.size()))
                .andExpect(jsonPath("$.stocks[0].symbol").value("RELIANCE"))
                .andExpect(jsonPath("$.stocks[*].sector").value(
                        org.hamcrest.Matchers.everyItem(org.hamcrest.Matchers.is(MockPricer.SECTOR))));
    }

    @Test
    void duplicateAddOverHttpIsRejectedOnce() throws Exception {
        watchlistSeeder.seed();

        mockMvc.perform(post("/api/watchlists/1/add-stock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"sbin\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/watchlists/1/add-stock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"SBIN\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Stock already exists in watchlist"));

        mockMvc.perform(get("/api/watchlists"))
                .andExpect(jsonPath("$.watchlists[0].id").value(1))
                .andExpect(jsonPath("$.watchlists[0].stock_count").value(WatchlistSeeder.DEFAULT_SYMBOLS.size() + 1));
    }

    @Test
    void removeOverHttpIsIdempotent() throws Exception {
        watchlistSeeder.seed();

        mockMvc.perform(delete("/api/watchlists/1/stocks/tcs")).andExpect(status().isOk());
        mockMvc.perform(delete("/api/watchlists/1/stocks/tcs")).andExpect(status().isOk());

        mockMvc.perform(get("/api/watchlists"))
                .andExpect(jsonPath("$.watchlists[0].stock_count").value(WatchlistSeeder.DEFAULT_SYMBOLS.size() - 1));
    }

    @Test
    void unknownWatchlistStocksIsNotFound() throws Exception {
        mockMvc.perform(get("/api/watchlists/987654/stocks"))
                .andExpect(status().isNotFound());
    }

    @Test
    void symbolThatOutgrowsTheColumnWhenUppercasedIsBadRequest() throws Exception {
        watchlistSeeder.seed();

        mockMvc.perform(post("/api/watchlists/1/add-stock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"" + "\u00df".repeat(20) + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Symbol must be at most 20 characters"));

        mockMvc.perform(get("/api/watchlists"))
                .andExpect(jsonPath("$.watchlists[0].stock_count").value(WatchlistSeeder.DEFAULT_SYMBOLS.size()));
    }

    @Test
    void paddedSymbolsAreMeasuredAfterTrimming() throws Exception {
        String padded = "          wipro          ";
        assertThat(padded.length()).isGreaterThan(20);

        String response = mockMvc.perform(post("/api/watchlists")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Padded\",\"symbols\":[\"" + padded + "\"]}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        long id = ((Number) JsonPath.read(response, "$.id")).longValue();

        mockMvc.perform(post("/api/watchlists/" + id + "/add-stock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"" + padded.replace("wipro", "itc") + "\"}"))
                .andExpect(status().isOk());

        assertThat(watchlistService.getWatchlistSymbols(id)).containsExactly("WIPRO", "ITC");
    }
}
