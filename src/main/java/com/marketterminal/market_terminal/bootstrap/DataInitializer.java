package com.marketterminal.market_terminal.bootstrap;

import com.marketterminal.market_terminal.service.api.BrokerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
@Profile("!test") // Don't run in test profile
public class DataInitializer implements CommandLineRunner {

    private final WatchlistSeeder watchlistSeeder;
    private final BrokerClient brokerClient;

    @Override
    public void run(String... args) {
        watchlistSeeder.seed();

        // A failed login is not fatal; quotes fall back to mock data
        if (brokerClient.login()) {
            log.info("Broker session established, serving live quotes");
        } else {
            log.warn("Broker login unavailable, serving mock quotes");
        }
    }
}
