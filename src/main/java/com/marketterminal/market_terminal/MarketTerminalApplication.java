package com.marketterminal.market_terminal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketTerminalApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketTerminalApplication.class, args);
    }
}
