package com.marketterminal.market_terminal.controller;

import com.marketterminal.market_terminal.dto.HealthDto;
import com.marketterminal.market_terminal.service.api.BrokerClient;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
@RequiredArgsConstructor
public class HealthController {

    static final String CONNECTED = "Connected";
    static final String MOCK_DATA = "Mock Data";

    private final BrokerClient brokerClient;

    @GetMapping("/health")
    public HealthDto health() {
        return HealthDto.builder()
                .status("healthy")
                .timestamp(LocalDateTime.now().toString())
                .brokerStatus(brokerStatus(brokerClient))
                .build();
    }

    static String brokerStatus(BrokerClient brokerClient) {
        return brokerClient.isConnected() ? CONNECTED : MOCK_DATA;
    }
}
