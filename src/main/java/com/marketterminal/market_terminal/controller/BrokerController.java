package com.marketterminal.market_terminal.controller;

import com.marketterminal.market_terminal.service.api.BrokerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/broker")
@RequiredArgsConstructor
@Slf4j
public class BrokerController {

    private final BrokerClient brokerClient;

    /**
     * Re-runs the broker login, replacing the current session. This is the only way to recover
     * live quotes after a session expires.
     */
    @PostMapping("/login")
    public ResponseEntity<Map<String, String>> login() {
        log.info("Manual broker re-login requested");
        brokerClient.login();
        return ResponseEntity.ok(Map.of("broker_status", HealthController.brokerStatus(brokerClient)));
    }
}
