package com.marketterminal.market_terminal.service.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketterminal.market_terminal.config.AngelOneConfig;
import com.marketterminal.market_terminal.dto.BrokerQuoteDto;
import com.marketterminal.market_terminal.exception.BrokerUnavailableException;
import com.marketterminal.market_terminal.util.RateLimiter;
import dev.samstevens.totp.code.CodeGenerator;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.code.HashingAlgorithm;
import dev.samstevens.totp.exceptions.CodeGenerationException;
import dev.samstevens.totp.time.SystemTimeProvider;
import dev.samstevens.totp.time.TimeProvider;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Angel One SmartAPI client.
 *
 * <p>Login flow: client code + password + TOTP gives a JWT, held as the single session of this
 * process. The session is never refreshed on its own; once it expires every lookup comes back
 * empty until {@link #login()} is called again.
 */
@Service
@Slf4j
public class AngelOneClient implements BrokerClient {

    private static final String LOGIN_PATH = "/rest/auth/angelbroking/user/v1/loginByPassword";
    private static final String LTP_PATH = "/rest/secure/angelbroking/order/v1/getLtpData";
    private static final String EXCHANGE = "NSE";
    private static final int TOTP_PERIOD_SECONDS = 30;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final RestTemplate restTemplate;
    private final AngelOneConfig config;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final CodeGenerator codeGenerator = new DefaultCodeGenerator(HashingAlgorithm.SHA1, 6);
    private final TimeProvider timeProvider = new SystemTimeProvider();

    private final AtomicReference<BrokerSession> session = new AtomicReference<>();
    private final ReentrantLock loginLock = new ReentrantLock();

    public AngelOneClient(
            RestTemplate restTemplate,
            AngelOneConfig config,
            ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.config = config;
        this.objectMapper = objectMapper;
        this.rateLimiter = new RateLimiter(config.getMaxRequestsPerMinute());
        log.info("AngelOneClient initialized with max {} requests per minute", config.getMaxRequestsPerMinute());
    }

    @Override
    public boolean login() {
        if (!config.hasCredentials()) {
            session.set(null);
            log.warn("SmartAPI credentials are not configured, serving mock data");
            return false;
        }

        loginLock.lock();
        try {
            BrokerSession previous = session.get();
            if (previous != null) {
                log.info("Replacing SmartAPI session established at {} ({} old)", previous.getEstablishedAt(),
                        Duration.between(previous.getEstablishedAt(), Instant.now()));
            }
            log.info("Logging in to SmartAPI as client {}", config.getClientCode());
            session.set(authenticate());
            log.info("SmartAPI login successful for client {}", config.getClientCode());
            return true;
        } catch (Exception e) {
            session.set(null);
            log.warn("SmartAPI login failed, serving mock data: {}", e.getMessage());
            return false;
        } finally {
            loginLock.unlock();
        }
    }

    @Override
    public Optional<BrokerQuoteDto> getQuote(String symbol) {
        BrokerSession current = session.get();
        if (current == null) {
            log.debug("No SmartAPI session, skipping live lookup for {}", symbol);
            return Optional.empty();
        }

        Optional<String> token = NseSymbolTokens.tokenFor(symbol);
        if (token.isEmpty()) {
            log.debug("No NSE token mapped for {}", symbol);
            return Optional.empty();
        }

        try {
            Map<String, String> body = Map.of(
                    "exchange", EXCHANGE,
                    "tradingsymbol", NseSymbolTokens.tradingSymbol(symbol),
                    "symboltoken", token.get());
            JsonNode data = post(LTP_PATH, body, current.getJwtToken());
            return Optional.of(parseLtp(symbol, data));
        } catch (Exception e) {
            log.warn("SmartAPI LTP lookup failed for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean isConnected() {
        return session.get() != null;
    }

    private BrokerSession authenticate() {
        Map<String, String> body = Map.of(
                "clientcode", config.getClientCode(),
                "password", config.getPassword(),
                "totp", generateTotp());

        JsonNode data = post(LOGIN_PATH, body, null);
        String jwtToken = data.path("jwtToken").asText("");
        if (jwtToken.isBlank()) {
            throw new BrokerUnavailableException("SmartAPI returned an empty jwtToken");
        }
        return new BrokerSession(jwtToken, Instant.now());
    }

    private String generateTotp() {
        long counter = Math.floorDiv(timeProvider.getTime(), TOTP_PERIOD_SECONDS);
        try {
            return codeGenerator.generate(config.getTotpSecret(), counter);
        } catch (CodeGenerationException e) {
            throw new BrokerUnavailableException("Failed to generate TOTP", e);
        }
    }

    /**
     * Posts to SmartAPI and returns the {@code data} node of a successful envelope.
     */
    private JsonNode post(String path, Map<String, String> body, String jwtToken) {
        if (!rateLimiter.acquire()) {
            throw new BrokerUnavailableException("Rate limiter interrupted");
        }

        HttpEntity<Map<String, String>> entity = new HttpEntity<>(body, createHeaders(jwtToken));
        ResponseEntity<String> response = restTemplate.exchange(
                config.getBaseUrl() + path,
                HttpMethod.POST,
                entity,
                String.class);

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new BrokerUnavailableException("SmartAPI call failed: " + response.getStatusCode());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.getBody());
        } catch (JsonProcessingException e) {
            throw new BrokerUnavailableException("Malformed SmartAPI response", e);
        }

        if (!root.path("status").asBoolean(false)) {
            throw new BrokerUnavailableException("SmartAPI error: " + root.path("message").asText());
        }
        JsonNode data = root.path("data");
        if (data.isMissingNode() || data.isNull()) {
            throw new BrokerUnavailableException("SmartAPI response carried no data");
        }
        return data;
    }

    private BrokerQuoteDto parseLtp(String symbol, JsonNode data) {
        if (!data.hasNonNull("ltp")) {
            throw new BrokerUnavailableException("No ltp in SmartAPI response for " + symbol);
        }
        BigDecimal ltp = new BigDecimal(data.get("ltp").asText());
        BigDecimal close = data.hasNonNull("close") ? new BigDecimal(data.get("close").asText()) : ltp;

        BigDecimal change = ltp.subtract(close);
        BigDecimal changePercent = BigDecimal.ZERO.setScale(2);
        if (close.compareTo(BigDecimal.ZERO) > 0) {
            changePercent = change.multiply(HUNDRED).divide(close, 2, RoundingMode.HALF_UP);
        }

        return BrokerQuoteDto.builder()
                .symbol(symbol.toUpperCase())
                .ltp(ltp)
                .change(change)
                .changePercent(changePercent)
                .build();
    }

    private HttpHeaders createHeaders(String jwtToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        headers.set("X-UserType", "USER");
        headers.set("X-SourceID", "WEB");
        headers.set("X-ClientLocalIP", "127.0.0.1");
        headers.set("X-ClientPublicIP", "127.0.0.1");
        headers.set("X-MACAddress", "00:00:00:00:00:00");
        headers.set("X-PrivateKey", config.getApiKey());
        if (jwtToken != null) {
            headers.setBearerAuth(jwtToken);
        }
        return headers;
    }

    @Value
    private static class BrokerSession {
        String jwtToken;
        Instant establishedAt;
    }
}
