package com.marketterminal.market_terminal.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "angel-one")
@Getter
@Setter
public class AngelOneConfig {
    private String apiKey;
    private String clientCode;
    private String password;
    private String totpSecret;
    private String baseUrl = "https://apiconnect.angelbroking.com";
    private int maxRequestsPerMinute = 180;

    /**
     * True only when every credential needed for a SmartAPI login is present.
     */
    public boolean hasCredentials() {
        return isPresent(apiKey) && isPresent(clientCode)
                && isPresent(password) && isPresent(totpSecret);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
