package com.marketterminal.market_terminal.service.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketterminal.market_terminal.config.AngelOneConfig;
import com.marketterminal.market_terminal.dto.BrokerQuoteDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AngelOneClientTest {

    private static final String BASE_URL = "http://smartapi.test";
    private static final String LOGIN_URL = BASE_URL + "/rest/auth/angelbroking/user/v1/loginByPassword";
    private static final String LTP_URL = BASE_URL + "/rest/secure/angelbroking/order/v1/getLtpData";

    private static final String LOGIN_OK = "{\"status\":true,\"message\":\"SUCCESS\",\"errorcode\":\"\"," +
            "\"data\":{\"jwtToken\":\"jwt-abc\",\"refreshToken\":\"refresh-abc\",\"feedToken\":\"feed-abc\"}}";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private AngelOneConfig config;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        config = new AngelOneConfig();
        config.setApiKey("api-key");
        config.setClientCode("C123");
        config.setPassword("1234");
        config.setTotpSecret("JBSWY3DPEHPK3PXP");
        config.setBaseUrl(BASE_URL);
        config.setMaxRequestsPerMinute(100);
    }

    private AngelOneClient client() {
        return new AngelOneClient(restTemplate, config, new ObjectMapper());
    }

    @Test
    @DisplayName("missing credentials → no login attempt, mock mode")
    void loginWithoutCredentialsFails() {
        config.setTotpSecret("");
        AngelOneClient client = client();

        assertThat(client.login()).isFalse();
        assertThat(client.isConnected()).isFalse();
        assertThat(client.getQuote("TCS")).isEmpty();
        server.verify();
    }

    @Test
    @DisplayName("successful login posts credentials with a six digit TOTP")
    void loginEstablishesSession() {
        server.expect(requestTo(LOGIN_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-PrivateKey", "api-key"))
                .andExpect(header("X-UserType", "USER"))
                .andExpect(jsonPath("$.clientcode").value("C123"))
                .andExpect(jsonPath("$.password").value("1234"))
                .andExpect(jsonPath("$.totp").value(org.hamcrest.Matchers.matchesPattern("\\d{6}")))
                .andRespond(withSuccess(LOGIN_OK, MediaType.APPLICATION_JSON));

        AngelOneClient client = client();

        assertThat(client.login()).isTrue();
        assertThat(client.isConnected()).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("rejected login leaves the client disconnected")
    void rejectedLogin() {
        server.expect(requestTo(LOGIN_URL))
                .andRespond(withSuccess("{\"status\":false,\"message\":\"Invalid totp\",\"data\":null}",
                        MediaType.APPLICATION_JSON));

        AngelOneClient client = client();

        assertThat(client.login()).isFalse();
        assertThat(client.isConnected()).isFalse();
    }

    @Test
    @DisplayName("re-login replaces a live session, a failed re-login clears it")
    void reloginReplacesThenClearsSession() {
        server.expect(requestTo(LOGIN_URL))
                .andRespond(withSuccess(LOGIN_OK, MediaType.APPLICATION_JSON));
        server.expect(requestTo(LOGIN_URL))
                .andRespond(withSuccess(LOGIN_OK, MediaType.APPLICATION_JSON));
        server.expect(requestTo(LOGIN_URL))
                .andRespond(withServerError());

        AngelOneClient client = client();

        assertThat(client.login()).isTrue();
        assertThat(client.login()).isTrue();
        assertThat(client.isConnected()).isTrue();
        assertThat(client.login()).isFalse();
        assertThat(client.isConnected()).isFalse();
        server.verify();
    }

    @Test
    @DisplayName("LTP lookup derives change from previous close")
    void quoteParsesLtp() {
        server.expect(requestTo(LOGIN_URL))
                .andRespond(withSuccess(LOGIN_OK, MediaType.APPLICATION_JSON));
        server.expect(requestTo(LTP_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer jwt-abc"))
                .andExpect(jsonPath("$.exchange").value("NSE"))
                .andExpect(jsonPath("$.tradingsymbol").value("TCS-EQ"))
                .andExpect(jsonPath("$.symboltoken").value("11536"))
                .andRespond(withSuccess("{\"status\":true,\"message\":\"SUCCESS\",\"data\":{" +
                        "\"exchange\":\"NSE\",\"tradingsymbol\":\"TCS-EQ\",\"symboltoken\":\"11536\"," +
                        "\"open\":3990.0,\"high\":4020.5,\"low\":3980.0,\"close\":4000.0,\"ltp\":4010.0}}",
                        MediaType.APPLICATION_JSON));

        AngelOneClient client = client();
        client.login();
        Optional<BrokerQuoteDto> quote = client.getQuote("TCS");

        assertThat(quote).isPresent();
        assertThat(quote.get().getSymbol()).isEqualTo("TCS");
        assertThat(quote.get().getLtp()).isEqualByComparingTo("4010");
        assertThat(quote.get().getChange()).isEqualByComparingTo("10");
        assertThat(quote.get().getChangePercent()).isEqualTo(new BigDecimal("0.25"));
        server.verify();
    }

    @Test
    @DisplayName("unmapped symbol misses without calling the broker")
    void unmappedSymbolMisses() {
        server.expect(requestTo(LOGIN_URL))
                .andRespond(withSuccess(LOGIN_OK, MediaType.APPLICATION_JSON));

        AngelOneClient client = client();
        client.login();

        assertThat(client.getQuote("NOTASTOCK")).isEmpty();
        server.verify();
    }

    @Test
    @DisplayName("upstream error and malformed payloads both come back empty")
    void upstreamFailuresAreEmpty() {
        server.expect(requestTo(LOGIN_URL))
                .andRespond(withSuccess(LOGIN_OK, MediaType.APPLICATION_JSON));
        server.expect(requestTo(LTP_URL)).andRespond(withServerError());
        server.expect(requestTo(LTP_URL))
                .andRespond(withSuccess("not json", MediaType.APPLICATION_JSON));
        server.expect(requestTo(LTP_URL))
                .andRespond(withSuccess("{\"status\":true,\"data\":{\"close\":100}}", MediaType.APPLICATION_JSON));

        AngelOneClient client = client();
        client.login();

        assertThat(client.getQuote("INFY")).isEmpty();
        assertThat(client.getQuote("INFY")).isEmpty();
        assertThat(client.getQuote("INFY")).isEmpty();
        // a failed lookup does not drop the session
        assertThat(client.isConnected()).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("no session → lookup skipped")
    void quoteWithoutSession() {
        AngelOneClient client = client();

        assertThat(client.getQuote("TCS")).isEmpty();
        server.verify();
    }
}
