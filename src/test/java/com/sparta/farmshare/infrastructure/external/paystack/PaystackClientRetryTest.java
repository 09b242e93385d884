package com.sparta.farmshare.infrastructure.external.paystack;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.farmshare.infrastructure.external.paystack.dto.PaystackResponse;
import com.sparta.farmshare.infrastructure.external.paystack.dto.ResolvedAccount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Paystack 클라이언트 재시도 정책 테스트
 * @Retryable 프록시를 거치도록 스프링 컨텍스트에서 빈을 받아 호출한다
 */
@SpringJUnitConfig(PaystackClientRetryTest.RetryTestConfig.class)
@TestPropertySource(properties = {
        "app.paystack.max-retries=3",
        "app.paystack.bank-list-max-retries=2",
        "app.paystack.retry-delay-ms=1"
})
@DisplayName("PaystackClient 재시도 테스트")
class PaystackClientRetryTest {

    private static final String BASE_URL = "https://api.paystack.co";
    private static final String RESOLVE_URL = BASE_URL + "/bank/resolve?account_number=0123456789&bank_code=058";

    @Configuration
    @EnableRetry
    static class RetryTestConfig {

        @Bean
        RestTemplate paystackRestTemplate() {
            return new RestTemplateBuilder().rootUri(BASE_URL).build();
        }

        @Bean
        PaystackClient paystackClient(RestTemplate paystackRestTemplate) {
            return new PaystackClient(paystackRestTemplate, new ObjectMapper());
        }
    }

    @Autowired
    private RestTemplate paystackRestTemplate;

    @Autowired
    private PaystackClient paystackClient;

    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        server = MockRestServiceServer.bindTo(paystackRestTemplate).build();
    }

    @Test
    @DisplayName("503이 세 번 나도 네 번째 시도에서 성공하면 결과를 돌려준다")
    void 서버오류_후_성공() {
        // given
        server.expect(ExpectedCount.times(3), requestTo(RESOLVE_URL))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(ExpectedCount.once(), requestTo(RESOLVE_URL))
                .andRespond(withSuccess("""
                        {"status": true, "message": "Account number resolved",
                         "data": {"account_number": "0123456789", "account_name": "ADA OBI", "bank_id": 9}}
                        """, MediaType.APPLICATION_JSON));

        // when
        PaystackResponse<ResolvedAccount> response = paystackClient.resolveAccount("0123456789", "058");

        // then
        assertThat(response.data().accountName()).isEqualTo("ADA OBI");
        server.verify();
    }

    @Test
    @DisplayName("429가 계속되면 최초 1회 + 재시도 3회, 총 4번 호출 후 실패한다")
    void 요청한도_초과_재시도_소진() {
        // given
        server.expect(ExpectedCount.times(4), requestTo(RESOLVE_URL))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        // when & then
        assertThatThrownBy(() -> paystackClient.resolveAccount("0123456789", "058"))
                .isInstanceOf(HttpClientErrorException.TooManyRequests.class);
        server.verify();
    }

    @Test
    @DisplayName("422 같은 4xx는 재시도하지 않는다")
    void 클라이언트_오류_즉시_실패() {
        // given
        server.expect(ExpectedCount.once(), requestTo(RESOLVE_URL))
                .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"status\": false, \"message\": \"Could not resolve account name\"}"));

        // when & then
        assertThatThrownBy(() -> paystackClient.resolveAccount("0123456789", "058"))
                .isInstanceOf(HttpClientErrorException.UnprocessableEntity.class);
        server.verify();
    }

    @Test
    @DisplayName("은행 목록은 재시도 2회까지만 한다")
    void 은행_목록_재시도_한도() {
        // given
        server.expect(ExpectedCount.times(3), requestTo(BASE_URL + "/bank?country=nigeria"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        // when & then
        assertThatThrownBy(() -> paystackClient.listBanks())
                .isInstanceOf(HttpServerErrorException.BadGateway.class);
        server.verify();
    }

    @Test
    @DisplayName("이체 수취인 등록 같은 POST는 5xx여도 재시도하지 않는다")
    void POST_재시도_안함() {
        // given
        server.expect(ExpectedCount.once(), requestTo(BASE_URL + "/transferrecipient"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        // when & then
        assertThatThrownBy(() -> paystackClient.createTransferRecipient("ADA OBI", "0123456789", "058"))
                .isInstanceOf(HttpServerErrorException.ServiceUnavailable.class);
        server.verify();
    }
}
