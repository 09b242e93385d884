package com.sparta.farmshare.application.payment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.farmshare.application.common.dto.MessageResponse;
import com.sparta.farmshare.application.payment.usecase.HandlePaystackWebhookUseCase;
import com.sparta.farmshare.application.payout.service.PayoutService;
import com.sparta.farmshare.application.security.service.SecurityService;
import com.sparta.farmshare.common.config.properties.PaystackProperties;
import com.sparta.farmshare.common.util.HashUtils;
import com.sparta.farmshare.domain.payment.entity.PaymentStatus;
import com.sparta.farmshare.domain.payment.entity.PaymentTransaction;
import com.sparta.farmshare.domain.payment.exception.InvalidWebhookSignatureException;
import com.sparta.farmshare.domain.payment.repository.PaymentTransactionRepository;
import com.sparta.farmshare.domain.payout.entity.PayoutStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("Paystack 웹훅 UseCase 테스트")
class HandlePaystackWebhookUseCaseTest {

    private static final String SECRET = "sk_test_farmshare";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private SecurityService securityService;

    @Mock
    private PaymentTransactionRepository paymentTransactionRepository;

    @Mock
    private PayoutService payoutService;

    private HandlePaystackWebhookUseCase useCase;

    @BeforeEach
    void setUp() {
        PaystackProperties properties = new PaystackProperties("https://api.paystack.co", SECRET, null,
                Duration.ofSeconds(15), 3, 2, 10);
        useCase = new HandlePaystackWebhookUseCase(properties, securityService, paymentTransactionRepository,
                payoutService, new ObjectMapper(), CLOCK);
    }

    @Test
    @DisplayName("서명이 맞는 charge.success는 결제를 SUCCESS로 만들고 처리 기록을 남긴다")
    void 결제_성공_웹훅() {
        // given
        String body = """
                {"event":"charge.success","data":{"id":987,"reference":"fs_pay_1","amount":1500000,"gateway_response":"Successful"}}""";
        PaymentTransaction payment = PaymentTransaction.pending("user-1", "buyer@farmshare.ng", "fs_pay_1",
                15_000, null, null);
        given(securityService.isWebhookProcessed("paystack", "charge.success:987")).willReturn(false);
        given(paymentTransactionRepository.findByReference("fs_pay_1")).willReturn(Optional.of(payment));

        // when
        MessageResponse response = useCase.execute(body, sign(body));

        // then
        assertThat(response.message()).isEqualTo("Webhook processed");
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.SUCCESS);
        assertThat(payment.getGatewayResponse()).isEqualTo("Successful");
        verify(securityService).clearPaymentFailures("user-1");
        verify(securityService).markWebhookProcessed("paystack", "charge.success:987", "charge.success", sign(body));
    }

    @Test
    @DisplayName("대문자 hex 서명도 허용하고 소문자로 기록한다")
    void 대문자_서명() {
        String body = "{\"event\":\"subscription.create\",\"data\":{\"id\":1}}";
        given(securityService.isWebhookProcessed("paystack", "subscription.create:1")).willReturn(false);

        MessageResponse response = useCase.execute(body, sign(body).toUpperCase(Locale.ROOT));

        assertThat(response.message()).isEqualTo("Webhook processed");
        verify(securityService).markWebhookProcessed("paystack", "subscription.create:1", "subscription.create",
                sign(body));
    }

    @Test
    @DisplayName("금액이 다르면 결제를 FAILED로 남긴다")
    void 금액_불일치() {
        String body = """
                {"event":"charge.success","data":{"id":988,"reference":"fs_pay_1","amount":100}}""";
        PaymentTransaction payment = PaymentTransaction.pending("user-1", "buyer@farmshare.ng", "fs_pay_1",
                15_000, null, null);
        given(securityService.isWebhookProcessed(anyString(), anyString())).willReturn(false);
        given(paymentTransactionRepository.findByReference("fs_pay_1")).willReturn(Optional.of(payment));

        useCase.execute(body, sign(body));

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(payment.getGatewayResponse()).isEqualTo("Amount mismatch");
    }

    @Test
    @DisplayName("서명이 틀리면 거부하고 아무것도 처리하지 않는다")
    void 서명_불일치() {
        String body = "{\"event\":\"charge.success\",\"data\":{\"id\":1}}";

        assertThatThrownBy(() -> useCase.execute(body, "deadbeef"))
                .isInstanceOf(InvalidWebhookSignatureException.class);
        verify(securityService, never()).markWebhookProcessed(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("서명 헤더가 없으면 거부한다")
    void 서명_없음() {
        assertThatThrownBy(() -> useCase.execute("{}", null))
                .isInstanceOf(InvalidWebhookSignatureException.class);
    }

    @Test
    @DisplayName("이미 처리한 이벤트는 다시 처리하지 않는다")
    void 중복_이벤트() {
        String body = "{\"event\":\"transfer.success\",\"data\":{\"id\":55,\"reference\":\"fs_ref_1\"}}";
        given(securityService.isWebhookProcessed("paystack", "transfer.success:55")).willReturn(true);

        MessageResponse response = useCase.execute(body, sign(body));

        assertThat(response.message()).isEqualTo("Event already processed");
        verify(payoutService, never()).applyTransferWebhook(anyString(), any(), any());
        verify(securityService, never()).markWebhookProcessed(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("transfer.failed는 사유와 함께 정산에 반영된다")
    void 이체_실패_웹훅() {
        String body = """
                {"event":"transfer.failed","data":{"id":56,"reference":"fs_ref_1","reason":"Insufficient balance"}}""";
        given(securityService.isWebhookProcessed("paystack", "transfer.failed:56")).willReturn(false);

        useCase.execute(body, sign(body));

        verify(payoutService).applyTransferWebhook("fs_ref_1", PayoutStatus.FAILED, "Insufficient balance");
    }

    @Test
    @DisplayName("JSON이 아니면 400")
    void 잘못된_본문() {
        String body = "not-json";

        assertThatThrownBy(() -> useCase.execute(body, sign(body)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static String sign(String body) {
        return HashUtils.hmacSha512Hex(SECRET, body);
    }
}
