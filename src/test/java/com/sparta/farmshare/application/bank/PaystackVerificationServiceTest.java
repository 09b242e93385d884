package com.sparta.farmshare.application.bank;

import com.sparta.farmshare.application.bank.dto.BankVerificationError;
import com.sparta.farmshare.application.bank.dto.BankVerificationResult;
import com.sparta.farmshare.application.bank.dto.SupportedBank;
import com.sparta.farmshare.application.bank.service.PaystackVerificationService;
import com.sparta.farmshare.common.config.properties.PaystackProperties;
import com.sparta.farmshare.domain.bank.exception.BankVerificationFailedException;
import com.sparta.farmshare.infrastructure.external.paystack.PaystackClient;
import com.sparta.farmshare.infrastructure.external.paystack.dto.PaystackBank;
import com.sparta.farmshare.infrastructure.external.paystack.dto.PaystackResponse;
import com.sparta.farmshare.infrastructure.external.paystack.dto.ResolvedAccount;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("Paystack 계좌 확인 서비스 테스트")
class PaystackVerificationServiceTest {

    private static final String ACCOUNT_NUMBER = "0123456789";
    private static final String BANK_CODE = "058";

    @Mock
    private PaystackClient paystackClient;

    private PaystackVerificationService service(String secretKey) {
        PaystackProperties properties = new PaystackProperties("https://api.paystack.co", secretKey, null,
                Duration.ofSeconds(15), 3, 2, 10);
        return new PaystackVerificationService(paystackClient, properties);
    }

    @Test
    @DisplayName("계좌 확인에 성공하면 예금주명을 돌려준다")
    void 계좌_확인_성공() {
        // given
        given(paystackClient.resolveAccount(ACCOUNT_NUMBER, BANK_CODE)).willReturn(new PaystackResponse<>(
                true, "Account number resolved", new ResolvedAccount(ACCOUNT_NUMBER, "ADA OBI", 9L)));

        // when
        BankVerificationResult result = service("sk_test").verifyBankAccount(ACCOUNT_NUMBER, BANK_CODE);

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.accountName()).isEqualTo("ADA OBI");
        assertThat(result.accountNumber()).isEqualTo(ACCOUNT_NUMBER);
        assertThat(result.message()).isEqualTo("Bank account verified successfully");
    }

    @Test
    @DisplayName("API 키가 없으면 Paystack을 호출하지 않고 NOT_CONFIGURED")
    void 키_미설정() {
        BankVerificationResult result = service("").verifyBankAccount(ACCOUNT_NUMBER, BANK_CODE);

        assertThat(result.success()).isFalse();
        assertThat(result.errorType()).isEqualTo(BankVerificationError.NOT_CONFIGURED);
        assertThat(result.error()).isEqualTo("Paystack API key not configured");
        verify(paystackClient, never()).resolveAccount(any(), any());
    }

    @Test
    @DisplayName("계좌번호가 10자리 숫자가 아니면 400")
    void 계좌번호_형식_오류() {
        assertThatThrownBy(() -> service("sk_test").verifyBankAccount("12345", BANK_CODE))
                .isInstanceOf(BankVerificationFailedException.class)
                .hasMessage("Invalid account number format. Must be 10 digits.");
    }

    @Test
    @DisplayName("은행 코드 형식이 틀리면 400")
    void 은행코드_형식_오류() {
        assertThatThrownBy(() -> service("sk_test").verifyBankAccount(ACCOUNT_NUMBER, "AB"))
                .isInstanceOf(BankVerificationFailedException.class)
                .hasMessage("Invalid bank code format");
    }

    @Test
    @DisplayName("422 응답은 INVALID_ACCOUNT로 분류")
    void 응답_422() {
        given(paystackClient.resolveAccount(ACCOUNT_NUMBER, BANK_CODE))
                .willThrow(HttpClientErrorException.create(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable",
                        null, null, null));

        BankVerificationResult result = service("sk_test").verifyBankAccount(ACCOUNT_NUMBER, BANK_CODE);

        assertThat(result.errorType()).isEqualTo(BankVerificationError.INVALID_ACCOUNT);
        assertThat(result.message()).isEqualTo("Account number not found or invalid for the selected bank");
    }

    @Test
    @DisplayName("400 응답은 Paystack 메시지를 그대로 전달")
    void 응답_400() {
        HttpClientErrorException badRequest = HttpClientErrorException.create(HttpStatus.BAD_REQUEST,
                "Bad Request", null, null, null);
        given(paystackClient.resolveAccount(ACCOUNT_NUMBER, BANK_CODE)).willThrow(badRequest);
        given(paystackClient.extractProviderMessage(badRequest)).willReturn("Could not resolve account name");

        BankVerificationResult result = service("sk_test").verifyBankAccount(ACCOUNT_NUMBER, BANK_CODE);

        assertThat(result.errorType()).isEqualTo(BankVerificationError.BAD_REQUEST);
        assertThat(result.message()).isEqualTo("Could not resolve account name");
    }

    @Test
    @DisplayName("5xx 응답은 SERVICE_UNAVAILABLE")
    void 응답_503() {
        given(paystackClient.resolveAccount(ACCOUNT_NUMBER, BANK_CODE))
                .willThrow(HttpServerErrorException.create(HttpStatus.SERVICE_UNAVAILABLE, "Unavailable",
                        null, null, null));

        BankVerificationResult result = service("sk_test").verifyBankAccount(ACCOUNT_NUMBER, BANK_CODE);

        assertThat(result.errorType()).isEqualTo(BankVerificationError.SERVICE_UNAVAILABLE);
        assertThat(result.errorType().isServiceFault()).isTrue();
    }

    @Test
    @DisplayName("소켓 타임아웃은 TIMEOUT")
    void 타임아웃() {
        given(paystackClient.resolveAccount(ACCOUNT_NUMBER, BANK_CODE))
                .willThrow(new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out")));

        BankVerificationResult result = service("sk_test").verifyBankAccount(ACCOUNT_NUMBER, BANK_CODE);

        assertThat(result.errorType()).isEqualTo(BankVerificationError.TIMEOUT);
    }

    @Test
    @DisplayName("status=false 응답은 INVALID_RESPONSE")
    void 잘못된_응답() {
        given(paystackClient.resolveAccount(ACCOUNT_NUMBER, BANK_CODE))
                .willReturn(new PaystackResponse<>(false, "failed", null));

        BankVerificationResult result = service("sk_test").verifyBankAccount(ACCOUNT_NUMBER, BANK_CODE);

        assertThat(result.errorType()).isEqualTo(BankVerificationError.INVALID_RESPONSE);
    }

    @Test
    @DisplayName("은행 목록은 bank code 기준으로 중복 제거되고 먼저 나온 항목이 남는다")
    void 은행_목록_중복_제거() {
        // given
        given(paystackClient.listBanks()).willReturn(List.of(
                new PaystackBank(1L, "Access Bank", "access-bank", "044", null, "emandate", true),
                new PaystackBank(2L, "Access Bank (Diamond)", "access-bank-diamond", "044", null, null, true),
                new PaystackBank(3L, "GTBank", "guaranty-trust-bank", "058", null, null, true)));

        // when
        List<SupportedBank> banks = service("sk_test").getSupportedBanks();

        // then
        assertThat(banks).extracting(SupportedBank::getCode).containsExactly("044", "058");
        assertThat(banks.get(0).getName()).isEqualTo("Access Bank");
    }

    @Test
    @DisplayName("은행 목록 조회 실패 시 빈 목록")
    void 은행_목록_실패() {
        given(paystackClient.listBanks()).willThrow(new ResourceAccessException("Connection refused"));

        assertThat(service("sk_test").getSupportedBanks()).isEmpty();
    }
}
