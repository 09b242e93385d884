package com.sparta.farmshare.presentation.controller.payment;

import com.sparta.farmshare.application.common.dto.MessageResponse;
import com.sparta.farmshare.application.payment.dto.InitializePaymentRequest;
import com.sparta.farmshare.application.payment.dto.InitializePaymentResponse;
import com.sparta.farmshare.application.payment.dto.PaymentResponse;
import com.sparta.farmshare.application.payment.usecase.HandlePaystackWebhookUseCase;
import com.sparta.farmshare.application.payment.usecase.InitializePaymentUseCase;
import com.sparta.farmshare.application.payment.usecase.VerifyPaymentUseCase;
import com.sparta.farmshare.presentation.auth.AuthUser;
import com.sparta.farmshare.presentation.auth.Authenticated;
import com.sparta.farmshare.presentation.auth.LoginUser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Paystack 결제 API
 */
@Tag(name = "결제", description = "Paystack 체크아웃 및 웹훅")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/payments")
public class PaymentController {

    private static final String SIGNATURE_HEADER = "x-paystack-signature";

    private final InitializePaymentUseCase initializePaymentUseCase;
    private final VerifyPaymentUseCase verifyPaymentUseCase;
    private final HandlePaystackWebhookUseCase handlePaystackWebhookUseCase;

    /**
     * 결제 페이지 생성
     * POST /api/payments/initialize
     */
    @Operation(summary = "결제 초기화", description = "Paystack 결제 URL을 발급합니다 (시간당 시도 제한)")
    @Authenticated
    @PostMapping("/initialize")
    public ResponseEntity<InitializePaymentResponse> initialize(@LoginUser AuthUser authUser,
                                                                @Valid @RequestBody InitializePaymentRequest request) {
        return ResponseEntity.ok(initializePaymentUseCase.execute(authUser.userId(), request));
    }

    /**
     * 결제 결과 확인
     * GET /api/payments/verify/{reference}
     */
    @Operation(summary = "결제 확인")
    @Authenticated
    @GetMapping("/verify/{reference}")
    public ResponseEntity<PaymentResponse> verify(@LoginUser AuthUser authUser, @PathVariable String reference) {
        return ResponseEntity.ok(verifyPaymentUseCase.execute(authUser.userId(), reference));
    }

    /**
     * Paystack 웹훅 (서명 검증)
     * POST /api/payments/paystack/webhook
     */
    @Operation(summary = "Paystack 웹훅")
    @PostMapping("/paystack/webhook")
    public ResponseEntity<MessageResponse> webhook(@RequestBody String rawBody,
                                                   @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        return ResponseEntity.ok(handlePaystackWebhookUseCase.execute(rawBody, signature));
    }
}
