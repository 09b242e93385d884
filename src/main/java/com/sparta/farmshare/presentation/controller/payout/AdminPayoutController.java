package com.sparta.farmshare.presentation.controller.payout;

import com.sparta.farmshare.application.payout.dto.InitiatePayoutRequest;
import com.sparta.farmshare.application.payout.dto.PayoutListResponse;
import com.sparta.farmshare.application.payout.dto.PayoutResponse;
import com.sparta.farmshare.application.payout.usecase.GetPayoutsUseCase;
import com.sparta.farmshare.application.payout.usecase.InitiatePayoutUseCase;
import com.sparta.farmshare.application.payout.usecase.VerifyPayoutUseCase;
import com.sparta.farmshare.domain.payout.entity.PayoutStatus;
import com.sparta.farmshare.presentation.auth.AdminOnly;
import com.sparta.farmshare.presentation.auth.AuthUser;
import com.sparta.farmshare.presentation.auth.LoginUser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 판매자 정산 관리 API (관리자 전용)
 */
@Tag(name = "정산 관리", description = "Paystack 이체를 통한 판매자 정산")
@RestController
@RequiredArgsConstructor
@Validated
@AdminOnly
@RequestMapping("/api/admin/payouts")
public class AdminPayoutController {

    private final InitiatePayoutUseCase initiatePayoutUseCase;
    private final GetPayoutsUseCase getPayoutsUseCase;
    private final VerifyPayoutUseCase verifyPayoutUseCase;

    /**
     * 정산 이체 실행
     * POST /api/admin/payouts
     */
    @Operation(summary = "정산 이체", description = "수수료 2%를 제외한 금액을 판매자 계좌로 이체합니다")
    @PostMapping
    public ResponseEntity<PayoutResponse> initiate(@LoginUser AuthUser authUser,
                                                   @Valid @RequestBody InitiatePayoutRequest request) {
        PayoutResponse response = initiatePayoutUseCase.execute(request, authUser.userId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * 정산 목록
     * GET /api/admin/payouts
     */
    @Operation(summary = "정산 목록 조회")
    @GetMapping
    public ResponseEntity<PayoutListResponse> getPayouts(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
            @Parameter(description = "상태 필터") @RequestParam(required = false) PayoutStatus status,
            @Parameter(description = "판매자 ID 필터") @RequestParam(required = false) String vendorId) {
        return ResponseEntity.ok(getPayoutsUseCase.execute(page, limit, status, vendorId));
    }

    /**
     * Paystack 이체 상태 동기화
     * POST /api/admin/payouts/{reference}/verify
     */
    @Operation(summary = "정산 상태 확인")
    @PostMapping("/{reference}/verify")
    public ResponseEntity<PayoutResponse> verify(@PathVariable String reference) {
        return ResponseEntity.ok(verifyPayoutUseCase.execute(reference));
    }
}
