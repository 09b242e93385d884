package com.sparta.farmshare.presentation.controller.bank;

import com.sparta.farmshare.application.bank.dto.BankServiceHealthResponse;
import com.sparta.farmshare.application.bank.dto.BankVerificationResponse;
import com.sparta.farmshare.application.bank.dto.SupportedBank;
import com.sparta.farmshare.application.bank.dto.VerifyBankRequest;
import com.sparta.farmshare.application.bank.usecase.CheckBankServiceHealthUseCase;
import com.sparta.farmshare.application.bank.usecase.GetSupportedBanksUseCase;
import com.sparta.farmshare.application.bank.usecase.VerifyBankAccountUseCase;
import com.sparta.farmshare.presentation.auth.AuthUser;
import com.sparta.farmshare.presentation.auth.Authenticated;
import com.sparta.farmshare.presentation.auth.LoginUser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 은행 / 정산 계좌 확인 API
 */
@Tag(name = "은행 계좌", description = "지원 은행 조회 및 정산 계좌 확인")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class BankController {

    private final GetSupportedBanksUseCase getSupportedBanksUseCase;
    private final CheckBankServiceHealthUseCase checkBankServiceHealthUseCase;
    private final VerifyBankAccountUseCase verifyBankAccountUseCase;

    /**
     * 지원 은행 목록
     * GET /api/banks
     */
    @Operation(summary = "지원 은행 목록", description = "Paystack 은행 목록 (6시간 캐시)")
    @GetMapping("/banks")
    public ResponseEntity<List<SupportedBank>> getBanks() {
        return ResponseEntity.ok(getSupportedBanksUseCase.execute());
    }

    /**
     * 계좌 확인 서비스 상태
     * GET /api/banks/health
     */
    @Operation(summary = "계좌 확인 서비스 상태")
    @GetMapping("/banks/health")
    public ResponseEntity<BankServiceHealthResponse> health() {
        return ResponseEntity.ok(checkBankServiceHealthUseCase.execute());
    }

    /**
     * 정산 계좌 확인 및 등록
     * POST /api/verification/bank
     */
    @Operation(summary = "정산 계좌 확인", description = "예금주명을 확인하고 내 계좌로 등록합니다")
    @Authenticated
    @PostMapping("/verification/bank")
    public ResponseEntity<BankVerificationResponse> verifyBank(@LoginUser AuthUser authUser,
                                                               @Valid @RequestBody VerifyBankRequest request) {
        return ResponseEntity.ok(verifyBankAccountUseCase.execute(authUser.userId(), request));
    }
}
