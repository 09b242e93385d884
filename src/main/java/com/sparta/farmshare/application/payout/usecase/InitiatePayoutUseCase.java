package com.sparta.farmshare.application.payout.usecase;

import com.sparta.farmshare.application.payout.dto.InitiatePayoutRequest;
import com.sparta.farmshare.application.payout.dto.PayoutEventType;
import com.sparta.farmshare.application.payout.dto.PayoutResponse;
import com.sparta.farmshare.application.payout.service.PayoutService;
import com.sparta.farmshare.application.payout.support.PayoutReferenceGenerator;
import com.sparta.farmshare.domain.payout.entity.Payout;
import com.sparta.farmshare.domain.payout.exception.VendorNotEligibleException;
import com.sparta.farmshare.domain.payout.repository.PayoutRepository;
import com.sparta.farmshare.domain.user.entity.Role;
import com.sparta.farmshare.domain.user.entity.User;
import com.sparta.farmshare.domain.user.exception.UserNotFoundException;
import com.sparta.farmshare.domain.user.repository.UserRepository;
import com.sparta.farmshare.infrastructure.aop.annotation.DistributedLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 판매자 정산 이체 유스케이스 (관리자)
 *
 * 같은 판매자에 대한 동시 요청은 분산 락으로 직렬화된다.
 * 락 AOP가 REQUIRES_NEW 트랜잭션을 열어 주므로 정산 저장과 Outbox 기록이 함께 커밋된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InitiatePayoutUseCase {

    private final UserRepository userRepository;
    private final PayoutRepository payoutRepository;
    private final PayoutService payoutService;
    private final PayoutReferenceGenerator referenceGenerator;

    @DistributedLock(key = "'payout:vendor:'.concat(#request.vendorId())", waitTime = 5L, leaseTime = 60L)
    public PayoutResponse execute(InitiatePayoutRequest request, String adminId) {
        User vendor = userRepository.findById(request.vendorId())
                .orElseThrow(() -> new UserNotFoundException(request.vendorId()));

        if (vendor.getRole() != Role.VENDOR) {
            throw new VendorNotEligibleException("User is not a vendor");
        }
        if (!vendor.hasVerifiedBankAccount()) {
            throw new VendorNotEligibleException("Vendor has no verified bank account");
        }

        Payout payout = Payout.create(
                vendor.getUserId(),
                referenceGenerator.generate(vendor.getUserId()),
                request.amount(),
                request.reason(),
                adminId);
        payoutRepository.save(payout);

        payoutService.requestTransfer(payout, vendor);
        payoutService.recordEvent(payout, PayoutEventType.forInitiation(payout.getStatus()));

        log.info("정산 생성 - reference={}, vendorId={}, gross={}, net={}, status={}",
                payout.getReference(), vendor.getUserId(), payout.getGrossAmount(),
                payout.getNetAmount(), payout.getStatus());

        return PayoutResponse.from(payout);
    }
}
