package com.sparta.farmshare.presentation.controller.newsletter;

import com.sparta.farmshare.application.common.dto.MessageResponse;
import com.sparta.farmshare.application.newsletter.dto.CampaignResponse;
import com.sparta.farmshare.application.newsletter.dto.NewsletterStatsResponse;
import com.sparta.farmshare.application.newsletter.dto.SendNewsletterRequest;
import com.sparta.farmshare.application.newsletter.dto.SendNewsletterResponse;
import com.sparta.farmshare.application.newsletter.dto.SubscribeRequest;
import com.sparta.farmshare.application.newsletter.dto.SubscribeResponse;
import com.sparta.farmshare.application.newsletter.dto.SubscriberListResponse;
import com.sparta.farmshare.application.newsletter.dto.UnsubscribeRequest;
import com.sparta.farmshare.application.newsletter.usecase.DeleteSubscriberUseCase;
import com.sparta.farmshare.application.newsletter.usecase.GetCampaignUseCase;
import com.sparta.farmshare.application.newsletter.usecase.GetNewsletterStatsUseCase;
import com.sparta.farmshare.application.newsletter.usecase.GetSubscribersUseCase;
import com.sparta.farmshare.application.newsletter.usecase.SendNewsletterUseCase;
import com.sparta.farmshare.application.newsletter.usecase.SubscribeNewsletterUseCase;
import com.sparta.farmshare.application.newsletter.usecase.UnsubscribeNewsletterUseCase;
import com.sparta.farmshare.presentation.auth.AdminOnly;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 뉴스레터 API
 * 구독/해지는 공개, 나머지는 관리자 전용
 */
@Tag(name = "뉴스레터", description = "뉴스레터 구독 및 발송 API")
@RestController
@RequiredArgsConstructor
@Validated
@RequestMapping("/api/newsletter")
public class NewsletterController {

    private final SubscribeNewsletterUseCase subscribeNewsletterUseCase;
    private final UnsubscribeNewsletterUseCase unsubscribeNewsletterUseCase;
    private final GetSubscribersUseCase getSubscribersUseCase;
    private final GetNewsletterStatsUseCase getNewsletterStatsUseCase;
    private final DeleteSubscriberUseCase deleteSubscriberUseCase;
    private final SendNewsletterUseCase sendNewsletterUseCase;
    private final GetCampaignUseCase getCampaignUseCase;

    /**
     * 구독
     * POST /api/newsletter/subscribe
     */
    @Operation(summary = "뉴스레터 구독", description = "해지했던 이메일은 재활성화됩니다")
    @PostMapping("/subscribe")
    public ResponseEntity<SubscribeResponse> subscribe(@Valid @RequestBody SubscribeRequest request) {
        return ResponseEntity.ok(subscribeNewsletterUseCase.execute(request));
    }

    /**
     * 구독 해지
     * POST /api/newsletter/unsubscribe
     */
    @Operation(summary = "뉴스레터 구독 해지")
    @PostMapping("/unsubscribe")
    public ResponseEntity<MessageResponse> unsubscribe(@Valid @RequestBody UnsubscribeRequest request) {
        return ResponseEntity.ok(unsubscribeNewsletterUseCase.execute(request.email()));
    }

    @Operation(summary = "구독자 목록 조회")
    @AdminOnly
    @GetMapping("/subscribers")
    public ResponseEntity<SubscriberListResponse> getSubscribers(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int limit,
            @RequestParam(defaultValue = "true") boolean activeOnly) {
        return ResponseEntity.ok(getSubscribersUseCase.execute(page, limit, activeOnly));
    }

    @Operation(summary = "구독 통계")
    @AdminOnly
    @GetMapping("/stats")
    public ResponseEntity<NewsletterStatsResponse> getStats() {
        return ResponseEntity.ok(getNewsletterStatsUseCase.execute());
    }

    /**
     * 구독자 영구 삭제
     * DELETE /api/newsletter/subscriber/{email}
     */
    @Operation(summary = "구독자 삭제")
    @AdminOnly
    @DeleteMapping("/subscriber/{email}")
    public ResponseEntity<MessageResponse> deleteSubscriber(@PathVariable String email) {
        return ResponseEntity.ok(deleteSubscriberUseCase.execute(email));
    }

    /**
     * 뉴스레터 발송 (testMode면 미리보기만)
     * POST /api/newsletter/send
     */
    @Operation(summary = "뉴스레터 발송", description = "배치 단위로 큐에 등록하고 즉시 응답합니다")
    @AdminOnly
    @PostMapping("/send")
    public ResponseEntity<SendNewsletterResponse> send(@Valid @RequestBody SendNewsletterRequest request) {
        return ResponseEntity.ok(sendNewsletterUseCase.execute(request));
    }

    @Operation(summary = "캠페인 발송 현황")
    @AdminOnly
    @GetMapping("/campaigns/{id}")
    public ResponseEntity<CampaignResponse> getCampaign(@PathVariable Long id) {
        return ResponseEntity.ok(getCampaignUseCase.execute(id));
    }
}
