package com.sparta.farmshare.application.newsletter;

import com.sparta.farmshare.application.newsletter.service.NewsletterDispatchService;
import com.sparta.farmshare.domain.newsletter.entity.NewsletterCampaign;
import com.sparta.farmshare.domain.newsletter.repository.NewsletterCampaignRepository;
import com.sparta.farmshare.infrastructure.mail.EmailSendException;
import com.sparta.farmshare.infrastructure.mail.EmailService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("뉴스레터 배치 발송 테스트")
class NewsletterDispatchServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private NewsletterCampaignRepository campaignRepository;

    @Mock
    private EmailService emailService;

    private NewsletterDispatchService dispatchService;

    @BeforeEach
    void setUp() {
        dispatchService = new NewsletterDispatchService(campaignRepository, emailService, CLOCK);
    }

    @Test
    @DisplayName("한 명의 발송 실패가 배치를 멈추지 않고 실패 수로 집계된다")
    void 부분_실패_집계() {
        // given
        NewsletterCampaign campaign = NewsletterCampaign.queue("Harvest news", "<p>hi</p>", "hi", null,
                3, 1, LocalDateTime.now(CLOCK));
        given(campaignRepository.findById(1L)).willReturn(Optional.of(campaign));
        given(emailService.sendCustomEmail("a@farmshare.ng", "Harvest news", "<p>hi</p>", "hi")).willReturn(true);
        given(emailService.sendCustomEmail("b@farmshare.ng", "Harvest news", "<p>hi</p>", "hi"))
                .willThrow(new EmailSendException("b@farmshare.ng", new RuntimeException("mailbox full")));
        given(emailService.sendCustomEmail("c@farmshare.ng", "Harvest news", "<p>hi</p>", "hi")).willReturn(false);

        // when
        dispatchService.processBatch(1L, List.of("a@farmshare.ng", "b@farmshare.ng", "c@farmshare.ng"));

        // then
        verify(campaignRepository).addBatchResult(1L, 1, 2);
        verify(campaignRepository).completeIfFinished(1L, LocalDateTime.now(CLOCK));
    }

    @Test
    @DisplayName("캠페인이 없으면 배치를 버린다")
    void 캠페인_없음() {
        given(campaignRepository.findById(99L)).willReturn(Optional.empty());

        dispatchService.processBatch(99L, List.of("a@farmshare.ng"));

        verify(emailService, never()).sendCustomEmail(anyString(), anyString(), anyString(), any());
        verify(campaignRepository, never()).addBatchResult(any(), anyInt(), anyInt());
    }
}
