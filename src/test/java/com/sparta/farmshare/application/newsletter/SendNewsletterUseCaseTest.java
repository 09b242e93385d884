package com.sparta.farmshare.application.newsletter;

import com.sparta.farmshare.application.newsletter.dto.SendNewsletterRequest;
import com.sparta.farmshare.application.newsletter.dto.SendNewsletterResponse;
import com.sparta.farmshare.application.newsletter.event.NewsletterCampaignQueuedEvent;
import com.sparta.farmshare.application.newsletter.usecase.SendNewsletterUseCase;
import com.sparta.farmshare.common.config.properties.NewsletterProperties;
import com.sparta.farmshare.domain.newsletter.entity.CampaignStatus;
import com.sparta.farmshare.domain.newsletter.entity.NewsletterCampaign;
import com.sparta.farmshare.domain.newsletter.repository.NewsletterCampaignRepository;
import com.sparta.farmshare.domain.newsletter.repository.NewsletterSubscriberRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("뉴스레터 발송 UseCase 테스트")
class SendNewsletterUseCaseTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private NewsletterSubscriberRepository subscriberRepository;

    @Mock
    private NewsletterCampaignRepository campaignRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private SendNewsletterUseCase useCase;

    @BeforeEach
    void setUp() {
        useCase = new SendNewsletterUseCase(subscriberRepository, campaignRepository,
                new NewsletterProperties(50, Duration.ofSeconds(1)), eventPublisher, CLOCK);
    }

    @Test
    @DisplayName("테스트 모드는 발송 없이 수신자 5명과 HTML 앞 500자만 보여준다")
    void 테스트_모드() {
        // given
        given(subscriberRepository.findActiveEmails()).willReturn(emails(8));
        String html = "<p>" + "a".repeat(600) + "</p>";

        // when
        SendNewsletterResponse response = useCase.execute(
                new SendNewsletterRequest("Harvest news", html, null, null, true));

        // then
        assertThat(response.message()).isEqualTo("Test mode - newsletter not sent");
        assertThat(response.recipientCount()).isEqualTo(8);
        assertThat(response.testRecipients()).hasSize(5).first().isEqualTo("user0@farmshare.ng");
        assertThat(response.htmlPreview()).hasSize(503).endsWith("...");
        verify(campaignRepository, never()).save(any());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    @DisplayName("실제 발송은 캠페인을 저장하고 50명 단위 배치 이벤트를 발행한다")
    void 배치_발송() {
        // given
        given(subscriberRepository.findActiveEmailsByAnyTag(List.of("farmers"))).willReturn(emails(120));
        given(campaignRepository.save(any(NewsletterCampaign.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        SendNewsletterResponse response = useCase.execute(
                new SendNewsletterRequest("Harvest news", "<p>hi</p>", "hi", List.of("farmers"), false));

        // then
        assertThat(response.message()).isEqualTo("Newsletter queued for delivery");
        assertThat(response.totalRecipients()).isEqualTo(120);
        assertThat(response.batchCount()).isEqualTo(3);

        ArgumentCaptor<NewsletterCampaign> campaignCaptor = ArgumentCaptor.forClass(NewsletterCampaign.class);
        verify(campaignRepository).save(campaignCaptor.capture());
        assertThat(campaignCaptor.getValue().getStatus()).isEqualTo(CampaignStatus.QUEUED);
        assertThat(campaignCaptor.getValue().getTargetTagList()).containsExactly("farmers");

        ArgumentCaptor<NewsletterCampaignQueuedEvent> eventCaptor =
                ArgumentCaptor.forClass(NewsletterCampaignQueuedEvent.class);
        verify(eventPublisher).publishEvent(eventCaptor.capture());
        assertThat(eventCaptor.getValue().batches())
                .extracting(List::size)
                .containsExactly(50, 50, 20);
    }

    @Test
    @DisplayName("수신자가 없으면 캠페인은 바로 COMPLETED이고 이벤트는 발행하지 않는다")
    void 수신자_없음() {
        given(subscriberRepository.findActiveEmails()).willReturn(List.of());
        given(campaignRepository.save(any(NewsletterCampaign.class))).willAnswer(invocation -> invocation.getArgument(0));

        SendNewsletterResponse response = useCase.execute(
                new SendNewsletterRequest("Harvest news", "<p>hi</p>", null, List.of(), false));

        assertThat(response.batchCount()).isZero();
        ArgumentCaptor<NewsletterCampaign> captor = ArgumentCaptor.forClass(NewsletterCampaign.class);
        verify(campaignRepository).save(captor.capture());
        assertThat(captor.getValue().getStatus()).isEqualTo(CampaignStatus.COMPLETED);
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    private static List<String> emails(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> "user" + i + "@farmshare.ng")
                .collect(Collectors.toList());
    }
}
