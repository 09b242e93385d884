package com.sparta.farmshare.application.payout;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.farmshare.application.payout.service.PayoutService;
import com.sparta.farmshare.domain.payout.entity.Payout;
import com.sparta.farmshare.domain.payout.entity.PayoutStatus;
import com.sparta.farmshare.domain.payout.repository.PayoutRepository;
import com.sparta.farmshare.domain.user.entity.Role;
import com.sparta.farmshare.domain.user.entity.User;
import com.sparta.farmshare.infrastructure.external.paystack.PaystackClient;
import com.sparta.farmshare.infrastructure.external.paystack.dto.TransferData;
import com.sparta.farmshare.infrastructure.external.paystack.dto.TransferRecipient;
import com.sparta.farmshare.infrastructure.outbox.entity.OutboxEvent;
import com.sparta.farmshare.infrastructure.outbox.repository.OutboxEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("정산 서비스 테스트")
class PayoutServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private PaystackClient paystackClient;

    @Mock
    private PayoutRepository payoutRepository;

    @Mock
    private OutboxEventRepository outboxEventRepository;

    private PayoutService payoutService;

    @BeforeEach
    void setUp() {
        payoutService = new PayoutService(paystackClient, payoutRepository, outboxEventRepository,
                new ObjectMapper().findAndRegisterModules(), CLOCK);
    }

    @Test
    @DisplayName("수취인이 없으면 등록 후 실지급액으로 이체를 요청한다")
    void 수취인_등록_후_이체() {
        // given
        User vendor = vendor(null);
        Payout payout = Payout.create(vendor.getUserId(), "fs_ref_1", 50_000, null, "admin-1");
        given(paystackClient.createTransferRecipient("ADA OBI", "0123456789", "058"))
                .willReturn(new TransferRecipient("RCP_1", "ADA OBI", "nuban"));
        given(paystackClient.initiateTransfer("RCP_1", 49_000, "fs_ref_1", null))
                .willReturn(new TransferData("fs_ref_1", "TRF_1", "pending", 4_900_000L, null));

        // when
        payoutService.requestTransfer(payout, vendor);

        // then
        assertThat(vendor.getPaystackRecipientCode()).isEqualTo("RCP_1");
        assertThat(payout.getRecipientCode()).isEqualTo("RCP_1");
        assertThat(payout.getTransferCode()).isEqualTo("TRF_1");
        assertThat(payout.getStatus()).isEqualTo(PayoutStatus.PROCESSING);
    }

    @Test
    @DisplayName("저장된 수취인 코드가 있으면 재등록하지 않는다")
    void 기존_수취인_재사용() {
        // given
        User vendor = vendor("RCP_SAVED");
        Payout payout = Payout.create(vendor.getUserId(), "fs_ref_1", 10_000, "March sales", "admin-1");
        given(paystackClient.initiateTransfer("RCP_SAVED", 9_800, "fs_ref_1", "March sales"))
                .willReturn(new TransferData("fs_ref_1", "TRF_1", "success", 980_000L, null));

        // when
        payoutService.requestTransfer(payout, vendor);

        // then
        verify(paystackClient, never()).createTransferRecipient(anyString(), anyString(), anyString());
        assertThat(payout.getStatus()).isEqualTo(PayoutStatus.COMPLETED);
    }

    @Test
    @DisplayName("Paystack 호출이 실패하면 예외 대신 FAILED로 남긴다")
    void 이체_실패() {
        // given
        User vendor = vendor("RCP_SAVED");
        Payout payout = Payout.create(vendor.getUserId(), "fs_ref_1", 10_000, null, "admin-1");
        given(paystackClient.initiateTransfer(anyString(), anyLong(), anyString(), any()))
                .willThrow(new ResourceAccessException("Connection reset"));

        // when
        payoutService.requestTransfer(payout, vendor);

        // then
        assertThat(payout.getStatus()).isEqualTo(PayoutStatus.FAILED);
        assertThat(payout.getFailureReason()).isEqualTo("Connection reset");
    }

    @Test
    @DisplayName("상태가 바뀐 경우에만 Outbox 이벤트를 남긴다")
    void 조회_결과_반영() {
        // given
        Payout payout = Payout.create("vendor-1", "fs_ref_1", 10_000, null, "admin-1");
        payout.applyProviderStatus("pending", "TRF_1", null);

        // when
        boolean unchanged = payoutService.reconcile(payout,
                new TransferData("fs_ref_1", "TRF_1", "pending", null, null));
        boolean changed = payoutService.reconcile(payout,
                new TransferData("fs_ref_1", "TRF_1", "success", null, null));

        // then
        assertThat(unchanged).isFalse();
        assertThat(changed).isTrue();

        ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxEventRepository).save(captor.capture());
        assertThat(captor.getValue().getAggregateType()).isEqualTo("PAYOUT");
        assertThat(captor.getValue().getAggregateId()).isEqualTo("fs_ref_1");
        assertThat(captor.getValue().getEventType()).isEqualTo("PAYOUT_COMPLETED");
        assertThat(captor.getValue().getPayload()).contains("\"reference\":\"fs_ref_1\"");
    }

    @Test
    @DisplayName("transfer.reversed 웹훅은 사유와 함께 REVERSED로 반영된다")
    void 웹훅_반영() {
        // given
        Payout payout = Payout.create("vendor-1", "fs_ref_1", 10_000, null, "admin-1");
        payout.markCompleted(null);
        given(payoutRepository.findByReference("fs_ref_1")).willReturn(Optional.of(payout));

        // when
        payoutService.applyTransferWebhook("fs_ref_1", PayoutStatus.REVERSED, "Account closed");

        // then
        assertThat(payout.getStatus()).isEqualTo(PayoutStatus.REVERSED);
        assertThat(payout.getFailureReason()).isEqualTo("Account closed");
        verify(outboxEventRepository).save(any(OutboxEvent.class));
    }

    @Test
    @DisplayName("REVERSED 이후 늦게 도착한 transfer.success 웹훅은 반영하지 않고 이벤트도 남기지 않는다")
    void 웹훅_순서_역전() {
        // given
        Payout payout = Payout.create("vendor-1", "fs_ref_1", 10_000, null, "admin-1");
        payout.applyProviderStatus("success", "TRF_1", null);
        payout.markReversed("Account closed", null);
        given(payoutRepository.findByReference("fs_ref_1")).willReturn(Optional.of(payout));

        // when
        payoutService.applyTransferWebhook("fs_ref_1", PayoutStatus.COMPLETED, null);

        // then
        assertThat(payout.getStatus()).isEqualTo(PayoutStatus.REVERSED);
        verify(outboxEventRepository, never()).save(any());
    }

    @Test
    @DisplayName("완료된 정산에 pending 조회 결과가 와도 상태와 이벤트가 바뀌지 않는다")
    void 조회_결과_최종상태_유지() {
        // given
        Payout payout = Payout.create("vendor-1", "fs_ref_1", 10_000, null, "admin-1");
        payout.markCompleted(null);

        // when
        boolean changed = payoutService.reconcile(payout,
                new TransferData("fs_ref_1", "TRF_1", "pending", null, null));

        // then
        assertThat(changed).isFalse();
        assertThat(payout.getStatus()).isEqualTo(PayoutStatus.COMPLETED);
        verify(outboxEventRepository, never()).save(any());
    }

    @Test
    @DisplayName("모르는 reference의 웹훅은 무시한다")
    void 웹훅_알수없는_reference() {
        given(payoutRepository.findByReference("unknown")).willReturn(Optional.empty());

        payoutService.applyTransferWebhook("unknown", PayoutStatus.COMPLETED, null);

        verify(outboxEventRepository, never()).save(any());
    }

    private User vendor(String recipientCode) {
        User vendor = User.builder()
                .userId("vendor-1")
                .email("vendor@farmshare.ng")
                .name("Ada")
                .role(Role.VENDOR)
                .verified(true)
                .build();
        vendor.registerBankAccount("0123456789", "058", "ADA OBI");
        if (recipientCode != null) {
            vendor.assignRecipientCode(recipientCode);
        }
        return vendor;
    }
}
