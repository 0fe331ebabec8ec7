package com.gotable.notification;

import com.gotable.menu.entity.Menu;
import com.gotable.reservation.entity.Reservation;
import com.gotable.support.TestFixtures;
import feign.FeignException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SlackReservationNotifierTest {

    private static final String WEBHOOK = "https://hooks.slack.com/services/T000/B000/XXXX";

    @Mock
    private SlackWebhookClient slackWebhookClient;

    private SlackReservationNotifier notifier;

    private Reservation reservation;

    @BeforeEach
    void setUp() {
        notifier = new SlackReservationNotifier(slackWebhookClient, new SlackProperties(true, WEBHOOK));

        Menu ramen = TestFixtures.menu(1L, "Signature Ramen", 850, true);
        reservation = TestFixtures.paidReservation(10L, TestFixtures.user(1L), "pi_ok", 1700L);
        reservation.addItem(ramen, 2);
    }

    @Test
    @DisplayName("확정 알림 - 예약 정보와 메뉴 목록을 Block Kit으로 전송")
    void reservationConfirmed_SendsBlocks() {
        notifier.reservationConfirmed(reservation);

        ArgumentCaptor<SlackMessage> message = ArgumentCaptor.forClass(SlackMessage.class);
        verify(slackWebhookClient).send(eq(URI.create(WEBHOOK)), message.capture());

        assertThat(message.getValue().text())
                .contains("New reservation confirmed")
                .contains("#10")
                .contains("2026-12-24 18:30");
        assertThat(message.getValue().blocks()).hasSize(3);
        assertThat(message.getValue().blocks().get(2).toString()).contains("- Signature Ramen × 2 (¥1,700)");
    }

    @Test
    @DisplayName("취소 알림에는 메뉴 목록이 없음")
    void reservationCancelled_OmitsMenus() {
        notifier.reservationCancelled(reservation);

        ArgumentCaptor<SlackMessage> message = ArgumentCaptor.forClass(SlackMessage.class);
        verify(slackWebhookClient).send(any(URI.class), message.capture());

        assertThat(message.getValue().text()).startsWith("Reservation cancelled");
        assertThat(message.getValue().blocks()).hasSize(2);
    }

    @Test
    @DisplayName("비활성화 또는 URL 미설정이면 전송하지 않음")
    void skippedWhenInactive() {
        new SlackReservationNotifier(slackWebhookClient, new SlackProperties(false, WEBHOOK))
                .reservationConfirmed(reservation);
        new SlackReservationNotifier(slackWebhookClient, new SlackProperties(true, " "))
                .reservationConfirmed(reservation);

        verifyNoInteractions(slackWebhookClient);
    }

    @Test
    @DisplayName("전송 실패는 호출자에게 전파")
    void sendFailurePropagates() {
        willThrow(mock(FeignException.class)).given(slackWebhookClient).send(any(URI.class), any(SlackMessage.class));

        assertThatThrownBy(() -> notifier.reservationConfirmed(reservation))
                .isInstanceOf(FeignException.class);
    }
}
