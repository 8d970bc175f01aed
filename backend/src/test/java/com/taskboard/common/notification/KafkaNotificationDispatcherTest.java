package com.taskboard.common.notification;

import com.taskboard.config.KafkaConfig;
import com.taskboard.config.TaskboardProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("KafkaNotificationDispatcher 단위 테스트")
class KafkaNotificationDispatcherTest {

    @Mock
    private KafkaTemplate<String, OutboundNotification> kafkaTemplate;

    @Mock
    private SendResult<String, OutboundNotification> sendResult;

    private SimpleMeterRegistry meterRegistry;
    private KafkaNotificationDispatcher dispatcher;

    private OutboundNotification notification;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new KafkaNotificationDispatcher(kafkaTemplate, meterRegistry, new TaskboardProperties());

        notification = OutboundNotification.builder()
                .kind(NotificationKind.WORKSPACE_INVITATION)
                .recipientEmail("invitee@example.com")
                .workspaceId(1L)
                .attributes(Map.of("workspaceName", "Team"))
                .build();
    }

    private CompletableFuture<SendResult<String, OutboundNotification>> sent() {
        return CompletableFuture.completedFuture(sendResult);
    }

    private CompletableFuture<SendResult<String, OutboundNotification>> failed() {
        return CompletableFuture.failedFuture(new IllegalStateException("broker unavailable"));
    }

    @Test
    @DisplayName("Kafka 전송에 성공하면 QUEUED를 반환한다")
    void dispatch_Queued() {
        // given
        when(kafkaTemplate.send(KafkaConfig.NOTIFICATIONS_TOPIC, "invitee@example.com", notification))
                .thenReturn(sent());

        // when
        DispatchResult result = dispatcher.dispatch(notification);

        // then
        assertThat(result).isEqualTo(DispatchResult.QUEUED);
        assertThat(dispatcher.pendingCount()).isZero();
        assertThat(meterRegistry.counter("taskboard.notifications.queued", "kind", "WORKSPACE_INVITATION").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Kafka 전송이 실패하면 대체 큐에 넣고 PENDING을 반환한다")
    void dispatch_FallbackOnFailure() {
        // given
        when(kafkaTemplate.send(anyString(), anyString(), any(OutboundNotification.class))).thenReturn(failed());

        // when
        DispatchResult result = dispatcher.dispatch(notification);

        // then
        assertThat(result).isEqualTo(DispatchResult.PENDING);
        assertThat(dispatcher.pendingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("재시도에 성공하면 대체 큐가 비워진다")
    void retryFallbackQueue_Drains() {
        // given
        when(kafkaTemplate.send(anyString(), anyString(), any(OutboundNotification.class)))
                .thenReturn(failed(), sent());
        dispatcher.dispatch(notification);

        // when
        dispatcher.retryFallbackQueue();

        // then
        assertThat(dispatcher.pendingCount()).isZero();
        verify(kafkaTemplate, times(2)).send(eq(KafkaConfig.NOTIFICATIONS_TOPIC), anyString(), eq(notification));
        assertThat(meterRegistry.counter("taskboard.notifications.fallback.success").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("재시도가 실패하면 알림을 다시 큐에 넣고 중단한다")
    void retryFallbackQueue_StopsOnFailure() {
        // given
        when(kafkaTemplate.send(anyString(), anyString(), any(OutboundNotification.class))).thenReturn(failed());
        dispatcher.dispatch(notification);

        // when
        dispatcher.retryFallbackQueue();

        // then
        assertThat(dispatcher.pendingCount()).isEqualTo(1);
        verify(kafkaTemplate, times(2)).send(anyString(), anyString(), any(OutboundNotification.class));
    }

    @Test
    @DisplayName("대체 큐가 비어 있으면 아무것도 전송하지 않는다")
    void retryFallbackQueue_Empty() {
        // when
        dispatcher.retryFallbackQueue();

        // then
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    @DisplayName("전송 대기 중 인터럽트되면 인터럽트 상태를 복원하고 대체 큐에 넣는다")
    @SuppressWarnings("unchecked")
    void dispatch_InterruptedKeepsFlag() throws Exception {
        // given
        CompletableFuture<SendResult<String, OutboundNotification>> interrupted = mock(CompletableFuture.class);
        when(interrupted.get(anyLong(), any(TimeUnit.class))).thenThrow(new InterruptedException());
        when(kafkaTemplate.send(KafkaConfig.NOTIFICATIONS_TOPIC, "invitee@example.com", notification))
                .thenReturn(interrupted);

        // when
        DispatchResult result = dispatcher.dispatch(notification);

        // then
        assertThat(Thread.interrupted()).isTrue();
        assertThat(result).isEqualTo(DispatchResult.PENDING);
        assertThat(dispatcher.pendingCount()).isEqualTo(1);
    }
}
