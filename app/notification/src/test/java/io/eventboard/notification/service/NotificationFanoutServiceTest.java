package io.eventboard.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.eventboard.notification.model.BuiltNotification;
import io.eventboard.notification.model.ChangeAction;
import io.eventboard.notification.model.ChangeEnvelope;
import io.eventboard.notification.model.NotificationRecord;
import io.eventboard.notification.model.NotificationType;
import io.eventboard.notification.model.NotificationView;
import io.eventboard.notification.websocket.ConnectionManager;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class NotificationFanoutServiceTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
  private static final UUID NOTIFICATION_ID = UUID.randomUUID();

  @Mock private NotificationBuilder builder;
  @Mock private NotificationStore store;
  @Mock private RecipientPolicy recipientPolicy;
  @Mock private ConnectionManager connectionManager;
  @Mock private NotificationMetrics metrics;
  @Mock private PlatformTransactionManager transactionManager;

  @Captor private ArgumentCaptor<NotificationView> viewCaptor;

  private NotificationFanoutService service;
  private ChangeEnvelope envelope;
  private BuiltNotification built;

  @BeforeEach
  void setUp() {
    service =
        new NotificationFanoutService(
            builder,
            store,
            recipientPolicy,
            connectionManager,
            metrics,
            transactionManager,
            Clock.fixed(NOW, ZoneOffset.UTC));
    envelope =
        new ChangeEnvelope(
            "evt-1", ChangeAction.UPDATED, new ObjectMapper().createObjectNode(), "msg-1");
    built =
        new BuiltNotification(
            new NotificationRecord(
                NOTIFICATION_ID,
                NotificationType.EVENT_UPDATED,
                "evt-1",
                null,
                "{}",
                "msg-1",
                NOW),
            Set.of("u1", "u2", "offline"));
    when(builder.build(envelope)).thenReturn(built);
  }

  @Test
  void persistsBeforeDispatchAndRecordsOnlyReachedUsers() {
    when(connectionManager.dispatch(any(), eq(built.recipients()))).thenReturn(Set.of("u1", "u2"));
    when(store.recordDelivery(NOTIFICATION_ID, "u1")).thenReturn(true);
    when(store.recordDelivery(NOTIFICATION_ID, "u2")).thenReturn(false);

    final FanoutResult result = service.handle(envelope);

    final InOrder order = inOrder(store, recipientPolicy, connectionManager);
    order.verify(store).insert(built);
    order.verify(recipientPolicy).remember(envelope);
    order.verify(connectionManager).dispatch(viewCaptor.capture(), eq(built.recipients()));
    verify(store, never()).recordDelivery(NOTIFICATION_ID, "offline");
    assertThat(viewCaptor.getValue().deliveredTo()).isEmpty();
    assertThat(result).isEqualTo(new FanoutResult(NOTIFICATION_ID, 3, 1));
    verify(metrics).recordDispatched(eq(1), any());
  }

  @Test
  void nothingIsSentWhenPersistenceFails() {
    doThrow(new DataAccessResourceFailureException("db down")).when(store).insert(built);

    assertThatThrownBy(() -> service.handle(envelope))
        .isInstanceOf(DataAccessResourceFailureException.class);

    verify(connectionManager, never()).dispatch(any(), any());
    verify(recipientPolicy, never()).remember(any());
    verify(metrics, never()).recordDispatched(anyInt(), any());
  }

  @Test
  void duplicateIsPropagatedWithoutDispatch() {
    doThrow(new DuplicateNotificationException(NOTIFICATION_ID, null)).when(store).insert(built);

    assertThatThrownBy(() -> service.handle(envelope))
        .isInstanceOf(DuplicateNotificationException.class);

    verify(connectionManager, never()).dispatch(any(), any());
  }

  @Test
  void failedDeliveryRecordDoesNotFailTheMessage() {
    when(connectionManager.dispatch(any(), any())).thenReturn(Set.of("u1"));
    when(store.recordDelivery(NOTIFICATION_ID, "u1"))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    final FanoutResult result = service.handle(envelope);

    assertThat(result.delivered()).isZero();
    verify(metrics).recordDispatched(eq(0), any());
  }
}
