package io.eventboard.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventboard.notification.model.BuiltNotification;
import io.eventboard.notification.model.ChangeAction;
import io.eventboard.notification.model.ChangeEnvelope;
import io.eventboard.notification.model.NotificationType;
import io.eventboard.notification.websocket.ConnectionDirectory;
import io.eventboard.notification.websocket.SubscriptionRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationBuilderTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  @Mock private ConnectionDirectory connectionDirectory;
  @Mock private RecipientPolicy recipientPolicy;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final SubscriptionRegistry registry = new SubscriptionRegistry();
  private NotificationBuilder builder;

  @BeforeEach
  void setUp() {
    builder =
        new NotificationBuilder(
            registry,
            connectionDirectory,
            recipientPolicy,
            objectMapper,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void recipientsAreSubscribersUnionInterestedParties() {
    registry.subscribe("c1", "evt-1");
    registry.subscribe("c2", "evt-1");
    registry.subscribe("c3", "evt-2");
    when(connectionDirectory.userIdsOf(Set.of("c1", "c2"))).thenReturn(Set.of("u1", "u2"));
    when(recipientPolicy.interestedParties(any())).thenReturn(Set.of("u2", "owner"));

    final BuiltNotification built = builder.build(envelope(ChangeAction.UPDATED, "msg-1"));

    assertThat(built.recipients()).containsExactlyInAnyOrder("u1", "u2", "owner");
  }

  @Test
  void recordCarriesTypeTopicActorAndContent() {
    when(connectionDirectory.userIdsOf(Set.of())).thenReturn(Set.of());
    when(recipientPolicy.interestedParties(any())).thenReturn(Set.of());

    final BuiltNotification built = builder.build(envelope(ChangeAction.DELETED, "msg-1"));

    assertThat(built.notification().type()).isEqualTo(NotificationType.EVENT_DELETED);
    assertThat(built.notification().ownerTopic()).isEqualTo("evt-1");
    assertThat(built.notification().actorUserId()).isEqualTo("u9");
    assertThat(built.notification().createdAt()).isEqualTo(NOW);
    assertThat(built.notification().messageId()).isEqualTo("msg-1");
    assertThat(built.notification().contentJson()).contains("\"title\":\"Launch\"");
    assertThat(built.recipients()).isEmpty();
  }

  @Test
  void notificationIdIsDerivedFromMessageId() {
    when(connectionDirectory.userIdsOf(Set.of())).thenReturn(Set.of());
    when(recipientPolicy.interestedParties(any())).thenReturn(Set.of());

    final BuiltNotification first = builder.build(envelope(ChangeAction.CREATED, "msg-1"));
    final BuiltNotification redelivered = builder.build(envelope(ChangeAction.CREATED, "msg-1"));
    final BuiltNotification other = builder.build(envelope(ChangeAction.CREATED, "msg-2"));

    assertThat(redelivered.notification().notificationId())
        .isEqualTo(first.notification().notificationId());
    assertThat(other.notification().notificationId())
        .isNotEqualTo(first.notification().notificationId());
  }

  private ChangeEnvelope envelope(ChangeAction action, String messageId) {
    final ObjectNode data = objectMapper.createObjectNode();
    data.put("id", "evt-1");
    data.put("title", "Launch");
    data.put("actor_user_id", "u9");
    return new ChangeEnvelope("evt-1", action, data, messageId);
  }
}
