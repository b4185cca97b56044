package io.eventboard.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.eventboard.notification.config.NotificationRecipientProperties;
import io.eventboard.notification.model.ChangeAction;
import io.eventboard.notification.model.ChangeEnvelope;
import io.eventboard.notification.nats.ChangeEnvelopeDecoder;
import io.eventboard.notification.repository.TopicOwnerRepository;
import io.eventboard.notification.websocket.ConnectionDirectory;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EventCreatorRecipientPolicyTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @Mock private TopicOwnerRepository topicOwnerRepository;
  @Mock private ConnectionDirectory connectionDirectory;

  @Test
  void includesCreatorAndStoredOwners() {
    when(topicOwnerRepository.findOwners("evt-1")).thenReturn(Set.of("owner"));

    final Set<String> parties = policy(false).interestedParties(envelope(ChangeAction.UPDATED, "u1"));

    assertThat(parties).containsExactlyInAnyOrder("u1", "owner");
    verify(connectionDirectory, never()).onlineUserIds();
  }

  @Test
  void storedOwnerIsUsedWhenPayloadLacksCreator() {
    when(topicOwnerRepository.findOwners("evt-1")).thenReturn(Set.of("owner"));

    assertThat(policy(false).interestedParties(envelope(ChangeAction.DELETED, null)))
        .containsExactly("owner");
  }

  @Test
  void broadcastsCreatedToOnlineUsersWhenEnabled() {
    when(topicOwnerRepository.findOwners("evt-1")).thenReturn(Set.of());
    when(connectionDirectory.onlineUserIds()).thenReturn(Set.of("a", "b"));

    assertThat(policy(true).interestedParties(envelope(ChangeAction.CREATED, "u1")))
        .containsExactlyInAnyOrder("u1", "a", "b");
  }

  @Test
  void broadcastAppliesOnlyToCreated() {
    when(topicOwnerRepository.findOwners("evt-1")).thenReturn(Set.of());

    assertThat(policy(true).interestedParties(envelope(ChangeAction.UPDATED, "u1")))
        .containsExactly("u1");
    verify(connectionDirectory, never()).onlineUserIds();
  }

  @Test
  void rememberStoresCreatorAsTopicOwner() {
    policy(false).remember(envelope(ChangeAction.CREATED, "u1"));

    verify(topicOwnerRepository).register("evt-1", "u1", NOW);
  }

  @Test
  void rememberWithoutCreatorRefreshesExistingOwners() {
    policy(false).remember(envelope(ChangeAction.UPDATED, null));

    verify(topicOwnerRepository, never()).register(any(), any(), any());
    verify(topicOwnerRepository).touch("evt-1", NOW);
  }

  @Test
  void legacyCreatedEnvelopeRegistersPublishingUserAsCreator() {
    final ChangeEnvelope envelope =
        new ChangeEnvelopeDecoder(OBJECT_MAPPER)
            .decode(
                """
                {"type":"notification","notification_type":"event.created",
                 "event":{"id":"evt-1","title":"Launch","action":"created",
                          "timestamp":"2024-01-01T00:00:00Z"},
                 "user":"alice"}
                """
                    .getBytes(StandardCharsets.UTF_8),
                "events:7")
            .envelope();
    when(topicOwnerRepository.findOwners("evt-1")).thenReturn(Set.of());

    final EventCreatorRecipientPolicy policy = policy(false);

    assertThat(policy.interestedParties(envelope)).containsExactly("alice");
    policy.remember(envelope);
    verify(topicOwnerRepository).register("evt-1", "alice", NOW);
  }

  private EventCreatorRecipientPolicy policy(boolean broadcastCreated) {
    return new EventCreatorRecipientPolicy(
        topicOwnerRepository,
        connectionDirectory,
        new NotificationRecipientProperties(broadcastCreated),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static ChangeEnvelope envelope(ChangeAction action, String createdBy) {
    final ObjectNode data = OBJECT_MAPPER.createObjectNode();
    data.put("id", "evt-1");
    if (createdBy != null) {
      data.put("created_by", createdBy);
    }
    return new ChangeEnvelope("evt-1", action, data, "msg-1");
  }
}
