/*
 * どこで: Notification WebSocket 層
 * 何を: トピック -> 接続 の購読表と、その逆引き (接続 -> トピック) を保持する
 * なぜ: 切断時に接続の購読をまとめて外し、配信時に購読者をロックなしで引くため
 */
package io.eventboard.notification.websocket;

import com.google.common.annotations.VisibleForTesting;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/** In-memory topic subscriptions. Every operation is idempotent and accepts unknown ids. */
@Component
public class SubscriptionRegistry {

  private final ConcurrentMap<String, Set<String>> subscribersByTopic = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Set<String>> topicsByConnection = new ConcurrentHashMap<>();

  public void subscribe(String connectionId, String topic) {
    subscribersByTopic.compute(topic, (key, subscribers) -> add(subscribers, connectionId));
    topicsByConnection.compute(connectionId, (key, topics) -> add(topics, topic));
  }

  public void unsubscribe(String connectionId, String topic) {
    subscribersByTopic.computeIfPresent(
        topic, (key, subscribers) -> remove(subscribers, connectionId));
    topicsByConnection.computeIfPresent(connectionId, (key, topics) -> remove(topics, topic));
  }

  /** Snapshot; later changes to the registry are not reflected in the returned set. */
  public Set<String> subscribersOf(String topic) {
    final Set<String> subscribers = subscribersByTopic.get(topic);
    return subscribers == null ? Set.of() : Set.copyOf(subscribers);
  }

  public Set<String> topicsOf(String connectionId) {
    final Set<String> topics = topicsByConnection.get(connectionId);
    return topics == null ? Set.of() : Set.copyOf(topics);
  }

  public void dropConnection(String connectionId) {
    final Set<String> topics = topicsByConnection.remove(connectionId);
    if (topics == null) {
      return;
    }
    for (String topic : topics) {
      subscribersByTopic.computeIfPresent(
          topic, (key, subscribers) -> remove(subscribers, connectionId));
    }
  }

  private static Set<String> add(Set<String> current, String value) {
    final Set<String> target = current == null ? ConcurrentHashMap.newKeySet() : current;
    target.add(value);
    return target;
  }

  // 空になったキーは null を返してマップから外す
  private static Set<String> remove(Set<String> current, String value) {
    current.remove(value);
    return current.isEmpty() ? null : current;
  }

  @VisibleForTesting
  int topicCount() {
    return subscribersByTopic.size();
  }
}
