package io.eventboard.notification.service;

import io.eventboard.notification.model.ChangeEnvelope;
import java.util.Set;

/**
 * Decides who receives a notification beyond the live subscribers of its topic.
 *
 * <p>{@link #interestedParties} must not change any state; it runs while the notification is being
 * built. {@link #remember} runs inside the transaction that persists the notification.
 */
public interface RecipientPolicy {

  Set<String> interestedParties(ChangeEnvelope envelope);

  default void remember(ChangeEnvelope envelope) {}
}
