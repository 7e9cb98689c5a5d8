package io.b2mash.teamboard.event;

import io.b2mash.teamboard.notification.NotificationKind;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/** Request to notify {@code recipients} about something that happened to a task. */
public record TaskNotificationEvent(
    NotificationKind kind,
    UUID entityId,
    UUID actorMemberId,
    Set<UUID> recipients,
    Map<String, Object> details,
    Instant occurredAt)
    implements DomainEvent {

  public TaskNotificationEvent {
    recipients = Set.copyOf(recipients);
    details = Map.copyOf(details);
  }

  @Override
  public String eventType() {
    return "task." + kind.name().toLowerCase();
  }

  @Override
  public String entityType() {
    return "TASK";
  }
}
