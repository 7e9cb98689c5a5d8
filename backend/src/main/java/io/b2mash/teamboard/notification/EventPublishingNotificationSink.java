package io.b2mash.teamboard.notification;

import io.b2mash.teamboard.event.TaskNotificationEvent;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes a {@link TaskNotificationEvent}; rows are written by {@link NotificationEventHandler}
 * once the surrounding transaction has committed.
 */
@Component
public class EventPublishingNotificationSink implements NotificationSink {

  private static final Logger log = LoggerFactory.getLogger(EventPublishingNotificationSink.class);

  private final ApplicationEventPublisher eventPublisher;

  public EventPublishingNotificationSink(ApplicationEventPublisher eventPublisher) {
    this.eventPublisher = eventPublisher;
  }

  @Override
  public void notify(
      Set<UUID> recipients,
      NotificationKind kind,
      UUID taskId,
      UUID actorMemberId,
      Map<String, Object> payload) {
    Set<UUID> targets =
        recipients.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
    if (targets.isEmpty()) {
      return;
    }
    try {
      // Events carry no null values
      var details = new HashMap<String, Object>();
      payload.forEach(
          (key, value) -> {
            if (value != null) {
              details.put(key, value);
            }
          });
      eventPublisher.publishEvent(
          new TaskNotificationEvent(kind, taskId, actorMemberId, targets, details, Instant.now()));
    } catch (RuntimeException e) {
      log.warn("Failed to publish {} notification for task {}", kind, taskId, e);
    }
  }
}
