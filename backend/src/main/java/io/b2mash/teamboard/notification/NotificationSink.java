package io.b2mash.teamboard.notification;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Fire-and-forget fan-out of task events to members. Implementations must never throw: a lost
 * notification is acceptable, a failed state change caused by one is not.
 *
 * <p>The actor is passed separately so that the delivery side can leave them out of the recipients.
 * Recognised payload keys are declared on {@link NotificationPayload}.
 */
public interface NotificationSink {

  void notify(
      Set<UUID> recipients,
      NotificationKind kind,
      UUID taskId,
      UUID actorMemberId,
      Map<String, Object> payload);
}
