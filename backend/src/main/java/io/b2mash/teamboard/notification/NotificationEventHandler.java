package io.b2mash.teamboard.notification;

import io.b2mash.teamboard.event.TaskNotificationEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Materialises task notifications once the transaction that requested them has committed. Runs
 * AFTER_COMMIT in a new transaction, so:
 *
 * <ol>
 *   <li>notifications only exist for committed task changes;
 *   <li>a failure here never rolls back or blocks the task change.
 * </ol>
 */
@Component
public class NotificationEventHandler {

  private static final Logger log = LoggerFactory.getLogger(NotificationEventHandler.class);

  private final NotificationService notificationService;

  public NotificationEventHandler(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onTaskNotification(TaskNotificationEvent event) {
    try {
      notificationService.handleTaskNotification(event);
    } catch (Exception e) {
      log.warn(
          "Failed to create notifications for {} event={}", event.eventType(), event.entityId(), e);
    }
  }
}
