package io.b2mash.teamboard.notification;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.teamboard.event.TaskNotificationEvent;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationEventHandlerTest {

  @Mock private NotificationService notificationService;
  @InjectMocks private NotificationEventHandler handler;

  private final TaskNotificationEvent event =
      new TaskNotificationEvent(
          NotificationKind.STATUS_CHANGE,
          UUID.randomUUID(),
          UUID.randomUUID(),
          Set.of(UUID.randomUUID()),
          Map.of(NotificationPayload.TO_STATUS, "DONE"),
          Instant.now());

  @Test
  void onTaskNotification_delegatesToService() {
    handler.onTaskNotification(event);

    verify(notificationService).handleTaskNotification(event);
  }

  @Test
  void onTaskNotification_logsFailureWithoutPropagating() {
    when(notificationService.handleTaskNotification(event))
        .thenThrow(new IllegalStateException("db down"));

    assertThatCode(() -> handler.onTaskNotification(event)).doesNotThrowAnyException();
  }
}
