package io.b2mash.teamboard.notification;

import io.b2mash.teamboard.event.TaskNotificationEvent;
import io.b2mash.teamboard.exception.ResourceNotFoundException;
import io.b2mash.teamboard.member.MemberNameResolver;
import io.b2mash.teamboard.task.Task;
import io.b2mash.teamboard.task.TaskRepository;
import io.b2mash.teamboard.task.TaskStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class NotificationService {

  private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

  private final NotificationRepository notificationRepository;
  private final TaskRepository taskRepository;
  private final MemberNameResolver memberNameResolver;
  private final MemberMentionScanner mentionScanner;
  private final NotificationProperties properties;

  public NotificationService(
      NotificationRepository notificationRepository,
      TaskRepository taskRepository,
      MemberNameResolver memberNameResolver,
      MemberMentionScanner mentionScanner,
      NotificationProperties properties) {
    this.notificationRepository = notificationRepository;
    this.taskRepository = taskRepository;
    this.memberNameResolver = memberNameResolver;
    this.mentionScanner = mentionScanner;
    this.properties = properties;
  }

  @Transactional(readOnly = true)
  public Page<Notification> listNotifications(
      UUID memberId, boolean unreadOnly, Pageable pageable) {
    if (unreadOnly) {
      return notificationRepository.findUnreadByRecipientMemberId(memberId, pageable);
    }
    return notificationRepository.findByRecipientMemberId(memberId, pageable);
  }

  @Transactional(readOnly = true)
  public long getUnreadCount(UUID memberId) {
    return notificationRepository.countUnreadByRecipientMemberId(memberId);
  }

  @Transactional(readOnly = true)
  public Notification getNotification(UUID notificationId, UUID memberId) {
    return notificationRepository
        .findByIdAndRecipientMemberId(notificationId, memberId)
        .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
  }

  @Transactional
  public void markAsRead(UUID notificationId, UUID memberId) {
    var notification =
        notificationRepository
            .findByIdAndRecipientMemberId(notificationId, memberId)
            .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
    notification.markAsRead();
  }

  @Transactional
  public int markAllAsRead(UUID memberId) {
    return notificationRepository.markAllAsRead(memberId, Instant.now());
  }

  /** Marks the given notifications read. Ids that belong to someone else are ignored. */
  @Transactional
  public int markAsRead(Collection<UUID> notificationIds, UUID memberId) {
    if (notificationIds.isEmpty()) {
      return 0;
    }
    return notificationRepository.markAsReadByIds(memberId, notificationIds, Instant.now());
  }

  /** Deletes the member's notifications, or only the read ones when {@code readOnly} is set. */
  @Transactional
  public int clearNotifications(UUID memberId, boolean readOnly) {
    int deleted = notificationRepository.deleteForRecipient(memberId, readOnly);
    log.debug("Cleared {} notification(s) for member {}", deleted, memberId);
    return deleted;
  }

  @Transactional
  public void dismissNotification(UUID notificationId, UUID memberId) {
    var notification =
        notificationRepository
            .findByIdAndRecipientMemberId(notificationId, memberId)
            .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
    notificationRepository.delete(notification);
  }

  // --- Fan-out (called by NotificationEventHandler) ---

  /**
   * Writes one notification per recipient of {@code event}. The actor never receives a
   * notification about their own action.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public List<Notification> handleTaskNotification(TaskNotificationEvent event) {
    var taskOpt = taskRepository.findById(event.entityId());
    if (taskOpt.isEmpty()) {
      log.warn("Task not found for {} notification: {}", event.kind(), event.entityId());
      return List.of();
    }
    var task = taskOpt.get();

    var recipients = new ArrayList<>(event.recipients());
    recipients.remove(event.actorMemberId());
    if (recipients.isEmpty()) {
      return List.of();
    }

    UUID actorId = event.actorMemberId();
    String actorName = actorId != null ? memberNameResolver.resolveName(actorId) : null;
    Map<UUID, String> recipientNames =
        event.kind() == NotificationKind.MENTION
            ? memberNameResolver.resolveNames(recipients)
            : Map.of();

    var created = new ArrayList<Notification>();
    for (UUID recipientId : recipients) {
      var text = render(event, task, actorName, recipientNames.get(recipientId));
      created.add(
          notificationRepository.save(
              new Notification(
                  recipientId,
                  event.actorMemberId(),
                  event.kind(),
                  text.title(),
                  text.body(),
                  "TASK",
                  task.getId(),
                  properties.taskLink(task.getId()))));
    }
    log.debug(
        "Created {} {} notifications for task {}", created.size(), event.kind(), task.getId());
    return created;
  }

  private RenderedText render(
      TaskNotificationEvent event, Task task, String actorName, String recipientName) {
    var details = event.details();
    String actor = actorName != null ? actorName : "Someone";
    String taskTitle = task.getTitle();
    String from = statusLabel(details.get(NotificationPayload.FROM_STATUS));
    String to = statusLabel(details.get(NotificationPayload.TO_STATUS));
    String comment = (String) details.get(NotificationPayload.COMMENT);

    return switch (event.kind()) {
      case APPROVAL_REQUEST ->
          new RenderedText(
              "Approval requested: %s".formatted(taskTitle),
              withComment(
                  "%s requests to move \"%s\" from %s to %s. Your approval is needed."
                      .formatted(actor, taskTitle, from, to),
                  comment));
      case APPROVAL_REJECTED ->
          new RenderedText(
              "Status change rejected: %s".formatted(taskTitle),
              withComment(
                  "%s rejected moving \"%s\" to %s.".formatted(actor, taskTitle, to), comment));
      case APPROVAL_CANCELLED ->
          new RenderedText(
              "Approval request withdrawn: %s".formatted(taskTitle),
              "%s withdrew the request to move \"%s\" to %s.".formatted(actor, taskTitle, to));
      case REVIEW_REQUESTED ->
          new RenderedText(
              "Review requested: %s".formatted(taskTitle),
              withComment(
                  "%s moved \"%s\" to %s and requests your review."
                      .formatted(actor, taskTitle, to),
                  comment));
      case STATUS_CHANGE ->
          new RenderedText(
              "Status changed: %s".formatted(taskTitle),
              withComment(
                  "%s changed the status of \"%s\" from %s to %s."
                      .formatted(actor, taskTitle, from, to),
                  comment));
      case MENTION ->
          new RenderedText(
              "%s mentioned you in \"%s\"".formatted(actor, taskTitle),
              mentionScanner.contextFor(
                  (String) details.get(NotificationPayload.TEXT), recipientName));
      case ASSIGNMENT ->
          new RenderedText(
              "Task assigned: %s".formatted(taskTitle),
              "%s assigned \"%s\" to you.".formatted(actor, taskTitle));
      case STAKEHOLDER_ADDED ->
          new RenderedText(
              "Added as stakeholder: %s".formatted(taskTitle),
              "%s added you as %s on \"%s\"."
                  .formatted(
                      actor,
                      String.valueOf(details.getOrDefault(NotificationPayload.ROLE, "stakeholder"))
                          .toLowerCase(),
                      taskTitle));
    };
  }

  private static String statusLabel(Object status) {
    if (status == null) {
      return "-";
    }
    if (status instanceof TaskStatus taskStatus) {
      return taskStatus.displayName();
    }
    try {
      return TaskStatus.valueOf(status.toString()).displayName();
    } catch (IllegalArgumentException e) {
      return status.toString();
    }
  }

  private static String withComment(String body, String comment) {
    if (comment == null || comment.isBlank()) {
      return body;
    }
    return body + " Comment: " + comment;
  }

  private record RenderedText(String title, String body) {}
}
