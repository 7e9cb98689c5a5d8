package io.b2mash.teamboard.notification;

import io.b2mash.teamboard.member.MemberContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

  private final NotificationService notificationService;

  public NotificationController(NotificationService notificationService) {
    this.notificationService = notificationService;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<Page<NotificationResponse>> listNotifications(
      @RequestParam(defaultValue = "false") boolean unreadOnly,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {

    UUID memberId = MemberContext.requireMemberId();
    var pageable =
        PageRequest.of(
            Math.max(page, 0),
            Math.min(Math.max(size, 1), 100),
            Sort.by(Sort.Direction.DESC, "createdAt"));
    var notifications = notificationService.listNotifications(memberId, unreadOnly, pageable);

    return ResponseEntity.ok(notifications.map(NotificationResponse::from));
  }

  @GetMapping("/unread-count")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<UnreadCountResponse> getUnreadCount() {
    UUID memberId = MemberContext.requireMemberId();
    return ResponseEntity.ok(new UnreadCountResponse(notificationService.getUnreadCount(memberId)));
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<NotificationResponse> getNotification(@PathVariable UUID id) {
    var notification = notificationService.getNotification(id, MemberContext.requireMemberId());
    return ResponseEntity.ok(NotificationResponse.from(notification));
  }

  @PutMapping("/{id}/read")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<Void> markAsRead(@PathVariable UUID id) {
    notificationService.markAsRead(id, MemberContext.requireMemberId());
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/read-batch")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<UpdatedCountResponse> markBatchAsRead(
      @Valid @RequestBody MarkReadRequest request) {
    int updated =
        notificationService.markAsRead(request.notificationIds(), MemberContext.requireMemberId());
    return ResponseEntity.ok(new UpdatedCountResponse(updated));
  }

  @PutMapping("/read-all")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<UpdatedCountResponse> markAllAsRead() {
    int updated = notificationService.markAllAsRead(MemberContext.requireMemberId());
    return ResponseEntity.ok(new UpdatedCountResponse(updated));
  }

  /** Clears read notifications, or every notification when {@code readOnly=false}. */
  @DeleteMapping("/clear-all")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<ClearedResponse> clearNotifications(
      @RequestParam(defaultValue = "true") boolean readOnly) {
    int deleted =
        notificationService.clearNotifications(MemberContext.requireMemberId(), readOnly);
    return ResponseEntity.ok(new ClearedResponse(deleted));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasAnyRole('MEMBER', 'MANAGER', 'ADMIN')")
  public ResponseEntity<Void> dismissNotification(@PathVariable UUID id) {
    notificationService.dismissNotification(id, MemberContext.requireMemberId());
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record NotificationResponse(
      UUID id,
      String type,
      String title,
      String body,
      UUID senderMemberId,
      String referenceEntityType,
      UUID referenceEntityId,
      String link,
      boolean isRead,
      Instant readAt,
      Instant createdAt) {

    public static NotificationResponse from(Notification notification) {
      return new NotificationResponse(
          notification.getId(),
          notification.getType().name(),
          notification.getTitle(),
          notification.getBody(),
          notification.getSenderMemberId(),
          notification.getReferenceEntityType(),
          notification.getReferenceEntityId(),
          notification.getLink(),
          notification.isRead(),
          notification.getReadAt(),
          notification.getCreatedAt());
    }
  }

  public record UnreadCountResponse(long count) {}

  public record MarkReadRequest(
      @NotNull(message = "notificationIds is required")
          @Size(max = 500, message = "at most 500 notifications per batch")
          List<UUID> notificationIds) {}

  public record UpdatedCountResponse(int updated) {}

  public record ClearedResponse(int deleted) {}
}
