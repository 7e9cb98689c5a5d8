package io.b2mash.teamboard.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "notifications")
public class Notification {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "recipient_member_id", nullable = false)
  private UUID recipientMemberId;

  @Column(name = "sender_member_id")
  private UUID senderMemberId;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 50)
  private NotificationKind type;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "body", columnDefinition = "TEXT")
  private String body;

  @Column(name = "reference_entity_type", length = 20)
  private String referenceEntityType;

  @Column(name = "reference_entity_id")
  private UUID referenceEntityId;

  @Column(name = "link", length = 500)
  private String link;

  @Column(name = "is_read", nullable = false)
  private boolean isRead;

  @Column(name = "read_at")
  private Instant readAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Notification() {}

  public Notification(
      UUID recipientMemberId,
      UUID senderMemberId,
      NotificationKind type,
      String title,
      String body,
      String referenceEntityType,
      UUID referenceEntityId,
      String link) {
    this.recipientMemberId = recipientMemberId;
    this.senderMemberId = senderMemberId;
    this.type = type;
    this.title = title;
    this.body = body;
    this.referenceEntityType = referenceEntityType;
    this.referenceEntityId = referenceEntityId;
    this.link = link;
    this.isRead = false;
    this.createdAt = Instant.now();
  }

  public void markAsRead() {
    if (!isRead) {
      this.isRead = true;
      this.readAt = Instant.now();
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getRecipientMemberId() {
    return recipientMemberId;
  }

  public UUID getSenderMemberId() {
    return senderMemberId;
  }

  public NotificationKind getType() {
    return type;
  }

  public String getTitle() {
    return title;
  }

  public String getBody() {
    return body;
  }

  public String getReferenceEntityType() {
    return referenceEntityType;
  }

  public UUID getReferenceEntityId() {
    return referenceEntityId;
  }

  public String getLink() {
    return link;
  }

  public boolean isRead() {
    return isRead;
  }

  public Instant getReadAt() {
    return readAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
