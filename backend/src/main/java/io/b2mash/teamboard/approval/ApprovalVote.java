package io.b2mash.teamboard.approval;

import io.b2mash.teamboard.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/** A stakeholder's vote on one pending status change. */
@Entity
@Table(
    name = "task_status_approvals",
    uniqueConstraints = @UniqueConstraint(columnNames = {"status_change_id", "stakeholder_id"}))
public class ApprovalVote {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "status_change_id", nullable = false, updatable = false)
  private UUID statusChangeId;

  @Column(name = "stakeholder_id", nullable = false, updatable = false)
  private UUID stakeholderId;

  @Enumerated(EnumType.STRING)
  @Column(name = "approval_status", nullable = false, length = 20)
  private ApprovalStatus approvalStatus;

  @Column(name = "comment", columnDefinition = "TEXT")
  private String comment;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "approved_at")
  private Instant approvedAt;

  protected ApprovalVote() {}

  public ApprovalVote(UUID statusChangeId, UUID stakeholderId) {
    this.statusChangeId = statusChangeId;
    this.stakeholderId = stakeholderId;
    this.approvalStatus = ApprovalStatus.PENDING;
    this.createdAt = Instant.now();
  }

  public void cast(VoteAction action, String comment) {
    if (approvalStatus != ApprovalStatus.PENDING) {
      throw new InvalidStateException(
          "Vote already cast", "Vote %s is already %s".formatted(id, approvalStatus));
    }
    this.approvalStatus =
        action == VoteAction.APPROVE ? ApprovalStatus.APPROVED : ApprovalStatus.REJECTED;
    this.comment = comment;
    this.approvedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getStatusChangeId() {
    return statusChangeId;
  }

  public UUID getStakeholderId() {
    return stakeholderId;
  }

  public ApprovalStatus getApprovalStatus() {
    return approvalStatus;
  }

  public String getComment() {
    return comment;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getApprovedAt() {
    return approvedAt;
  }
}
