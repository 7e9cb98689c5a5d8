package io.b2mash.teamboard.statushistory;

import io.b2mash.teamboard.exception.InvalidStateException;
import io.b2mash.teamboard.task.TaskStatus;
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

/**
 * One entry of a task's status ledger. Everything but {@link #getReviewResult() reviewResult} is
 * fixed at creation; the result only moves once, from PENDING to a terminal value.
 */
@Entity
@Table(name = "task_status_history")
public class StatusChangeRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "task_id", nullable = false, updatable = false)
  private UUID taskId;

  @Enumerated(EnumType.STRING)
  @Column(name = "from_status", length = 20, updatable = false)
  private TaskStatus fromStatus;

  @Enumerated(EnumType.STRING)
  @Column(name = "to_status", nullable = false, length = 20, updatable = false)
  private TaskStatus toStatus;

  @Column(name = "changed_by", nullable = false, updatable = false)
  private UUID changedBy;

  @Column(name = "comment", columnDefinition = "TEXT", updatable = false)
  private String comment;

  @Enumerated(EnumType.STRING)
  @Column(name = "review_type", length = 20, updatable = false)
  private ReviewType reviewType;

  @Column(name = "review_feedback", columnDefinition = "TEXT", updatable = false)
  private String reviewFeedback;

  @Enumerated(EnumType.STRING)
  @Column(name = "review_result", length = 20)
  private ReviewResult reviewResult;

  @Column(name = "changed_at", nullable = false, updatable = false)
  private Instant changedAt;

  protected StatusChangeRecord() {}

  public StatusChangeRecord(
      UUID taskId,
      TaskStatus fromStatus,
      TaskStatus toStatus,
      UUID changedBy,
      String comment,
      String reviewFeedback,
      ReviewResult reviewResult) {
    this.taskId = taskId;
    this.fromStatus = fromStatus;
    this.toStatus = toStatus;
    this.changedBy = changedBy;
    this.comment = comment;
    this.reviewType = ReviewType.fromLeaving(fromStatus);
    this.reviewFeedback = reviewFeedback;
    this.reviewResult = reviewResult;
    this.changedAt = Instant.now();
  }

  /** Closes an open ballot record with a terminal result. */
  public void resolve(ReviewResult result) {
    if (reviewResult != ReviewResult.PENDING) {
      throw new InvalidStateException(
          "Status change already resolved",
          "Status change %s is %s and cannot become %s".formatted(id, reviewResult, result));
    }
    if (result == null || !result.isTerminal()) {
      throw new IllegalArgumentException("A pending status change resolves to a terminal result");
    }
    this.reviewResult = result;
  }

  public boolean isPending() {
    return reviewResult == ReviewResult.PENDING;
  }

  public boolean isRequestedBy(UUID memberId) {
    return changedBy.equals(memberId);
  }

  public UUID getId() {
    return id;
  }

  public UUID getTaskId() {
    return taskId;
  }

  public TaskStatus getFromStatus() {
    return fromStatus;
  }

  public TaskStatus getToStatus() {
    return toStatus;
  }

  public UUID getChangedBy() {
    return changedBy;
  }

  public String getComment() {
    return comment;
  }

  public ReviewType getReviewType() {
    return reviewType;
  }

  public String getReviewFeedback() {
    return reviewFeedback;
  }

  public ReviewResult getReviewResult() {
    return reviewResult;
  }

  public Instant getChangedAt() {
    return changedAt;
  }
}
