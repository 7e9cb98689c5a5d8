package io.b2mash.teamboard.stakeholder;

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

@Entity
@Table(
    name = "task_stakeholders",
    uniqueConstraints = @UniqueConstraint(columnNames = {"task_id", "member_id"}))
public class TaskStakeholder {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "task_id", nullable = false)
  private UUID taskId;

  @Column(name = "member_id", nullable = false)
  private UUID memberId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 20)
  private StakeholderRole role;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TaskStakeholder() {}

  public TaskStakeholder(UUID taskId, UUID memberId, StakeholderRole role) {
    this.taskId = taskId;
    this.memberId = memberId;
    this.role = role != null ? role : StakeholderRole.STAKEHOLDER;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getTaskId() {
    return taskId;
  }

  public UUID getMemberId() {
    return memberId;
  }

  public StakeholderRole getRole() {
    return role;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
