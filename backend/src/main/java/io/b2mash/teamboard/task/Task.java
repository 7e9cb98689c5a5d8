package io.b2mash.teamboard.task;

import io.b2mash.teamboard.exception.InvalidTransitionException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "tasks")
public class Task {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TaskStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "priority", nullable = false, length = 20)
  private TaskPriority priority;

  @Column(name = "task_type", length = 100)
  private String taskType;

  @Column(name = "assignee_id")
  private UUID assigneeId;

  @Column(name = "created_by", nullable = false)
  private UUID createdBy;

  @Column(name = "estimated_hours", precision = 8, scale = 2)
  private BigDecimal estimatedHours;

  @Column(name = "start_date")
  private LocalDate startDate;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Task() {}

  public Task(
      UUID projectId,
      String title,
      String description,
      TaskPriority priority,
      String taskType,
      UUID assigneeId,
      UUID createdBy) {
    this.projectId = projectId;
    this.title = title;
    this.description = description;
    this.status = TaskStatus.TODO;
    this.priority = priority != null ? priority : TaskPriority.MEDIUM;
    this.taskType = taskType;
    this.assigneeId = assigneeId;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Edits the descriptive fields. Status is only ever changed through {@link #applyStatus}. */
  public void update(
      String title,
      String description,
      TaskPriority priority,
      String taskType,
      UUID assigneeId,
      BigDecimal estimatedHours,
      LocalDate startDate,
      LocalDate dueDate) {
    this.title = title;
    this.description = description;
    this.priority = priority != null ? priority : this.priority;
    this.taskType = taskType;
    this.assigneeId = assigneeId;
    this.estimatedHours = estimatedHours;
    this.startDate = startDate;
    this.dueDate = dueDate;
    this.updatedAt = Instant.now();
  }

  public void schedule(BigDecimal estimatedHours, LocalDate startDate, LocalDate dueDate) {
    this.estimatedHours = estimatedHours;
    this.startDate = startDate;
    this.dueDate = dueDate;
  }

  /**
   * Moves the task to {@code target}. {@code completedAt} is stamped on entering DONE and cleared
   * on any other status.
   *
   * @throws InvalidTransitionException if {@code target} is not an allowed successor
   */
  public void applyStatus(TaskStatus target) {
    requireTransition(target);
    this.status = target;
    this.completedAt = target == TaskStatus.DONE ? Instant.now() : null;
    this.updatedAt = Instant.now();
  }

  public void requireTransition(TaskStatus target) {
    if (!this.status.canTransitionTo(target)) {
      throw new InvalidTransitionException(
          status.name(),
          target.name(),
          status.allowedTransitions().stream().map(Enum::name).toList());
    }
  }

  public boolean isCreatedBy(UUID memberId) {
    return createdBy.equals(memberId);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public String getTaskType() {
    return taskType;
  }

  public UUID getAssigneeId() {
    return assigneeId;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public BigDecimal getEstimatedHours() {
    return estimatedHours;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
