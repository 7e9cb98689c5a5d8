package io.b2mash.teamboard.task;

import java.util.Map;
import java.util.Set;

/** Task lifecycle status with validated transitions. */
public enum TaskStatus {
  TODO("To do"),
  TASK_REVIEW("Task review"),
  IN_PROGRESS("In progress"),
  RESULT_REVIEW("Result review"),
  DONE("Done"),
  CANCELLED("Cancelled");

  private static final Map<TaskStatus, Set<TaskStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          TODO, Set.of(TASK_REVIEW, CANCELLED),
          TASK_REVIEW, Set.of(TODO, IN_PROGRESS, CANCELLED),
          IN_PROGRESS, Set.of(RESULT_REVIEW, CANCELLED),
          RESULT_REVIEW, Set.of(IN_PROGRESS, DONE, CANCELLED),
          DONE, Set.of(CANCELLED),
          CANCELLED, Set.of(TODO));

  private final String displayName;

  TaskStatus(String displayName) {
    this.displayName = displayName;
  }

  /** Human-readable label used in notification texts. */
  public String displayName() {
    return displayName;
  }

  /** Returns the set of statuses this status can transition to. */
  public Set<TaskStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  /** Returns true if transitioning from this status to the target is allowed. */
  public boolean canTransitionTo(TaskStatus target) {
    return allowedTransitions().contains(target);
  }

  /** Returns true for the two review states, whose entry asks reviewers to look at the task. */
  public boolean isReview() {
    return this == TASK_REVIEW || this == RESULT_REVIEW;
  }
}
