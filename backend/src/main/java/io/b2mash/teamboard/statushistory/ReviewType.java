package io.b2mash.teamboard.statushistory;

import io.b2mash.teamboard.task.TaskStatus;

/** Which review a transition concludes, derived from the status the task is leaving. */
public enum ReviewType {
  TASK_REVIEW,
  RESULT_REVIEW;

  /** Returns the review being left, or {@code null} when {@code from} is not a review state. */
  public static ReviewType fromLeaving(TaskStatus from) {
    if (from == null) {
      return null;
    }
    return switch (from) {
      case TASK_REVIEW -> TASK_REVIEW;
      case RESULT_REVIEW -> RESULT_REVIEW;
      default -> null;
    };
  }
}
