package io.b2mash.teamboard.exception;

import java.util.Collection;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a task is asked to move to a status that is not an allowed successor of its current
 * status. The problem body carries the allowed set under {@code allowedStatuses} so clients can
 * offer the legal choices.
 */
public class InvalidTransitionException extends ErrorResponseException {

  private final List<String> allowedStatuses;

  public InvalidTransitionException(String from, String to, Collection<String> allowed) {
    super(HttpStatus.BAD_REQUEST, createProblem(from, to, sorted(allowed)), null);
    this.allowedStatuses = sorted(allowed);
  }

  public List<String> getAllowedStatuses() {
    return allowedStatuses;
  }

  private static List<String> sorted(Collection<String> allowed) {
    return allowed.stream().sorted().toList();
  }

  private static ProblemDetail createProblem(String from, String to, List<String> allowed) {
    var problem =
        Problems.of(
            HttpStatus.BAD_REQUEST,
            "Invalid status transition",
            "Cannot move task from %s to %s. Allowed: %s".formatted(from, to, allowed));
    problem.setProperty("allowedStatuses", allowed);
    return problem;
  }
}
