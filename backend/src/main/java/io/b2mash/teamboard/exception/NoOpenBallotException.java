package io.b2mash.teamboard.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class NoOpenBallotException extends ErrorResponseException {

  public NoOpenBallotException(UUID taskId) {
    super(
        HttpStatus.NOT_FOUND,
        Problems.of(
            HttpStatus.NOT_FOUND,
            "No open approval request",
            "Task %s has no status change awaiting approval".formatted(taskId)),
        null);
  }
}
