package io.b2mash.teamboard.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class NoSuchBallotException extends ErrorResponseException {

  public NoSuchBallotException(UUID taskId, UUID stakeholderId) {
    super(
        HttpStatus.NOT_FOUND,
        Problems.of(
            HttpStatus.NOT_FOUND,
            "No pending approval",
            "Member %s has no pending vote on an open status change of task %s"
                .formatted(stakeholderId, taskId)),
        null);
  }
}
