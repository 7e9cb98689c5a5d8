package io.b2mash.teamboard.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** A task already has an open approval ballot; a second transition must wait for it. */
public class ApprovalInFlightException extends ErrorResponseException {

  public ApprovalInFlightException(UUID taskId, UUID statusChangeId) {
    super(
        HttpStatus.CONFLICT,
        Problems.of(
            HttpStatus.CONFLICT,
            "Approval in flight",
            "Task %s has a pending status change %s awaiting stakeholder approval"
                .formatted(taskId, statusChangeId)),
        null);
    getBody().setProperty("statusChangeId", statusChangeId);
  }
}
