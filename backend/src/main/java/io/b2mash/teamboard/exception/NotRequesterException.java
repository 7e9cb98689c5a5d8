package io.b2mash.teamboard.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class NotRequesterException extends ErrorResponseException {

  public NotRequesterException(UUID statusChangeId) {
    super(
        HttpStatus.FORBIDDEN,
        Problems.of(
            HttpStatus.FORBIDDEN,
            "Cannot cancel approval request",
            "Only the member who requested status change %s can withdraw it"
                .formatted(statusChangeId)),
        null);
  }
}
