package io.b2mash.teamboard.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class ForbiddenException extends ErrorResponseException {

  public ForbiddenException(String title, String detail) {
    super(HttpStatus.FORBIDDEN, Problems.of(HttpStatus.FORBIDDEN, title, detail), null);
  }
}
