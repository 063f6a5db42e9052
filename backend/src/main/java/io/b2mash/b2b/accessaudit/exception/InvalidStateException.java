package io.b2mash.b2b.accessaudit.exception;

import org.springframework.http.HttpStatus;

public class InvalidStateException extends DomainProblemException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, title, detail);
  }
}
