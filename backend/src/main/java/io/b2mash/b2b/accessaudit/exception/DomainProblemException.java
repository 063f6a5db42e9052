package io.b2mash.b2b.accessaudit.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Base for domain failures that carry an RFC 7807 {@link ProblemDetail} body. */
public abstract class DomainProblemException extends ErrorResponseException {

  protected DomainProblemException(HttpStatus status, String title, String detail) {
    super(status, problem(status, title, detail), null);
  }

  private static ProblemDetail problem(HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setTitle(title);
    return problem;
  }
}
