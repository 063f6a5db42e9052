package io.b2mash.b2b.accessaudit.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends DomainProblemException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + id);
  }
}
