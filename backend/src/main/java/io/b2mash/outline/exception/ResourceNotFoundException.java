package io.b2mash.outline.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The targeted template, section or task is no longer in the store, usually because another editor
 * deleted it. The problem carries the resource type and id so clients can drop it from their
 * outline.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(HttpStatus.NOT_FOUND, createProblem(describe(resourceType), resourceType, id), null);
  }

  /** "TemplateTask" reads as "template task". */
  static String describe(String resourceType) {
    return resourceType.replaceAll("([a-z])([A-Z])", "$1 $2").toLowerCase();
  }

  private static ProblemDetail createProblem(String noun, String resourceType, Object id) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(Character.toUpperCase(noun.charAt(0)) + noun.substring(1) + " not found");
    problem.setDetail(
        "No " + noun + " with id " + id + ". It may have been deleted; reload the outline.");
    problem.setProperty("resourceType", resourceType);
    problem.setProperty("resourceId", String.valueOf(id));
    return problem;
  }
}
