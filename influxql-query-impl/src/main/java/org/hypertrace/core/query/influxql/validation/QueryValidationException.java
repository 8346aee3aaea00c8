package org.hypertrace.core.query.influxql.validation;

/** Raised when a query spec cannot be compiled. No query text is produced in that case. */
public class QueryValidationException extends RuntimeException {
  private final ValidationError error;

  public QueryValidationException(ValidationError error, String message) {
    super(message);
    this.error = error;
  }

  public ValidationError getError() {
    return error;
  }
}
