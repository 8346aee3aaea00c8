package org.hypertrace.core.query.influxql.validation;

public interface QueryValidation extends Comparable<QueryValidation> {
  void validate(QueryValidationContext context) throws QueryValidationException;

  default int getPriority() {
    return 10;
  }

  @Override
  default int compareTo(QueryValidation other) {
    return Integer.compare(this.getPriority(), other.getPriority());
  }
}
