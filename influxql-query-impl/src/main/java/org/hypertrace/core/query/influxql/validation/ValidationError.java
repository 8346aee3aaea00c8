package org.hypertrace.core.query.influxql.validation;

public enum ValidationError {
  NO_MEASUREMENTS,
  MISSING_TIME_BOUND_FOR_GROUP_BY_TIME,
  DISJUNCTION_NOT_SUPPORTED
}
