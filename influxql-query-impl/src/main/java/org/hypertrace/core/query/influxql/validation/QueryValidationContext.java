package org.hypertrace.core.query.influxql.validation;

import lombok.NonNull;
import lombok.Value;
import org.hypertrace.core.query.influxql.api.QuerySpec;
import org.hypertrace.core.query.influxql.where.WhereConditions;

/** The query spec under validation and the where conditions that are about to be rendered. */
@Value
public class QueryValidationContext {
  @NonNull QuerySpec querySpec;
  @NonNull WhereConditions whereConditions;
  boolean disjunctionSupported;
}
