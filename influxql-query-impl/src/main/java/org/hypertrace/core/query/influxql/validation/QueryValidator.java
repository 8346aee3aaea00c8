package org.hypertrace.core.query.influxql.validation;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;

/**
 * Query validator invokes each registered validation in priority order. The first failing
 * validation aborts the run and its exception is passed to the caller.
 */
public class QueryValidator {
  private final List<QueryValidation> validations;

  @Inject
  public QueryValidator(Set<QueryValidation> validations) {
    this.validations = validations.stream().sorted().collect(Collectors.toUnmodifiableList());
  }

  public void validate(QueryValidationContext context) {
    for (QueryValidation validation : validations) {
      validation.validate(context);
    }
  }
}
