package org.hypertrace.core.query.influxql.validation;

class ConditionGroupsValidation implements QueryValidation {
  @Override
  public void validate(QueryValidationContext context) {
    int groupCount = context.getWhereConditions().getExplicitGroups().size();
    if (groupCount > 1 && !context.isDisjunctionSupported()) {
      throw new QueryValidationException(
          ValidationError.DISJUNCTION_NOT_SUPPORTED,
          String.format(
              "Received %s condition groups, but the configured where composition only supports"
                  + " a single conjunction",
              groupCount));
    }
  }

  @Override
  public int getPriority() {
    return 5;
  }
}
