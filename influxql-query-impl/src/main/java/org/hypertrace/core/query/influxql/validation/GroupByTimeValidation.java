package org.hypertrace.core.query.influxql.validation;

import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.influxql.InfluxQueryBuilderConfig;
import org.hypertrace.core.query.influxql.InfluxQueryBuilderConfig.GroupByTimeValidationConfig;
import org.hypertrace.core.query.influxql.clause.GroupByClauseBuilder;

/** Bucketing by {@code time(...)} is only allowed when the where clause bounds time. */
@Slf4j
class GroupByTimeValidation implements QueryValidation {

  GroupByTimeValidationConfig config;

  @Inject
  GroupByTimeValidation(InfluxQueryBuilderConfig builderConfig) {
    this.config = builderConfig.getGroupByTimeValidationConfig();
  }

  @Override
  public void validate(QueryValidationContext context) {
    switch (config.getMode()) {
      case ERROR:
        findUnboundTimeBucket(context)
            .ifPresent(
                term -> {
                  throw new QueryValidationException(
                      ValidationError.MISSING_TIME_BOUND_FOR_GROUP_BY_TIME,
                      generateErrorMessage(term));
                });
        return;
      case WARN:
        findUnboundTimeBucket(context)
            .ifPresent(
                term ->
                    log.warn(
                        generateErrorMessage(term) + ". Allowing due to warn mode.{}{}",
                        System.lineSeparator(),
                        context.getQuerySpec()));
        return;
      case DISABLED:
      default:
        break;
    }
  }

  private Optional<String> findUnboundTimeBucket(QueryValidationContext context) {
    List<String> groupBy = context.getQuerySpec().getGroupBy();
    if (groupBy == null || context.getWhereConditions().hasTimeCondition()) {
      return Optional.empty();
    }
    return groupBy.stream().filter(GroupByClauseBuilder::isTimeBucket).findFirst();
  }

  private String generateErrorMessage(String term) {
    return String.format(
        "Received GROUP BY %s without a time condition in WHERE, set 'from' or add a time"
            + " condition",
        term);
  }
}
