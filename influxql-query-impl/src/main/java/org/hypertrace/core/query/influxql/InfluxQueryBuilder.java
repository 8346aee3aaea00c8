package org.hypertrace.core.query.influxql;

import com.google.common.annotations.VisibleForTesting;
import java.util.Optional;
import javax.inject.Inject;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.influxql.api.QuerySpec;
import org.hypertrace.core.query.influxql.clause.FromClauseBuilder;
import org.hypertrace.core.query.influxql.clause.GroupByClauseBuilder;
import org.hypertrace.core.query.influxql.clause.QueryAssembler;
import org.hypertrace.core.query.influxql.clause.SelectClauseBuilder;
import org.hypertrace.core.query.influxql.validation.QueryValidationContext;
import org.hypertrace.core.query.influxql.validation.QueryValidationException;
import org.hypertrace.core.query.influxql.validation.QueryValidator;
import org.hypertrace.core.query.influxql.where.WhereClauseBuilder;
import org.hypertrace.core.query.influxql.where.WhereConditions;

/** Compiles a {@link QuerySpec} into an InfluxQL query string. */
@Slf4j
public class InfluxQueryBuilder {

  private final QueryValidator queryValidator;
  private final WhereClauseBuilder whereClauseBuilder;
  private final SelectClauseBuilder selectClauseBuilder;
  private final FromClauseBuilder fromClauseBuilder;
  private final GroupByClauseBuilder groupByClauseBuilder;
  private final QueryAssembler queryAssembler;

  @Inject
  InfluxQueryBuilder(QueryValidator queryValidator, WhereClauseBuilder whereClauseBuilder) {
    this(
        queryValidator,
        whereClauseBuilder,
        new SelectClauseBuilder(),
        new FromClauseBuilder(),
        new GroupByClauseBuilder(),
        new QueryAssembler());
  }

  @VisibleForTesting
  InfluxQueryBuilder(
      QueryValidator queryValidator,
      WhereClauseBuilder whereClauseBuilder,
      SelectClauseBuilder selectClauseBuilder,
      FromClauseBuilder fromClauseBuilder,
      GroupByClauseBuilder groupByClauseBuilder,
      QueryAssembler queryAssembler) {
    this.queryValidator = queryValidator;
    this.whereClauseBuilder = whereClauseBuilder;
    this.selectClauseBuilder = selectClauseBuilder;
    this.fromClauseBuilder = fromClauseBuilder;
    this.groupByClauseBuilder = groupByClauseBuilder;
    this.queryAssembler = queryAssembler;
  }

  /**
   * Validates the query spec and builds the query.
   *
   * @throws QueryValidationException if the query spec has no measurements, or groups by time
   *     without a time bound, or uses condition groups the configured where composition cannot
   *     express
   */
  public String buildQuery(@NonNull QuerySpec querySpec) {
    WhereConditions whereConditions = WhereConditions.resolve(querySpec);
    queryValidator.validate(
        new QueryValidationContext(
            querySpec, whereConditions, whereClauseBuilder.supportsDisjunction()));

    Optional<String> whereClause = whereClauseBuilder.buildWhereClause(whereConditions);
    String query =
        queryAssembler.assemble(
            selectClauseBuilder.buildSelectClause(querySpec.getFields()),
            fromClauseBuilder.buildFromClause(querySpec.getMeasurements()),
            whereClause,
            groupByClauseBuilder.buildGroupByClause(querySpec.getGroupBy()));

    if (log.isDebugEnabled()) {
      log.debug("Converted QuerySpec to InfluxQL: {}", query);
    }
    return query;
  }

  @VisibleForTesting
  WhereClauseBuilder getWhereClauseBuilder() {
    return whereClauseBuilder;
  }
}
