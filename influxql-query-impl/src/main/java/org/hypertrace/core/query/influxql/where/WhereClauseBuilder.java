package org.hypertrace.core.query.influxql.where;

import java.util.Optional;

public interface WhereClauseBuilder {
  String WHERE = "WHERE ";

  WhereComposition getComposition();

  /** Whether conditions may be split into disjunctive groups. */
  boolean supportsDisjunction();

  /** Returns the {@code WHERE ...} clause, empty when there is no condition at all. */
  Optional<String> buildWhereClause(WhereConditions whereConditions);
}
