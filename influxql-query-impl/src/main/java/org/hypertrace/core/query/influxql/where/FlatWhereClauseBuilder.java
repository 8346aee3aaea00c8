package org.hypertrace.core.query.influxql.where;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Joins every condition, explicit ones first and then the time range, with lowercase and. */
class FlatWhereClauseBuilder implements WhereClauseBuilder {
  private static final String AND = " and ";

  private final ConditionConverter conditionConverter;

  FlatWhereClauseBuilder(ConditionConverter conditionConverter) {
    this.conditionConverter = conditionConverter;
  }

  @Override
  public WhereComposition getComposition() {
    return WhereComposition.FLAT;
  }

  @Override
  public boolean supportsDisjunction() {
    return false;
  }

  @Override
  public Optional<String> buildWhereClause(WhereConditions whereConditions) {
    if (whereConditions.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        WHERE
            + Stream.concat(
                    whereConditions.getExplicitGroups().stream().flatMap(List::stream),
                    whereConditions.getTimeRange().stream())
                .map(conditionConverter::convert)
                .collect(Collectors.joining(AND)));
  }
}
