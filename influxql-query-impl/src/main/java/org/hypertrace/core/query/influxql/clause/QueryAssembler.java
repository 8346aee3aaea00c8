package org.hypertrace.core.query.influxql.clause;

import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Concatenates the clauses in their fixed order, leaving out the absent ones. */
public class QueryAssembler {

  public String assemble(
      String selectClause,
      String fromClause,
      Optional<String> whereClause,
      Optional<String> groupByClause) {
    return Stream.of(Optional.of(selectClause), Optional.of(fromClause), whereClause, groupByClause)
        .flatMap(Optional::stream)
        .filter(clause -> !clause.isEmpty())
        .collect(Collectors.joining(" "));
  }
}
