package org.hypertrace.core.query.influxql.where;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.hypertrace.core.query.influxql.api.Condition;

/**
 * Joins conditions of a group with {@code AND} and groups with {@code OR}. The implicit time
 * range is prefixed with {@code AND} so that it bounds every group. Example:
 *
 * <pre>(time > now() - 2d AND time < now() - 1d) AND node = 'node-1'</pre>
 */
class GroupedWhereClauseBuilder implements WhereClauseBuilder {
  private static final String AND = " AND ";
  private static final String OR = " OR ";

  private final ConditionConverter conditionConverter;

  GroupedWhereClauseBuilder(ConditionConverter conditionConverter) {
    this.conditionConverter = conditionConverter;
  }

  @Override
  public WhereComposition getComposition() {
    return WhereComposition.GROUPED;
  }

  @Override
  public boolean supportsDisjunction() {
    return true;
  }

  @Override
  public Optional<String> buildWhereClause(WhereConditions whereConditions) {
    List<List<Condition>> explicitGroups = whereConditions.getExplicitGroups();
    List<Condition> timeRange = whereConditions.getTimeRange();
    if (explicitGroups.isEmpty() && timeRange.isEmpty()) {
      return Optional.empty();
    }
    if (explicitGroups.isEmpty()) {
      return Optional.of(WHERE + convertConjunction(timeRange));
    }

    String explicitClause =
        explicitGroups.stream().map(this::convertConjunction).collect(Collectors.joining(OR));
    if (timeRange.isEmpty()) {
      return Optional.of(WHERE + explicitClause);
    }
    return Optional.of(
        WHERE
            + parenthesizeIf(timeRange.size() > 1, convertConjunction(timeRange))
            + AND
            + parenthesizeIf(explicitGroups.size() > 1, explicitClause));
  }

  private String convertConjunction(List<Condition> conditions) {
    return conditions.stream().map(conditionConverter::convert).collect(Collectors.joining(AND));
  }

  private static String parenthesizeIf(boolean condition, String clause) {
    return condition ? "(" + clause + ")" : clause;
  }
}
