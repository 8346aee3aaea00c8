package org.hypertrace.core.query.influxql.where;

import static org.hypertrace.core.query.influxql.util.QuerySpecUtil.createTimeCondition;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Stream;
import lombok.NonNull;
import lombok.Value;
import org.hypertrace.core.query.influxql.api.ComparisonOperator;
import org.hypertrace.core.query.influxql.api.Condition;
import org.hypertrace.core.query.influxql.api.QuerySpec;
import org.hypertrace.core.query.influxql.util.QuerySpecUtil;

/**
 * Conditions that end up in the where clause: the explicit condition groups of a query spec and
 * the implicit time range derived from its {@code from} / {@code to} fields.
 */
@Value
public class WhereConditions {
  @NonNull List<List<Condition>> explicitGroups;
  @NonNull List<Condition> timeRange;

  public static WhereConditions resolve(QuerySpec querySpec) {
    ImmutableList.Builder<List<Condition>> explicitGroups = ImmutableList.builder();
    if (querySpec.getWhere() != null) {
      querySpec.getWhere().stream()
          .filter(group -> group != null && !group.isEmpty())
          .map(ImmutableList::copyOf)
          .forEach(explicitGroups::add);
    }

    ImmutableList.Builder<Condition> timeRange = ImmutableList.builder();
    if (querySpec.getFrom() != null) {
      timeRange.add(createTimeCondition(ComparisonOperator.GT, querySpec.getFrom()));
    }
    if (querySpec.getTo() != null) {
      timeRange.add(createTimeCondition(ComparisonOperator.LT, querySpec.getTo()));
    }
    return new WhereConditions(explicitGroups.build(), timeRange.build());
  }

  public boolean isEmpty() {
    return explicitGroups.isEmpty() && timeRange.isEmpty();
  }

  public boolean hasTimeCondition() {
    return Stream.concat(explicitGroups.stream().flatMap(List::stream), timeRange.stream())
        .anyMatch(QuerySpecUtil::isTimeCondition);
  }
}
