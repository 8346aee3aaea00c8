package org.hypertrace.core.query.influxql.util;

import java.util.Arrays;
import java.util.List;
import org.hypertrace.core.query.influxql.api.ComparisonOperator;
import org.hypertrace.core.query.influxql.api.Condition;
import org.hypertrace.core.query.influxql.api.ConditionValue;

/**
 * Utility methods to easily create {@link org.hypertrace.core.query.influxql.api.QuerySpec}
 * conditions.
 */
public class QuerySpecUtil {

  public static final String TIME_COLUMN = "time";

  public static Condition createTimeCondition(ComparisonOperator operator, String expression) {
    return Condition.of(TIME_COLUMN, ConditionValue.expression(expression), operator);
  }

  public static Condition createEqualsCondition(String field, String value) {
    return Condition.of(field, value, ComparisonOperator.EQ);
  }

  public static Condition createNotEqualsCondition(String field, String value) {
    return Condition.of(field, value, ComparisonOperator.NEQ);
  }

  public static Condition createExpressionCondition(
      String field, ComparisonOperator operator, String expression) {
    return Condition.of(field, ConditionValue.expression(expression), operator);
  }

  /** Creates the {@code time > from AND time < to} pair. */
  public static List<Condition> createBetweenTimesConditions(String from, String to) {
    return List.of(
        createTimeCondition(ComparisonOperator.GT, from),
        createTimeCondition(ComparisonOperator.LT, to));
  }

  public static List<Condition> createConditionGroup(Condition... conditions) {
    return Arrays.asList(conditions);
  }

  public static boolean isTimeCondition(Condition condition) {
    return TIME_COLUMN.equals(condition.getField());
  }
}
