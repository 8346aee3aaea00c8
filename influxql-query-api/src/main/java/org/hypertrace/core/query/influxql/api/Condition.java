package org.hypertrace.core.query.influxql.api;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/** A single comparison of a field against a value. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Condition {
  @NonNull String field;
  @NonNull ConditionValue value;
  @NonNull ComparisonOperator operator;

  public static Condition of(String field, ConditionValue value, ComparisonOperator operator) {
    return new Condition(field, value, operator);
  }

  /** The value is classified by {@link ConditionValue#of(String)}. */
  public static Condition of(String field, String value, ComparisonOperator operator) {
    return new Condition(field, ConditionValue.of(value), operator);
  }
}
