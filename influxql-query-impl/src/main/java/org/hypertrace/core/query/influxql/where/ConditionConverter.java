package org.hypertrace.core.query.influxql.where;

import org.hypertrace.core.query.influxql.api.Condition;
import org.hypertrace.core.query.influxql.api.ConditionValue;

/** Renders a single {@link Condition} as {@code <field> <operator> <value>}. */
public class ConditionConverter {

  public String convert(Condition condition) {
    return condition.getField()
        + " "
        + condition.getOperator().getSymbol()
        + " "
        + convertValueToString(condition.getValue());
  }

  /** String literals are single-quoted. Inner quotes are not escaped. */
  String convertValueToString(ConditionValue value) {
    switch (value.getKind()) {
      case EXPRESSION:
      case DURATION:
        return value.getText();
      case LITERAL:
        return "'" + value.getText() + "'";
      default:
        throw new IllegalArgumentException(
            String.format("Condition value kind %s not supported", value.getKind()));
    }
  }
}
