package org.hypertrace.core.query.influxql.api;

import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Right hand side of a {@link Condition}. The {@link ValueKind} decides how the text is rendered:
 * literals are single-quoted, expressions and duration literals are written as they are.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConditionValue {

  private static final Pattern DURATION_PATTERN = Pattern.compile("^\\d+(u|µ|ms|s|m|h|d|w)$");

  @NonNull ValueKind kind;
  @NonNull String text;

  /**
   * Creates a value from a plain string. Strings shaped like a duration literal (e.g. {@code 20d})
   * are kept unquoted, everything else is treated as a string literal.
   */
  public static ConditionValue of(String value) {
    return new ConditionValue(
        isDurationLiteral(value) ? ValueKind.DURATION : ValueKind.LITERAL, value);
  }

  /** Creates a raw expression value, e.g. {@code now() - 2h}. Never quoted. */
  public static ConditionValue expression(String expression) {
    return new ConditionValue(ValueKind.EXPRESSION, expression);
  }

  public static boolean isDurationLiteral(String value) {
    return value != null && DURATION_PATTERN.matcher(value).matches();
  }

  public enum ValueKind {
    LITERAL,
    EXPRESSION,
    DURATION
  }
}
