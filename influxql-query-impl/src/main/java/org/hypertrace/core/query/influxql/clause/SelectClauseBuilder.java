package org.hypertrace.core.query.influxql.clause;

import com.google.common.base.Joiner;
import java.util.List;

public class SelectClauseBuilder {
  private static final Joiner FIELD_JOINER = Joiner.on(',');
  private static final String ALL_FIELDS = "*";

  /** Fields are written verbatim, so expressions like {@code max(value) - 20} are allowed. */
  public String buildSelectClause(List<String> fields) {
    if (fields == null || fields.isEmpty()) {
      return "SELECT " + ALL_FIELDS;
    }
    return "SELECT " + FIELD_JOINER.join(fields);
  }
}
