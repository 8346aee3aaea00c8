package org.hypertrace.core.query.influxql.clause;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import java.util.List;

public class FromClauseBuilder {
  private static final Joiner MEASUREMENT_JOINER = Joiner.on(',');

  public String buildFromClause(List<String> measurements) {
    Preconditions.checkArgument(
        measurements != null && !measurements.isEmpty(), "measurements must not be empty");
    return "FROM " + MEASUREMENT_JOINER.join(measurements);
  }
}
