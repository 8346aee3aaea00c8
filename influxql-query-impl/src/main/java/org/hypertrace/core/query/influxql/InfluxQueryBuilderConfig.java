package org.hypertrace.core.query.influxql;

import com.typesafe.config.Config;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.hypertrace.core.query.influxql.where.WhereComposition;

@Value
@NonFinal
public class InfluxQueryBuilderConfig {

  private static final String CONFIG_PATH_WHERE_COMPOSITION = "where.composition";
  private static final String CONFIG_PATH_GROUP_BY_TIME_VALIDATION = "validation.groupByTime";

  WhereComposition whereComposition;
  GroupByTimeValidationConfig groupByTimeValidationConfig;

  public InfluxQueryBuilderConfig(Config config) {
    Config resolved = config.resolve();
    this.whereComposition =
        resolved.getEnum(WhereComposition.class, CONFIG_PATH_WHERE_COMPOSITION);
    this.groupByTimeValidationConfig =
        new GroupByTimeValidationConfig(resolved.getConfig(CONFIG_PATH_GROUP_BY_TIME_VALIDATION));
  }

  @Value
  @NonFinal
  public static class GroupByTimeValidationConfig {
    private static final String CONFIG_PATH_MODE = "mode";
    ValidationMode mode;

    private GroupByTimeValidationConfig(Config config) {
      this.mode = config.getEnum(ValidationMode.class, CONFIG_PATH_MODE);
    }

    public enum ValidationMode {
      DISABLED,
      WARN,
      ERROR
    }
  }
}
