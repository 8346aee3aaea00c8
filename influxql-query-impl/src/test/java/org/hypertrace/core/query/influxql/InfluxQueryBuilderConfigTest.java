package org.hypertrace.core.query.influxql;

import static java.util.Objects.requireNonNull;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.hypertrace.core.query.influxql.InfluxQueryBuilderConfig.GroupByTimeValidationConfig.ValidationMode;
import org.hypertrace.core.query.influxql.where.WhereComposition;
import org.junit.jupiter.api.Test;

public class InfluxQueryBuilderConfigTest {

  @Test
  public void testDefaultsFromReferenceConfig() {
    InfluxQueryBuilderConfig config =
        new InfluxQueryBuilderConfig(ConfigFactory.defaultReference().getConfig("influxql"));

    assertEquals(WhereComposition.GROUPED, config.getWhereComposition());
    assertEquals(ValidationMode.ERROR, config.getGroupByTimeValidationConfig().getMode());
  }

  @Test
  public void testApplicationConfigOverridesDefaults() {
    Config appConfig =
        ConfigFactory.parseURL(
                requireNonNull(
                    InfluxQueryBuilderConfigTest.class
                        .getClassLoader()
                        .getResource("application.conf")))
            .withFallback(ConfigFactory.defaultReference());
    InfluxQueryBuilderConfig config =
        new InfluxQueryBuilderConfig(appConfig.getConfig("influxql"));

    assertEquals(WhereComposition.FLAT, config.getWhereComposition());
    assertEquals(ValidationMode.WARN, config.getGroupByTimeValidationConfig().getMode());
  }
}
