package org.hypertrace.core.query.influxql;

import com.google.inject.Guice;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/** Entry point for callers that do not run their own injector. */
public class InfluxQueryBuilderFactory {
  private static final String CONFIG_PATH_ROOT = "influxql";

  private InfluxQueryBuilderFactory() {
    // empty private constructor
  }

  /** Builds from {@code application.conf} on the classpath, falling back to the defaults. */
  public static InfluxQueryBuilder build() {
    return build(ConfigFactory.load());
  }

  public static InfluxQueryBuilder build(Config config) {
    Config builderConfig =
        config.withFallback(ConfigFactory.defaultReference()).getConfig(CONFIG_PATH_ROOT);
    return Guice.createInjector(new InfluxQueryModule(builderConfig))
        .getInstance(InfluxQueryBuilder.class);
  }
}
