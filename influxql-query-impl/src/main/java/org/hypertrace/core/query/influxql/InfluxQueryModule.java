package org.hypertrace.core.query.influxql;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.typesafe.config.Config;
import javax.inject.Singleton;
import org.hypertrace.core.query.influxql.validation.QueryValidationModule;
import org.hypertrace.core.query.influxql.where.ConditionConverter;
import org.hypertrace.core.query.influxql.where.WhereClauseBuilder;
import org.hypertrace.core.query.influxql.where.WhereClauseBuilderFactory;

public class InfluxQueryModule extends AbstractModule {

  private final InfluxQueryBuilderConfig config;

  public InfluxQueryModule(Config config) {
    this.config = new InfluxQueryBuilderConfig(config);
  }

  @Override
  protected void configure() {
    bind(InfluxQueryBuilderConfig.class).toInstance(this.config);
    bind(InfluxQueryBuilder.class).in(Singleton.class);
    install(new QueryValidationModule());
  }

  @Provides
  @Singleton
  WhereClauseBuilder provideWhereClauseBuilder(InfluxQueryBuilderConfig config) {
    return WhereClauseBuilderFactory.getWhereClauseBuilder(
        config.getWhereComposition(), new ConditionConverter());
  }
}
