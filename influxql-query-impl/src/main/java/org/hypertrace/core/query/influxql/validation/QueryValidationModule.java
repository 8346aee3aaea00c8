package org.hypertrace.core.query.influxql.validation;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;

public class QueryValidationModule extends AbstractModule {
  @Override
  protected void configure() {
    Multibinder<QueryValidation> validationMultibinder =
        Multibinder.newSetBinder(binder(), QueryValidation.class);
    validationMultibinder.addBinding().to(MeasurementsValidation.class);
    validationMultibinder.addBinding().to(ConditionGroupsValidation.class);
    validationMultibinder.addBinding().to(GroupByTimeValidation.class);
  }
}
