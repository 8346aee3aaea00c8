package org.hypertrace.core.query.influxql.validation;

import java.util.List;

class MeasurementsValidation implements QueryValidation {
  @Override
  public void validate(QueryValidationContext context) {
    List<String> measurements = context.getQuerySpec().getMeasurements();
    if (measurements == null || measurements.isEmpty()) {
      throw new QueryValidationException(
          ValidationError.NO_MEASUREMENTS, "Query requires at least one measurement");
    }
  }

  @Override
  public int getPriority() {
    return 0;
  }
}
