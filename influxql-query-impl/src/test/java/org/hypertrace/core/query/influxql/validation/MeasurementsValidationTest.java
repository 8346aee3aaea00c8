package org.hypertrace.core.query.influxql.validation;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.hypertrace.core.query.influxql.api.QuerySpec;
import org.hypertrace.core.query.influxql.where.WhereConditions;
import org.junit.jupiter.api.Test;

class MeasurementsValidationTest {
  private final MeasurementsValidation validation = new MeasurementsValidation();

  @Test
  void errorsOnMissingMeasurements() {
    QueryValidationException exception =
        assertThrows(
            QueryValidationException.class,
            () -> validation.validate(buildContext(QuerySpec.builder().build())));
    assertEquals(ValidationError.NO_MEASUREMENTS, exception.getError());
  }

  @Test
  void errorsOnEmptyMeasurements() {
    QueryValidationException exception =
        assertThrows(
            QueryValidationException.class,
            () ->
                validation.validate(
                    buildContext(QuerySpec.builder().measurements(List.of()).build())));
    assertEquals(ValidationError.NO_MEASUREMENTS, exception.getError());
  }

  @Test
  void allowsSingleMeasurement() {
    assertDoesNotThrow(
        () -> validation.validate(buildContext(QuerySpec.builder().measurements("m").build())));
  }

  private QueryValidationContext buildContext(QuerySpec querySpec) {
    return new QueryValidationContext(querySpec, WhereConditions.resolve(querySpec), true);
  }
}
