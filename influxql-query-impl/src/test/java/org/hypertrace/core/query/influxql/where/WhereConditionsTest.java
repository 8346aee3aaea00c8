package org.hypertrace.core.query.influxql.where;

import static org.hypertrace.core.query.influxql.util.QuerySpecUtil.createEqualsCondition;
import static org.hypertrace.core.query.influxql.util.QuerySpecUtil.createTimeCondition;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.hypertrace.core.query.influxql.api.ComparisonOperator;
import org.hypertrace.core.query.influxql.api.Condition;
import org.hypertrace.core.query.influxql.api.QuerySpec;
import org.junit.jupiter.api.Test;

class WhereConditionsTest {

  @Test
  void isEmptyWithoutConditionsOrTimeRange() {
    WhereConditions whereConditions =
        WhereConditions.resolve(QuerySpec.builder().measurements("m").build());

    assertTrue(whereConditions.isEmpty());
    assertFalse(whereConditions.hasTimeCondition());
  }

  @Test
  void derivesTimeRangeFromAndTo() {
    WhereConditions whereConditions =
        WhereConditions.resolve(
            QuerySpec.builder().measurements("m").from("now() - 2d").to("now() - 1d").build());

    assertEquals(
        List.of(
            createTimeCondition(ComparisonOperator.GT, "now() - 2d"),
            createTimeCondition(ComparisonOperator.LT, "now() - 1d")),
        whereConditions.getTimeRange());
    assertTrue(whereConditions.hasTimeCondition());
  }

  @Test
  void detectsExplicitTimeCondition() {
    WhereConditions whereConditions =
        WhereConditions.resolve(
            QuerySpec.builder()
                .measurements("m")
                .where(
                    List.of(
                        List.of(createEqualsCondition("node", "node-1")),
                        List.of(createTimeCondition(ComparisonOperator.GT, "now() - 1h"))))
                .build());

    assertTrue(whereConditions.getTimeRange().isEmpty());
    assertTrue(whereConditions.hasTimeCondition());
  }

  @Test
  void dropsEmptyGroups() {
    List<List<Condition>> where = new ArrayList<>();
    where.add(List.of());
    where.add(null);
    where.add(List.of(createEqualsCondition("node", "node-1")));

    WhereConditions whereConditions =
        WhereConditions.resolve(QuerySpec.builder().measurements("m").where(where).build());

    assertEquals(
        List.of(List.of(createEqualsCondition("node", "node-1"))),
        whereConditions.getExplicitGroups());
  }
}
