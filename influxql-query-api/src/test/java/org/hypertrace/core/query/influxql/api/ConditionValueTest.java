package org.hypertrace.core.query.influxql.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.hypertrace.core.query.influxql.api.ConditionValue.ValueKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConditionValueTest {

  @ParameterizedTest
  @ValueSource(strings = {"20u", "20µ", "20ms", "20s", "20m", "20h", "20d", "20w", "1500ms"})
  void classifiesDurationLiterals(String value) {
    assertEquals(ValueKind.DURATION, ConditionValue.of(value).getKind());
    assertTrue(ConditionValue.isDurationLiteral(value));
  }

  @ParameterizedTest
  @ValueSource(strings = {"node-1", "20", "d", "20x", "20 d", "-20d", "20dd", "now() - 2h", ""})
  void classifiesEverythingElseAsLiteral(String value) {
    assertEquals(ValueKind.LITERAL, ConditionValue.of(value).getKind());
    assertFalse(ConditionValue.isDurationLiteral(value));
  }

  @Test
  void keepsExpressionTextUnchanged() {
    ConditionValue value = ConditionValue.expression("now() - 2h");
    assertEquals(ValueKind.EXPRESSION, value.getKind());
    assertEquals("now() - 2h", value.getText());
  }

  @Test
  void rejectsNullText() {
    assertThrows(NullPointerException.class, () -> ConditionValue.of(null));
    assertThrows(NullPointerException.class, () -> ConditionValue.expression(null));
  }
}
