package org.hypertrace.core.query.influxql.where;

public class WhereClauseBuilderFactory {

  private WhereClauseBuilderFactory() {
    // empty private constructor
  }

  public static WhereClauseBuilder getWhereClauseBuilder(
      WhereComposition composition, ConditionConverter conditionConverter) {
    switch (composition) {
      case GROUPED:
        return new GroupedWhereClauseBuilder(conditionConverter);
      case FLAT:
        return new FlatWhereClauseBuilder(conditionConverter);
      default:
        throw new IllegalArgumentException(
            String.format("Unsupported where composition %s", composition));
    }
  }
}
