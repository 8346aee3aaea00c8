package org.hypertrace.core.query.influxql.api;

public enum ComparisonOperator {
  EQ("="),
  NEQ("!="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">=");

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }
}
