package org.hypertrace.core.query.influxql.where;

/** How multiple where conditions are combined into one clause. */
public enum WhereComposition {
  /** Disjunctive groups of conjunctive conditions, keywords {@code AND} / {@code OR}. */
  GROUPED,
  /** A single conjunction joined with lowercase {@code and}. */
  FLAT
}
