package org.hypertrace.core.query.influxql.api;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import lombok.Builder;
import lombok.Value;

/**
 * Declarative description of a time series query. Optional parts are left {@code null}. Lists are
 * copied on the way in, so later changes to the caller's lists do not leak into the spec.
 *
 * <p>{@code where} holds condition groups: conditions inside a group are conjunctive, the groups
 * themselves are disjunctive. A flat list of conditions is a single group, see {@link
 * QuerySpecBuilder#conditions(Condition...)}.
 */
@Value
@Builder(toBuilder = true)
public class QuerySpec {
  List<String> measurements;
  List<String> fields;
  List<List<Condition>> where;
  String from;
  String to;
  List<String> groupBy;

  public static class QuerySpecBuilder {

    public QuerySpecBuilder measurements(String... measurements) {
      return measurements(Arrays.asList(measurements));
    }

    public QuerySpecBuilder measurements(List<String> measurements) {
      this.measurements = copyOf(measurements);
      return this;
    }

    public QuerySpecBuilder fields(String... fields) {
      return fields(Arrays.asList(fields));
    }

    public QuerySpecBuilder fields(List<String> fields) {
      this.fields = copyOf(fields);
      return this;
    }

    public QuerySpecBuilder groupBy(String... groupBy) {
      return groupBy(Arrays.asList(groupBy));
    }

    public QuerySpecBuilder groupBy(List<String> groupBy) {
      this.groupBy = copyOf(groupBy);
      return this;
    }

    /** Null groups are dropped. */
    public QuerySpecBuilder where(List<List<Condition>> where) {
      this.where =
          where == null
              ? null
              : where.stream()
                  .filter(Objects::nonNull)
                  .<List<Condition>>map(ImmutableList::copyOf)
                  .collect(ImmutableList.toImmutableList());
      return this;
    }

    /** Sets a single conjunctive group of conditions. */
    public QuerySpecBuilder conditions(Condition... conditions) {
      return where(List.of(Arrays.asList(conditions)));
    }

    private static <T> List<T> copyOf(List<T> values) {
      return values == null ? null : ImmutableList.copyOf(values);
    }
  }
}
