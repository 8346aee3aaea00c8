package org.hypertrace.core.query.influxql.clause;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds {@code GROUP BY}. Plain identifiers are double-quoted to keep them apart from keywords,
 * call-shaped terms like {@code time(2d)} are written as they are.
 */
public class GroupByClauseBuilder {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^\\w+$");
  private static final Pattern TIME_BUCKET_PATTERN = Pattern.compile("^time\\(.*\\)$");

  public Optional<String> buildGroupByClause(List<String> groupBy) {
    if (groupBy == null || groupBy.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        "GROUP BY "
            + groupBy.stream()
                .map(GroupByClauseBuilder::convertTerm)
                .collect(Collectors.joining(",")));
  }

  static String convertTerm(String term) {
    return isIdentifier(term) ? "\"" + term + "\"" : term;
  }

  public static boolean isIdentifier(String term) {
    return IDENTIFIER_PATTERN.matcher(term).matches();
  }

  public static boolean isTimeBucket(String term) {
    return TIME_BUCKET_PATTERN.matcher(term.trim()).matches();
  }
}
