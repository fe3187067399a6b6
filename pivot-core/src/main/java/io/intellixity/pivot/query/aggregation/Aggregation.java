package io.intellixity.pivot.query.aggregation;

import java.util.*;

/**
 * Aggregate column of a query.
 *
 * @param kind aggregate function
 * @param field source column; required for everything except {@link Kind#COUNT}
 * @param name optional output column name; defaults to the lowercase kind
 */
public record Aggregation(Kind kind, String field, String name) {
  public enum Kind { COUNT, DISTINCT, SUM, AVG, MIN, MAX }

  public Aggregation {
    Objects.requireNonNull(kind, "kind");
    if (kind != Kind.COUNT && (field == null || field.isBlank())) {
      throw new IllegalArgumentException(kind + " requires a field");
    }
    name = (name == null || name.isBlank()) ? null : name;
  }

  public String columnName() {
    return name != null ? name : kind.name().toLowerCase(Locale.ROOT);
  }

  public static Aggregation count() { return new Aggregation(Kind.COUNT, null, null); }
  public static Aggregation distinct(String field) { return new Aggregation(Kind.DISTINCT, field, null); }
  public static Aggregation sum(String field) { return new Aggregation(Kind.SUM, field, null); }
  public static Aggregation avg(String field) { return new Aggregation(Kind.AVG, field, null); }
  public static Aggregation min(String field) { return new Aggregation(Kind.MIN, field, null); }
  public static Aggregation max(String field) { return new Aggregation(Kind.MAX, field, null); }

  public Aggregation named(String name) { return new Aggregation(kind, field, name); }

  /** Output column names, in order; repeated names get {@code _2}, {@code _3}... suffixes. */
  public static List<String> columnNames(List<Aggregation> aggregations) {
    if (aggregations == null || aggregations.isEmpty()) return List.of();
    Map<String, Integer> seen = new HashMap<>();
    List<String> out = new ArrayList<>(aggregations.size());
    for (Aggregation a : aggregations) {
      String base = a.columnName();
      int n = seen.merge(base, 1, Integer::sum);
      out.add(n == 1 ? base : base + "_" + n);
    }
    return out;
  }
}
