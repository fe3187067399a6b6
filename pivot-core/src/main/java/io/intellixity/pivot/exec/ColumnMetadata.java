package io.intellixity.pivot.exec;

import java.util.Objects;

/**
 * Describes one output column of a query.
 *
 * @param name stable column name used for alignment across queries
 * @param displayName human readable label
 * @param baseType engine type name if known, else null
 * @param source which part of the query produced the column
 */
public record ColumnMetadata(String name, String displayName, String baseType, Source source) {
  public enum Source { BREAKOUT, FIELD, AGGREGATION }

  public ColumnMetadata {
    Objects.requireNonNull(name, "name");
    displayName = (displayName == null) ? name : displayName;
  }

  public static ColumnMetadata named(String name) {
    return new ColumnMetadata(name, name, null, null);
  }
}
