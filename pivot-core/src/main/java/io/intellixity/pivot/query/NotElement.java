package io.intellixity.pivot.query;

import java.util.Objects;

/** Unary NOT for a filter subtree (can wrap a {@link Condition} or a {@link LogicalGroup}). */
public final class NotElement implements QueryElement {
  private final QueryElement element;

  public NotElement(QueryElement element) {
    this.element = Objects.requireNonNull(element, "element");
  }

  public QueryElement element() { return element; }

  @Override
  public boolean equals(Object o) {
    return o instanceof NotElement n && element.equals(n.element);
  }

  @Override
  public int hashCode() { return Objects.hash("not", element); }
}
