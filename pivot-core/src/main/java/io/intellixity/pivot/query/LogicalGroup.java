package io.intellixity.pivot.query;

import java.util.*;

public final class LogicalGroup implements QueryElement {
  private final Clause clause;
  private final List<QueryElement> elements;

  public LogicalGroup(Clause clause, List<QueryElement> elements) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.elements = List.copyOf(elements == null ? List.of() : elements);
  }

  public Clause clause() { return clause; }
  public List<QueryElement> elements() { return elements; }

  @Override
  public boolean equals(Object o) {
    return o instanceof LogicalGroup g && clause == g.clause && elements.equals(g.elements);
  }

  @Override
  public int hashCode() { return Objects.hash(clause, elements); }

  /** Back-compat map form: {clause: AND, elements: [...]}; a missing or unknown clause means AND. */
  @SuppressWarnings("unchecked")
  static LogicalGroup fromMap(Map<String,Object> m) {
    Object raw = m.get("clause");
    Clause clause;
    if (raw == null) {
      clause = Clause.AND;
    } else {
      try {
        clause = Clause.valueOf(String.valueOf(raw).toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        clause = Clause.AND;
      }
    }
    List<QueryElement> els = new ArrayList<>();
    if (m.get("elements") instanceof List<?> list) {
      for (Object o : list) {
        if (!(o instanceof Map<?,?> child)) throw new IllegalArgumentException("Unsupported group element: " + o);
        Map<String,Object> cm = (Map<String,Object>) child;
        els.add(cm.containsKey("clause") || cm.containsKey("elements") ? fromMap(cm) : Condition.fromMap(cm));
      }
    }
    return new LogicalGroup(clause, els);
  }
}
