package io.intellixity.pivot.plan;

import io.intellixity.pivot.query.QueryValidationException;

import java.util.*;

/**
 * Enumerates the breakout subsets (by index) a pivot grid needs: subtotal rows, row totals, subtotals
 * within row totals, column grand totals and the overall grand total.
 */
public final class BreakoutCombinations {
  private BreakoutCombinations() {}

  /**
   * Returns the distinct breakout index subsets ordered by {@link GroupNumbers#groupNumber} ascending.
   *
   * A null or empty {@code pivotRows} is read as every breakout, in order. Each subset keeps the index order in
   * which it was first listed.
   *
   * @throws InvalidPivotRequestException if an axis references an index {@code >= breakoutCount}
   */
  public static List<List<Integer>> enumerate(int breakoutCount, List<Integer> pivotRows, List<Integer> pivotCols) {
    validate(breakoutCount, pivotRows, pivotCols);

    List<Integer> rows = (pivotRows == null || pivotRows.isEmpty()) ? range(breakoutCount) : pivotRows;
    List<Integer> cols = (pivotCols == null) ? List.of() : pivotCols;

    List<List<Integer>> candidates = new ArrayList<>();
    // subtotal rows crossed with every column breakout
    for (int i = 1; i < rows.size(); i++) candidates.add(concat(rows.subList(0, i), cols));
    // row totals
    candidates.add(rows);
    // subtotal levels within row totals
    for (int i = 1; i < rows.size(); i++) candidates.add(rows.subList(0, i));
    // column grand totals
    candidates.add(cols);
    // grand total
    candidates.add(List.of());

    Map<Set<Integer>, List<Integer>> distinct = new LinkedHashMap<>();
    for (List<Integer> c : candidates) {
      LinkedHashSet<Integer> key = new LinkedHashSet<>(c);
      distinct.putIfAbsent(key, List.copyOf(key));
    }

    List<List<Integer>> out = new ArrayList<>(distinct.values());
    out.sort(Comparator.comparingLong(c -> GroupNumbers.groupNumber(breakoutCount, c)));
    return out;
  }

  /** Rejects axis indexes outside {@code [0, breakoutCount)}; rows are checked before cols. */
  public static void validate(int breakoutCount, List<Integer> pivotRows, List<Integer> pivotCols) {
    validateAxis(PivotAxis.ROWS, pivotRows, breakoutCount);
    validateAxis(PivotAxis.COLS, pivotCols, breakoutCount);
  }

  private static void validateAxis(PivotAxis axis, List<Integer> indexes, int breakoutCount) {
    if (indexes == null) return;
    for (Integer i : indexes) {
      if (i == null) throw new QueryValidationException("Invalid " + axis.key() + ": null breakout index");
      if (i < 0 || i >= breakoutCount) throw new InvalidPivotRequestException(axis, i, breakoutCount);
    }
  }

  private static List<Integer> range(int n) {
    List<Integer> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) out.add(i);
    return out;
  }

  private static List<Integer> concat(List<Integer> a, List<Integer> b) {
    List<Integer> out = new ArrayList<>(a.size() + b.size());
    out.addAll(a);
    out.addAll(b);
    return out;
  }
}
