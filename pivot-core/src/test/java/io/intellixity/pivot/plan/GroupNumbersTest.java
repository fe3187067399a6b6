package io.intellixity.pivot.plan;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class GroupNumbersTest {
  @Test
  void fullSetIsZeroAndEmptySetIsAllOnes() {
    assertEquals(0L, GroupNumbers.groupNumber(3, List.of(0, 1, 2)));
    assertEquals(7L, GroupNumbers.groupNumber(3, List.of()));
    assertEquals(7L, GroupNumbers.allAbsent(3));
    assertEquals(0L, GroupNumbers.groupNumber(0, List.of()));
  }

  @Test
  void presentBreakoutsClearTheirBit() {
    assertEquals(5L, GroupNumbers.groupNumber(3, List.of(1)));
    assertEquals(1L, GroupNumbers.groupNumber(3, List.of(1, 2)));
    assertEquals(4L, GroupNumbers.groupNumber(3, List.of(0, 1)));
  }

  @Test
  void orderOfIndexesDoesNotMatter() {
    assertEquals(GroupNumbers.groupNumber(4, List.of(0, 2, 3)), GroupNumbers.groupNumber(4, List.of(3, 0, 2)));
    assertEquals(GroupNumbers.groupNumber(4, List.of(0, 2, 3)), GroupNumbers.groupNumber(4, List.of(2, 3, 0)));
  }

  @Test
  void repeatedIndexCountsOnce() {
    assertEquals(GroupNumbers.groupNumber(3, List.of(1)), GroupNumbers.groupNumber(3, List.of(1, 1)));
  }

  @Test
  void supportsSixtyTwoBreakouts() {
    assertEquals(Long.MAX_VALUE >> 1, GroupNumbers.allAbsent(62));
    assertEquals(Long.MAX_VALUE >> 1 ^ (1L << 61), GroupNumbers.groupNumber(62, List.of(61)));
    assertThrows(IllegalArgumentException.class, () -> GroupNumbers.groupNumber(63, List.of()));
  }

  @Test
  void rejectsOutOfRangeIndex() {
    assertThrows(IllegalArgumentException.class, () -> GroupNumbers.groupNumber(3, List.of(3)));
    assertThrows(IllegalArgumentException.class, () -> GroupNumbers.groupNumber(3, List.of(-1)));
  }
}
