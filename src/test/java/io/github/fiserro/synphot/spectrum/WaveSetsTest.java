package io.github.fiserro.synphot.spectrum;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class WaveSetsTest {

  private static final double[] A = {1000, 2000, 3000};
  private static final double[] B = {1500, 2000, 4000};
  private static final double[] C = {500, 2500, 3000, 5000};

  @Test
  void merge_shouldGiveSortedUnionWithoutDuplicates() {
    assertArrayEquals(new double[] {1000, 1500, 2000, 3000, 4000}, WaveSets.merge(A, B));
  }

  @Test
  void merge_withItself_shouldBeIdempotent() {
    assertArrayEquals(A, WaveSets.merge(A, A));
  }

  @Test
  void merge_shouldBeCommutativeAndAssociative() {
    assertArrayEquals(WaveSets.merge(A, B), WaveSets.merge(B, A));
    assertArrayEquals(
        WaveSets.merge(WaveSets.merge(A, B), C),
        WaveSets.merge(A, WaveSets.merge(B, C)));
  }

  @Test
  void merge_withNull_shouldReturnOtherOperand() {
    assertSame(A, WaveSets.merge(null, A));
    assertSame(B, WaveSets.merge(B, null));
    assertNull(WaveSets.merge(null, null));
  }

  @Test
  void intersect_shouldExcludeBounds() {
    assertArrayEquals(new double[] {2000}, WaveSets.intersect(A, 1000, 3000));
  }

  @Test
  void trim_shouldIncludeBounds() {
    assertArrayEquals(A, WaveSets.trim(A, 1000, 3000));
    assertArrayEquals(new double[] {2000, 3000}, WaveSets.trim(A, 1500, 3000));
  }

  @Test
  void intersect_withEmptyRange_shouldGiveEmptyGrid() {
    assertEquals(0, WaveSets.intersect(A, 3000, 1000).length);
  }

  @Test
  void logSpaced_shouldHitBothEndsAndGrow() {
    double[] grid = WaveSets.logSpaced(500, 26000, 10000);

    assertEquals(10000, grid.length);
    assertEquals(500, grid[0], 1e-9);
    assertEquals(26000, grid[grid.length - 1], 1e-6);
    for (int i = 1; i < grid.length; i++) {
      assertTrue(grid[i] > grid[i - 1], "not ascending at " + i);
    }
  }

  @Test
  void linearSpaced_shouldStepEvenly() {
    assertArrayEquals(new double[] {0, 2.5, 5, 7.5, 10}, WaveSets.linearSpaced(0, 10, 5), 1e-12);
  }

  @Test
  void logSpaced_withNonPositiveMinimum_shouldFail() {
    assertThrows(IllegalArgumentException.class, () -> WaveSets.logSpaced(0, 100, 10));
  }
}
