package truthtable.core;

import java.util.ArrayList;
import java.util.List;

/** Helpers for enumerating truth assignments in binary counting order. */
public final class Assignments {
  private Assignments() {}

  /** Number of assignments over {@code size} operands. */
  public static long count(int size) {
    if (size < 0 || size > 62) {
      throw new IllegalArgumentException("size out of range: " + size);
    }
    return 1L << size;
  }

  /**
   * Decodes {@code mask} with the first operand as the most significant bit, so masks {@code 0..2^n
   * - 1} visit {@code (F..F)} through {@code (T..T)} in counting order.
   */
  public static boolean[] fromMask(long mask, int size) {
    boolean[] assignment = new boolean[size];
    for (int i = 0; i < size; i++) {
      assignment[i] = ((mask >>> (size - 1 - i)) & 1L) != 0;
    }
    return assignment;
  }

  public static List<Boolean> toList(boolean[] assignment) {
    List<Boolean> values = new ArrayList<>(assignment.length);
    for (boolean value : assignment) {
      values.add(value);
    }
    return values;
  }
}
