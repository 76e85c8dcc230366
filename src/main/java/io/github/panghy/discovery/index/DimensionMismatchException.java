package io.github.panghy.discovery.index;

/**
 * Thrown when a vector's length differs from the index dimension.
 */
public class DimensionMismatchException extends IllegalArgumentException {
  private final int expected;
  private final int actual;

  public DimensionMismatchException(int expected, int actual) {
    super("Vector dimension mismatch: expected " + expected + " but was " + actual);
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
