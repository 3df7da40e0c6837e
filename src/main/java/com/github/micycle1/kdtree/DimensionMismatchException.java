package com.github.micycle1.kdtree;

/**
 * Thrown when a point's dimension does not match the dimension of the tree.
 */
public class DimensionMismatchException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final int expected;
	private final int actual;

	/**
	 * @param expected dimension of the tree
	 * @param actual   dimension of the offending point
	 */
	public DimensionMismatchException(int expected, int actual) {
		super("Dimension mismatch: expected " + expected + ", got " + actual);
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
