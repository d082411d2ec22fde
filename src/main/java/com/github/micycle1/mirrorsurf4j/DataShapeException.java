package com.github.micycle1.mirrorsurf4j;

/**
 * Raised when the row or column count of a table (or array) does not match
 * the number of sample points it has to be combined with.
 */
public class DataShapeException extends MirrorModelException {

	private static final long serialVersionUID = 1L;

	public DataShapeException(String message) {
		super(message);
	}

	public static void requireLength(String what, int actual, int expected) {
		if (actual != expected) {
			throw new DataShapeException(what + " has " + actual + " entries, expected " + expected);
		}
	}
}
