package com.github.micycle1.mirrorsurf4j;

/**
 * Raised when a reference table is structurally invalid, e.g. a look-up table
 * whose ruler row is not strictly increasing, or a text table with ragged
 * rows.
 */
public class MalformedTableException extends MirrorModelException {

	private static final long serialVersionUID = 1L;

	public MalformedTableException(String message) {
		super(message);
	}

	public MalformedTableException(String message, Throwable cause) {
		super(message, cause);
	}
}
