package com.github.micycle1.mirrorsurf4j.io;

import com.github.micycle1.mirrorsurf4j.DataShapeException;
import com.github.micycle1.mirrorsurf4j.MalformedTableException;

/**
 * Rectangular numeric table as read from a reference data file (FEA influence
 * coefficients, forces, look-up tables). Immutable.
 */
public final class ReferenceTable {

	private final String source;
	private final double[][] rows;
	private final int columnCount;

	/**
	 * @param source description of where the table came from, used in messages
	 * @param rows   table rows, all of the same length
	 * @throws MalformedTableException if rows differ in length
	 */
	public ReferenceTable(String source, double[][] rows) {
		this.source = source;
		this.columnCount = rows.length == 0 ? 0 : rows[0].length;
		this.rows = new double[rows.length][];
		for (int r = 0; r < rows.length; r++) {
			if (rows[r].length != columnCount) {
				throw new MalformedTableException(source + ": row " + r + " has " + rows[r].length + " columns, expected " + columnCount);
			}
			this.rows[r] = rows[r].clone();
		}
	}

	public int rowCount() {
		return rows.length;
	}

	public int columnCount() {
		return columnCount;
	}

	public double value(int row, int column) {
		return rows[row][column];
	}

	public double[] row(int row) {
		return rows[row].clone();
	}

	public double[] column(int column) {
		if (column < 0 || column >= columnCount) {
			throw new DataShapeException(source + " has " + columnCount + " columns, column " + column + " requested");
		}
		double[] out = new double[rows.length];
		for (int r = 0; r < rows.length; r++) {
			out[r] = rows[r][column];
		}
		return out;
	}

	public double[][] toArray() {
		double[][] out = new double[rows.length][];
		for (int r = 0; r < rows.length; r++) {
			out[r] = rows[r].clone();
		}
		return out;
	}

	/**
	 * @throws DataShapeException unless the table has exactly {@code expected}
	 *                            rows
	 */
	public ReferenceTable requireRows(int expected) {
		if (rows.length != expected) {
			throw new DataShapeException(source + " has " + rows.length + " rows, expected " + expected + " (one per sample point)");
		}
		return this;
	}

	/**
	 * @throws DataShapeException unless the table has at least {@code minimum}
	 *                            columns
	 */
	public ReferenceTable requireColumns(int minimum) {
		if (columnCount < minimum) {
			throw new DataShapeException(source + " has " + columnCount + " columns, at least " + minimum + " expected");
		}
		return this;
	}

	@Override
	public String toString() {
		return "ReferenceTable[" + source + ", " + rows.length + "x" + columnCount + "]";
	}
}
