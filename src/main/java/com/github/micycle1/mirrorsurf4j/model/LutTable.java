package com.github.micycle1.mirrorsurf4j.model;

import com.github.micycle1.mirrorsurf4j.DataShapeException;
import com.github.micycle1.mirrorsurf4j.MalformedTableException;

/**
 * Actuator force look-up table indexed by a scalar control variable (zenith
 * angle).
 * <p>
 * The first row of the source table is the ruler of control values, which
 * must be strictly increasing; every further row holds one actuator's force at
 * each ruler value.
 */
public final class LutTable {

	private final double[] ruler;
	private final double[][] forces;

	/**
	 * @param ruler  control values, strictly increasing
	 * @param forces {@code forces[actuator][column]}, one column per ruler value
	 * @throws MalformedTableException if the ruler is not strictly increasing
	 * @throws DataShapeException      if a force row does not match the ruler
	 */
	public LutTable(double[] ruler, double[][] forces) {
		if (ruler.length == 0) {
			throw new MalformedTableException("Look-up table has an empty ruler");
		}
		for (int i = 1; i < ruler.length; i++) {
			if (!(ruler[i] > ruler[i - 1])) {
				throw new MalformedTableException(
						"Look-up table ruler is not strictly increasing at column " + i + " (" + ruler[i - 1] + " -> " + ruler[i] + ")");
			}
		}
		this.ruler = ruler.clone();
		this.forces = new double[forces.length][];
		for (int a = 0; a < forces.length; a++) {
			DataShapeException.requireLength("force row " + a, forces[a].length, ruler.length);
			this.forces[a] = forces[a].clone();
		}
	}

	/**
	 * Splits a raw table into ruler (row 0) and actuator rows.
	 */
	public static LutTable fromRows(double[][] rows) {
		if (rows.length == 0) {
			throw new MalformedTableException("Look-up table is empty");
		}
		double[][] forces = new double[rows.length - 1][];
		System.arraycopy(rows, 1, forces, 0, forces.length);
		return new LutTable(rows[0], forces);
	}

	public int columnCount() {
		return ruler.length;
	}

	public int actuatorCount() {
		return forces.length;
	}

	public double ruler(int column) {
		return ruler[column];
	}

	public double[] ruler() {
		return ruler.clone();
	}

	public double force(int actuator, int column) {
		return forces[actuator][column];
	}

	public double[] column(int column) {
		double[] out = new double[forces.length];
		for (int a = 0; a < forces.length; a++) {
			out[a] = forces[a][column];
		}
		return out;
	}
}
