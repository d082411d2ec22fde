package com.github.micycle1.mirrorsurf4j.model;

import java.util.Arrays;

/**
 * Least-squares Zernike coefficients of a surface field, in Noll order (entry
 * {@code 0} is piston, Noll index 1). Coefficients carry the unit of the field
 * they were fitted to.
 */
public final class AberrationCoefficients {

	private final double[] values;

	public AberrationCoefficients(double[] values) {
		if (values.length == 0) {
			throw new IllegalArgumentException("At least one coefficient is required");
		}
		this.values = values.clone();
	}

	public int size() {
		return values.length;
	}

	/**
	 * @param i zero-based term index (Noll index minus one)
	 */
	public double get(int i) {
		return values[i];
	}

	public double[] toArray() {
		return values.clone();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof AberrationCoefficients && Arrays.equals(values, ((AberrationCoefficients) o).values);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(values);
	}

	@Override
	public String toString() {
		return "AberrationCoefficients" + Arrays.toString(values);
	}
}
