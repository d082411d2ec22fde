package com.github.micycle1.mirrorsurf4j.lut;

import java.util.Arrays;

import com.github.micycle1.mirrorsurf4j.model.LutTable;

/**
 * Piecewise-linear look-up of actuator forces.
 * <p>
 * Queries outside the ruler are clamped to the nearest boundary column; the
 * table is never extrapolated.
 */
public final class LutInterpolator {

	private LutInterpolator() {
	}

	/**
	 * Returns one force per actuator for the given control value.
	 *
	 * @param table look-up table
	 * @param query control value (same unit as the ruler)
	 * @return forces, one per actuator row
	 */
	public static double[] interpolate(LutTable table, double query) {
		if (Double.isNaN(query)) {
			throw new IllegalArgumentException("Look-up query must not be NaN");
		}
		int last = table.columnCount() - 1;
		if (query >= table.ruler(last)) {
			return table.column(last);
		}
		if (query <= table.ruler(0)) {
			return table.column(0);
		}

		int lower = lowerBracket(table.ruler(), query);
		double r0 = table.ruler(lower);
		double r1 = table.ruler(lower + 1);
		double w = (query - r0) / (r1 - r0);

		double[] out = new double[table.actuatorCount()];
		for (int a = 0; a < out.length; a++) {
			out[a] = (1 - w) * table.force(a, lower) + w * table.force(a, lower + 1);
		}
		return out;
	}

	/**
	 * Index of the last ruler entry {@code <= query}; the caller guarantees
	 * {@code ruler[0] < query < ruler[last]}.
	 */
	static int lowerBracket(double[] ruler, double query) {
		int idx = Arrays.binarySearch(ruler, query);
		return idx >= 0 ? idx : -idx - 2;
	}
}
