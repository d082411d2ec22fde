package com.github.micycle1.mirrorsurf4j.corrector;

import com.github.micycle1.mirrorsurf4j.DataShapeException;

/**
 * Combinations of tabulated FEA influence vectors shared by all mirror types.
 */
public final class Influence {

	private Influence() {
	}

	/**
	 * Gravity print-through relative to the pre-compensated pose:
	 * {@code [Z cos(t) + H sin(t)] - [Z cos(t0) + H sin(t0)]}.
	 *
	 * @param zenith               response with the telescope pointing at zenith
	 * @param horizon              response with the telescope pointing at horizon
	 * @param zenithAngle          zenith angle {@code t}, radians
	 * @param preCompensationAngle elevation {@code t0} already compensated,
	 *                             radians
	 */
	public static double[] printThrough(double[] zenith, double[] horizon, double zenithAngle, double preCompensationAngle) {
		DataShapeException.requireLength("horizon response", horizon.length, zenith.length);
		double c = Math.cos(zenithAngle);
		double s = Math.sin(zenithAngle);
		double c0 = Math.cos(preCompensationAngle);
		double s0 = Math.sin(preCompensationAngle);
		double[] out = new double[zenith.length];
		for (int i = 0; i < out.length; i++) {
			out[i] = (zenith[i] * c + horizon[i] * s) - (zenith[i] * c0 + horizon[i] * s0);
		}
		return out;
	}

	/**
	 * {@code sum_k weights[k] * responses[k]}, elementwise.
	 */
	public static double[] superpose(double[] weights, double[][] responses) {
		if (weights.length != responses.length) {
			throw new IllegalArgumentException(weights.length + " weights for " + responses.length + " responses");
		}
		int n = responses.length == 0 ? 0 : responses[0].length;
		double[] out = new double[n];
		for (int k = 0; k < responses.length; k++) {
			DataShapeException.requireLength("influence vector " + k, responses[k].length, n);
			double w = weights[k];
			for (int i = 0; i < n; i++) {
				out[i] += w * responses[k][i];
			}
		}
		return out;
	}
}
