package com.github.micycle1.mirrorsurf4j.zernike;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

import com.github.micycle1.mirrorsurf4j.DataShapeException;
import com.github.micycle1.mirrorsurf4j.model.AberrationCoefficients;

/**
 * Least-squares projection of a sampled surface onto the {@link ZernikeBasis}.
 * <p>
 * Coordinates must already be normalized to the unit disk (divided by the
 * mirror's outer radius). Samples whose value is {@code NaN} take no part in
 * the fit and keep a {@code NaN} residual.
 */
public final class ZernikeFit {

	/** Allowed excess of {@code x^2 + y^2} over 1 for normalized coordinates. */
	public static final double UNIT_DISK_TOLERANCE = 1e-3;

	private ZernikeFit() {
	}

	/**
	 * Fits the first {@code numTerms} Zernike terms to the surface.
	 *
	 * @param values   surface values
	 * @param xNorm    normalized x coordinates
	 * @param yNorm    normalized y coordinates
	 * @param numTerms number of Noll terms, {@code 1..ZernikeBasis.MAX_TERMS}
	 * @return least-squares coefficients, in the unit of {@code values}
	 */
	public static AberrationCoefficients fit(double[] values, double[] xNorm, double[] yNorm, int numTerms) {
		ZernikeBasis.checkTermCount(numTerms);
		checkInputs(values.length, xNorm, yNorm);

		int rows = 0;
		for (double v : values) {
			if (!Double.isNaN(v)) {
				rows++;
			}
		}
		if (rows < numTerms) {
			throw new DataShapeException("Fitting " + numTerms + " terms needs at least as many valid samples, got " + rows);
		}

		DMatrixRMaj design = new DMatrixRMaj(rows, numTerms);
		DMatrixRMaj rhs = new DMatrixRMaj(rows, 1);
		int row = 0;
		for (int i = 0; i < values.length; i++) {
			if (Double.isNaN(values[i])) {
				continue;
			}
			double[] basis = ZernikeBasis.values(numTerms, xNorm[i], yNorm[i]);
			for (int t = 0; t < numTerms; t++) {
				design.unsafe_set(row, t, basis[t]);
			}
			rhs.unsafe_set(row, 0, values[i]);
			row++;
		}

		LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.leastSquares(rows, numTerms);
		if (!solver.setA(design)) {
			throw new IllegalStateException("Zernike design matrix could not be decomposed");
		}
		DMatrixRMaj coefficients = new DMatrixRMaj(numTerms, 1);
		solver.solve(rhs, coefficients);
		return new AberrationCoefficients(coefficients.getData());
	}

	/**
	 * Evaluates the Zernike sum at each point.
	 */
	public static double[] eval(AberrationCoefficients coefficients, double[] xNorm, double[] yNorm) {
		DataShapeException.requireLength("y coordinates", yNorm.length, xNorm.length);
		int numTerms = coefficients.size();
		ZernikeBasis.checkTermCount(numTerms);
		double[] out = new double[xNorm.length];
		for (int i = 0; i < xNorm.length; i++) {
			double[] basis = ZernikeBasis.values(numTerms, xNorm[i], yNorm[i]);
			double sum = 0;
			for (int t = 0; t < numTerms; t++) {
				sum += coefficients.get(t) * basis[t];
			}
			out[i] = sum;
		}
		return out;
	}

	/**
	 * Surface minus the evaluated fit.
	 */
	public static double[] residual(double[] values, AberrationCoefficients coefficients, double[] xNorm, double[] yNorm) {
		DataShapeException.requireLength("x coordinates", xNorm.length, values.length);
		double[] fitted = eval(coefficients, xNorm, yNorm);
		double[] out = new double[values.length];
		for (int i = 0; i < values.length; i++) {
			out[i] = values[i] - fitted[i];
		}
		return out;
	}

	/**
	 * Sum of squares of the non-{@code NaN} entries.
	 */
	public static double energy(double[] residual) {
		double sum = 0;
		for (double v : residual) {
			if (!Double.isNaN(v)) {
				sum += v * v;
			}
		}
		return sum;
	}

	private static void checkInputs(int count, double[] xNorm, double[] yNorm) {
		DataShapeException.requireLength("x coordinates", xNorm.length, count);
		DataShapeException.requireLength("y coordinates", yNorm.length, count);
		for (int i = 0; i < count; i++) {
			double r2 = xNorm[i] * xNorm[i] + yNorm[i] * yNorm[i];
			if (!(r2 <= 1 + UNIT_DISK_TOLERANCE)) {
				throw new IllegalArgumentException("Sample " + i + " lies outside the unit disk (r^2 = " + r2 + "); normalize by the outer radius first");
			}
		}
	}
}
