package com.github.micycle1.mirrorsurf4j.resample;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;
import org.locationtech.jts.geom.Envelope;

import com.github.micycle1.mirrorsurf4j.DataShapeException;
import com.github.micycle1.mirrorsurf4j.model.SurfaceField;

/**
 * Global multiquadric radial basis function interpolant,
 * {@code f(p) = sum_j w_j * sqrt((|p - p_j| / eps)^2 + 1)}.
 * <p>
 * The weights solve the dense {@code N x N} collocation system exactly (no
 * smoothing), so the surface passes through every sample and is infinitely
 * differentiable everywhere. The shape parameter {@code eps} defaults to the
 * average sample spacing estimated from the bounding box:
 * {@code (product of non-zero box edges / N)^(1 / number of non-zero edges)}.
 */
public final class MultiquadricRbf implements ScatteredInterpolant {

	private final double[] cx;
	private final double[] cy;
	private final double[] weights;
	private final double epsilon;
	private final double invEps2;

	private MultiquadricRbf(double[] cx, double[] cy, double[] weights, double epsilon) {
		this.cx = cx;
		this.cy = cy;
		this.weights = weights;
		this.epsilon = epsilon;
		this.invEps2 = 1.0 / (epsilon * epsilon);
	}

	public static MultiquadricRbf fit(SurfaceField field) {
		return fit(field, defaultEpsilon(field));
	}

	/**
	 * @param field   samples with finite values
	 * @param epsilon shape parameter, same unit as the sample positions
	 */
	public static MultiquadricRbf fit(SurfaceField field, double epsilon) {
		int n = field.size();
		if (n == 0) {
			throw new DataShapeException("Cannot fit an interpolant through an empty field");
		}
		if (!(epsilon > 0) || !Double.isFinite(epsilon)) {
			throw new IllegalArgumentException("RBF shape parameter must be finite and > 0");
		}
		double[] xs = field.xs();
		double[] ys = field.ys();
		double invEps2 = 1.0 / (epsilon * epsilon);

		DMatrixRMaj a = new DMatrixRMaj(n, n);
		DMatrixRMaj b = new DMatrixRMaj(n, 1);
		for (int i = 0; i < n; i++) {
			double v = field.z(i);
			if (!Double.isFinite(v)) {
				throw new IllegalArgumentException("Sample " + i + " has a non-finite value");
			}
			b.unsafe_set(i, 0, v);
			a.unsafe_set(i, i, 1);
			for (int j = i + 1; j < n; j++) {
				double dx = xs[i] - xs[j];
				double dy = ys[i] - ys[j];
				double phi = Math.sqrt((dx * dx + dy * dy) * invEps2 + 1);
				a.unsafe_set(i, j, phi);
				a.unsafe_set(j, i, phi);
			}
		}

		LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.lu(n);
		if (!solver.setA(a)) {
			throw new IllegalStateException("RBF collocation matrix is singular");
		}
		DMatrixRMaj w = new DMatrixRMaj(n, 1);
		solver.solve(b, w);
		return new MultiquadricRbf(xs, ys, w.getData(), epsilon);
	}

	static double defaultEpsilon(SurfaceField field) {
		Envelope env = field.envelope();
		double product = 1;
		int edges = 0;
		for (double edge : new double[] { env.getWidth(), env.getHeight() }) {
			if (edge > 0) {
				product *= edge;
				edges++;
			}
		}
		if (edges == 0) {
			return 1;
		}
		return Math.pow(product / field.size(), 1.0 / edges);
	}

	public double epsilon() {
		return epsilon;
	}

	@Override
	public double value(double x, double y) {
		double sum = 0;
		for (int j = 0; j < weights.length; j++) {
			double dx = x - cx[j];
			double dy = y - cy[j];
			sum += weights[j] * Math.sqrt((dx * dx + dy * dy) * invEps2 + 1);
		}
		return sum;
	}
}
