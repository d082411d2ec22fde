package com.github.micycle1.mirrorsurf4j.zernike;

import com.github.micycle1.mirrorsurf4j.ConfigurationException;

/**
 * Noll-ordered, Noll-normalized Zernike polynomials on the unit disk.
 * <p>
 * Term {@code j} (1-based Noll index) has radial order {@code n} and azimuthal
 * frequency {@code m}; even {@code j} take the cosine branch, odd {@code j} the
 * sine branch. With this normalization each term has unit RMS over the disk,
 * so e.g. {@code Z2 = 2x}, {@code Z4 = sqrt(3)(2r^2 - 1)} and
 * {@code Z6 = sqrt(6)(x^2 - y^2)}.
 */
public final class ZernikeBasis {

	/** Radial orders 0..14. */
	public static final int MAX_TERMS = 120;

	private static final int[] N = new int[MAX_TERMS + 1];
	private static final int[] M = new int[MAX_TERMS + 1];
	private static final double[][] RADIAL = new double[MAX_TERMS + 1][];
	private static final double[] NORM = new double[MAX_TERMS + 1];

	static {
		for (int j = 1; j <= MAX_TERMS; j++) {
			int[] nm = nollToNm(j);
			N[j] = nm[0];
			M[j] = nm[1];
			RADIAL[j] = radialCoefficients(nm[0], Math.abs(nm[1]));
			NORM[j] = nm[1] == 0 ? Math.sqrt(nm[0] + 1) : Math.sqrt(2.0 * (nm[0] + 1));
		}
	}

	private ZernikeBasis() {
	}

	/**
	 * Rejects term counts the basis cannot represent.
	 *
	 * @throws ConfigurationException if {@code numTerms} is not in
	 *                                {@code [1, MAX_TERMS]}
	 */
	public static void checkTermCount(int numTerms) {
		if (numTerms < 1 || numTerms > MAX_TERMS) {
			throw new ConfigurationException("Number of Zernike terms must be in [1, " + MAX_TERMS + "], got " + numTerms);
		}
	}

	/**
	 * Radial order and signed azimuthal frequency of a Noll index; negative
	 * {@code m} denotes the sine branch.
	 */
	public static int[] nollToNm(int j) {
		if (j < 1) {
			throw new IllegalArgumentException("Noll index must be >= 1");
		}
		int n = (int) ((-1.0 + Math.sqrt(8.0 * (j - 1) + 1)) / 2.0);
		int p = j - n * (n + 1) / 2;
		int k = n % 2;
		int m = ((p + k) / 2) * 2 - k;
		if (m != 0 && j % 2 != 0) {
			m = -m;
		}
		return new int[] { n, m };
	}

	public static int radialOrder(int j) {
		return N[j];
	}

	public static int azimuthalFrequency(int j) {
		return M[j];
	}

	/**
	 * Evaluates term {@code j} (1-based Noll index) at a point of the unit disk.
	 */
	public static double value(int j, double x, double y) {
		if (j < 1 || j > MAX_TERMS) {
			throw new IllegalArgumentException("Noll index must be in [1, " + MAX_TERMS + "], got " + j);
		}
		double r = Math.hypot(x, y);
		double radial = radial(j, r);
		int m = M[j];
		if (m == 0) {
			return NORM[j] * radial;
		}
		double theta = Math.atan2(y, x);
		double angular = m > 0 ? Math.cos(m * theta) : Math.sin(-m * theta);
		return NORM[j] * radial * angular;
	}

	/**
	 * Evaluates the first {@code numTerms} terms at one point.
	 */
	public static double[] values(int numTerms, double x, double y) {
		double r = Math.hypot(x, y);
		double theta = Math.atan2(y, x);
		double[] out = new double[numTerms];
		for (int j = 1; j <= numTerms; j++) {
			int m = M[j];
			double radial = radial(j, r);
			if (m == 0) {
				out[j - 1] = NORM[j] * radial;
			} else {
				out[j - 1] = NORM[j] * radial * (m > 0 ? Math.cos(m * theta) : Math.sin(-m * theta));
			}
		}
		return out;
	}

	private static double radial(int j, double r) {
		// Horner over r^2 from the highest power: R(r) = r^|m| * sum c_k r^(2k)
		double[] c = RADIAL[j];
		double r2 = r * r;
		double sum = 0;
		for (int k = c.length - 1; k >= 0; k--) {
			sum = sum * r2 + c[k];
		}
		return sum * Math.pow(r, Math.abs(M[j]));
	}

	/**
	 * Coefficients {@code c_k} of {@code R_n^m(r) = r^m * sum_k c_k r^(2k)}.
	 */
	private static double[] radialCoefficients(int n, int m) {
		int terms = (n - m) / 2 + 1;
		double[] c = new double[terms];
		for (int s = 0; s < terms; s++) {
			double v = factorial(n - s) / (factorial(s) * factorial((n + m) / 2 - s) * factorial((n - m) / 2 - s));
			// power n - 2s = m + 2k
			int k = (n - 2 * s - m) / 2;
			c[k] = (s % 2 == 0) ? v : -v;
		}
		return c;
	}

	private static double factorial(int n) {
		double f = 1;
		for (int i = 2; i <= n; i++) {
			f *= i;
		}
		return f;
	}
}
