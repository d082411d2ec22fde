package com.github.micycle1.mirrorsurf4j.model;

import java.util.Arrays;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import com.github.micycle1.mirrorsurf4j.DataShapeException;

/**
 * Scalar surface deformation sampled at scattered planar positions.
 * <p>
 * Each sample is an {@code (x, y, z)} triple where {@code z} is the deformation
 * along the optical axis. Instances are immutable; the arrays handed in are
 * copied. Sample values may be {@code NaN} (missing data), positions may not.
 * Two samples closer than {@link #DUPLICATE_TOLERANCE} times the diagonal of
 * the field's bounding box are rejected as duplicates.
 */
public final class SurfaceField {

	public static final double DUPLICATE_TOLERANCE = 1e-9;

	private final double[] x;
	private final double[] y;
	private final double[] z;

	private SurfaceField(double[] x, double[] y, double[] z) {
		this.x = x;
		this.y = y;
		this.z = z;
	}

	/**
	 * Creates a field from parallel coordinate and value arrays.
	 *
	 * @param x sample x positions
	 * @param y sample y positions
	 * @param z deformation at each sample
	 * @return validated field
	 * @throws DataShapeException       if the arrays differ in length
	 * @throws IllegalArgumentException if a position is not finite or two
	 *                                  samples share the same position
	 */
	public static SurfaceField of(double[] x, double[] y, double[] z) {
		DataShapeException.requireLength("y coordinates", y.length, x.length);
		DataShapeException.requireLength("surface values", z.length, x.length);
		for (int i = 0; i < x.length; i++) {
			if (!Double.isFinite(x[i]) || !Double.isFinite(y[i])) {
				throw new IllegalArgumentException("Sample " + i + " has a non-finite position");
			}
		}
		SurfaceField field = new SurfaceField(x.clone(), y.clone(), z.clone());
		field.checkDuplicates();
		return field;
	}

	/**
	 * Creates a field from JTS coordinates, using {@link Coordinate#getZ()} as the
	 * sample value.
	 */
	public static SurfaceField of(Coordinate[] coordinates) {
		double[] xs = new double[coordinates.length];
		double[] ys = new double[coordinates.length];
		double[] zs = new double[coordinates.length];
		for (int i = 0; i < coordinates.length; i++) {
			xs[i] = coordinates[i].getX();
			ys[i] = coordinates[i].getY();
			zs[i] = coordinates[i].getZ();
		}
		return of(xs, ys, zs);
	}

	public int size() {
		return x.length;
	}

	public double x(int i) {
		return x[i];
	}

	public double y(int i) {
		return y[i];
	}

	public double z(int i) {
		return z[i];
	}

	public double[] xs() {
		return x.clone();
	}

	public double[] ys() {
		return y.clone();
	}

	public double[] values() {
		return z.clone();
	}

	/**
	 * Returns a field at the same sample positions carrying new values.
	 */
	public SurfaceField withValues(double[] values) {
		DataShapeException.requireLength("surface values", values.length, x.length);
		return new SurfaceField(x, y, values.clone());
	}

	/**
	 * Returns a field with positions multiplied by {@code positionScale} and values
	 * by {@code valueScale}; used for unit changes (m to mm, um to mm).
	 */
	public SurfaceField scaled(double positionScale, double valueScale) {
		if (!(positionScale > 0) || !Double.isFinite(positionScale)) {
			throw new IllegalArgumentException("Position scale must be finite and > 0");
		}
		double[] xs = new double[x.length];
		double[] ys = new double[x.length];
		double[] zs = new double[x.length];
		for (int i = 0; i < x.length; i++) {
			xs[i] = x[i] * positionScale;
			ys[i] = y[i] * positionScale;
			zs[i] = z[i] * valueScale;
		}
		return new SurfaceField(xs, ys, zs);
	}

	/**
	 * Returns the samples at the given indices, in index order.
	 */
	public SurfaceField subset(int[] indices) {
		double[] xs = new double[indices.length];
		double[] ys = new double[indices.length];
		double[] zs = new double[indices.length];
		for (int k = 0; k < indices.length; k++) {
			xs[k] = x[indices[k]];
			ys[k] = y[indices[k]];
			zs[k] = z[indices[k]];
		}
		return new SurfaceField(xs, ys, zs);
	}

	/**
	 * Elementwise sum of two fields sampled at the same positions.
	 */
	public SurfaceField plus(SurfaceField other) {
		DataShapeException.requireLength("added field", other.size(), size());
		double[] zs = new double[z.length];
		for (int i = 0; i < z.length; i++) {
			if (other.x[i] != x[i] || other.y[i] != y[i]) {
				throw new IllegalArgumentException("Sample " + i + " is not at the same position in both fields");
			}
			zs[i] = z[i] + other.z[i];
		}
		return new SurfaceField(x, y, zs);
	}

	public Envelope envelope() {
		Envelope envelope = new Envelope();
		for (int i = 0; i < x.length; i++) {
			envelope.expandToInclude(x[i], y[i]);
		}
		return envelope;
	}

	public Coordinate[] toCoordinates() {
		Coordinate[] coordinates = new Coordinate[x.length];
		for (int i = 0; i < x.length; i++) {
			coordinates[i] = new Coordinate(x[i], y[i], z[i]);
		}
		return coordinates;
	}

	/**
	 * Root mean square of the finite sample values ({@code NaN} when there are
	 * none).
	 */
	public double rms() {
		double sum = 0;
		int n = 0;
		for (double v : z) {
			if (!Double.isNaN(v)) {
				sum += v * v;
				n++;
			}
		}
		return n == 0 ? Double.NaN : Math.sqrt(sum / n);
	}

	private void checkDuplicates() {
		if (x.length < 2) {
			return;
		}
		Envelope bounds = envelope();
		double tol = DUPLICATE_TOLERANCE * Math.hypot(bounds.getWidth(), bounds.getHeight());
		STRtree index = new STRtree();
		for (int i = 0; i < x.length; i++) {
			index.insert(new Envelope(x[i], x[i], y[i], y[i]), i);
		}
		for (int i = 0; i < x.length; i++) {
			Envelope query = new Envelope(x[i], x[i], y[i], y[i]);
			query.expandBy(tol);
			@SuppressWarnings("unchecked")
			List<Integer> hits = index.query(query);
			for (int j : hits) {
				if (j > i && Math.hypot(x[j] - x[i], y[j] - y[i]) <= tol) {
					throw new IllegalArgumentException("Samples " + i + " and " + j + " share position (" + x[i] + ", " + y[i] + ")");
				}
			}
		}
	}

	@Override
	public String toString() {
		return "SurfaceField[size=" + size() + ", envelope=" + envelope() + ", rms=" + rms() + "]";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SurfaceField)) {
			return false;
		}
		SurfaceField other = (SurfaceField) o;
		return Arrays.equals(x, other.x) && Arrays.equals(y, other.y) && Arrays.equals(z, other.z);
	}

	@Override
	public int hashCode() {
		return 31 * (31 * Arrays.hashCode(x) + Arrays.hashCode(y)) + Arrays.hashCode(z);
	}
}
