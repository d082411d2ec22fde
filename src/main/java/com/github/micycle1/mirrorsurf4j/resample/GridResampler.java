package com.github.micycle1.mirrorsurf4j.resample;

import java.util.Objects;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.mirrorsurf4j.ConfigurationException;
import com.github.micycle1.mirrorsurf4j.model.GridResidueMap;
import com.github.micycle1.mirrorsurf4j.model.MirrorGeometry;
import com.github.micycle1.mirrorsurf4j.model.SurfaceField;

/**
 * Resamples a scattered surface onto the regular grid expected by the optical
 * design tool, with first and mixed partial derivatives at every node.
 * <p>
 * The requested {@code nx x ny} grid is padded by {@link #PADDING} nodes on
 * every side so that the tool's own stencils have neighbours at the true edge.
 * The padded grid spans the outer diameter scaled by the per-axis extension
 * factor {@code (padded - 1) / (requested - 1)}. Nodes outside the annulus
 * {@code [inner / extFr, outer * extFr]}, where {@code extFr} is the geometric
 * mean of the two axis factors, are written as zero (value and derivatives).
 * Inside it the fitted interpolant is evaluated and differentiated by central
 * differences with step {@code 1e-4 * min(pitchX, pitchY)}.
 * <p>
 * Node rows run over y, starting at the most positive y (the consumer reads
 * from negative y after flipping); columns run over x from negative to
 * positive.
 */
public final class GridResampler {

	private static final Logger LOGGER = LoggerFactory.getLogger(GridResampler.class);

	/** Extra nodes on each side of the requested grid. */
	public static final int PADDING = 2;
	/** Finite-difference step relative to the smaller pitch. */
	public static final double STEP_FRACTION = 1e-4;

	private final ScatteredInterpolant.Factory interpolantFactory;

	public GridResampler() {
		this(MultiquadricRbf::fit);
	}

	public GridResampler(ScatteredInterpolant.Factory interpolantFactory) {
		this.interpolantFactory = Objects.requireNonNull(interpolantFactory, "interpolantFactory");
	}

	/**
	 * Layout of a padded grid: node counts, pitches, origin and the annulus
	 * inflation factor.
	 */
	public static record GridLayout(int xCount, int yCount, double pitchX, double pitchY, double minX, double minY, double extFr) {

		public static GridLayout of(MirrorGeometry geometry, int nx, int ny) {
			if (nx < 2 || ny < 2) {
				throw new ConfigurationException("Grid needs at least 2 nodes per axis, got " + nx + "x" + ny);
			}
			int xCount = nx + 2 * PADDING;
			int yCount = ny + 2 * PADDING;
			double extFx = (xCount - 1) / (double) (nx - 1);
			double extFy = (yCount - 1) / (double) (ny - 1);
			double extFr = Math.sqrt(extFx * extFy);
			double pitchX = geometry.outerRadius() * 2 * extFx / (xCount - 1);
			double pitchY = geometry.outerRadius() * 2 * extFy / (yCount - 1);
			double minX = -0.5 * (xCount - 1) * pitchX;
			double minY = -0.5 * (yCount - 1) * pitchY;
			return new GridLayout(xCount, yCount, pitchX, pitchY, minX, minY, extFr);
		}

		public double x(int col) {
			return minX + col * pitchX;
		}

		/**
		 * y of a node row, already flipped to the consumer's convention.
		 */
		public double y(int row) {
			return -(minY + row * pitchY);
		}

		public double step() {
			return STEP_FRACTION * Math.min(pitchX, pitchY);
		}

		/**
		 * Whether a node at radius {@code r} lies in the inflated valid annulus.
		 */
		public boolean isInside(MirrorGeometry geometry, double r) {
			return !(r < geometry.innerRadius() / extFr || r > geometry.outerRadius() * extFr);
		}
	}

	/**
	 * Resamples with the default multiquadric interpolant.
	 */
	public static GridResidueMap resample(SurfaceField field, MirrorGeometry geometry, int nx, int ny) {
		return new GridResampler().sample(field, geometry, nx, ny);
	}

	/**
	 * Fits the interpolant through {@code field} and samples it on the padded
	 * grid. {@code NaN} samples are left out of the fit.
	 *
	 * @param field    surface in the tool frame; positions and values in mm
	 * @param geometry annulus radii in mm
	 * @param nx       requested nodes along x (before padding)
	 * @param ny       requested nodes along y (before padding)
	 */
	public GridResidueMap sample(SurfaceField field, MirrorGeometry geometry, int nx, int ny) {
		GridLayout layout = GridLayout.of(geometry, nx, ny);
		ScatteredInterpolant f = interpolantFactory.fit(finiteSamples(field));

		int xCount = layout.xCount();
		double eps = layout.step();
		double[] nodes = new double[GridResidueMap.FIELDS_PER_NODE * xCount * layout.yCount()];

		IntStream.range(0, layout.yCount()).parallel().forEach(row -> {
			double y = layout.y(row);
			for (int col = 0; col < xCount; col++) {
				double x = layout.x(col);
				if (!layout.isInside(geometry, Math.hypot(x, y))) {
					continue; // zero-filled
				}
				int o = (row * xCount + col) * GridResidueMap.FIELDS_PER_NODE;
				nodes[o] = f.value(x, y);
				nodes[o + 1] = (f.value(x + eps, y) - f.value(x - eps, y)) / (2.0 * eps);
				nodes[o + 2] = (f.value(x, y + eps) - f.value(x, y - eps)) / (2.0 * eps);
				double dxUp = (f.value(x + eps, y + eps) - f.value(x - eps, y + eps)) / (2.0 * eps);
				double dxDown = (f.value(x + eps, y - eps) - f.value(x - eps, y - eps)) / (2.0 * eps);
				nodes[o + 3] = (dxUp - dxDown) / (2.0 * eps);
			}
		});

		GridResidueMap map = new GridResidueMap(xCount, layout.yCount(), layout.pitchX(), layout.pitchY(), nodes);
		if (LOGGER.isDebugEnabled()) {
			int zero = 0;
			for (int row = 0; row < map.yCount(); row++) {
				for (int col = 0; col < map.xCount(); col++) {
					if (map.isZero(row, col)) {
						zero++;
					}
				}
			}
			LOGGER.debug("Resampled {} samples onto {}x{} grid (pitch {} x {}), {} nodes zero-filled", field.size(), xCount, layout.yCount(),
					layout.pitchX(), layout.pitchY(), zero);
		}
		return map;
	}

	private static SurfaceField finiteSamples(SurfaceField field) {
		int finite = 0;
		for (int i = 0; i < field.size(); i++) {
			if (Double.isFinite(field.z(i))) {
				finite++;
			}
		}
		if (finite == field.size()) {
			return field;
		}
		int[] keep = new int[finite];
		int k = 0;
		for (int i = 0; i < field.size(); i++) {
			if (Double.isFinite(field.z(i))) {
				keep[k++] = i;
			}
		}
		LOGGER.debug("Dropping {} non-finite samples before interpolation", field.size() - finite);
		return field.subset(keep);
	}
}
