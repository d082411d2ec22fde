package com.github.micycle1.mirrorsurf4j.corrector;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.mirrorsurf4j.ConfigurationException;
import com.github.micycle1.mirrorsurf4j.geom.FrameTransform;
import com.github.micycle1.mirrorsurf4j.io.ReferenceTable;
import com.github.micycle1.mirrorsurf4j.io.ReferenceTableReader;
import com.github.micycle1.mirrorsurf4j.model.LutTable;
import com.github.micycle1.mirrorsurf4j.model.MirrorGeometry;
import com.github.micycle1.mirrorsurf4j.model.SurfaceField;
import com.github.micycle1.mirrorsurf4j.model.ThermalGradients;

/**
 * Surface model of the secondary mirror (M2).
 * <p>
 * A single FEA table provides, per sample, the columns
 * {@code x y zenithDz horizonDz axialDz radialDz}: the surface response to
 * gravity along the zenith and horizon directions and to a unit axial and
 * radial temperature gradient. Sample positions come from the first two
 * columns of the bending-mode grid table, whose rows match the FEA rows.
 */
public final class SecondaryMirrorCorrector implements SurfaceCorrector {

	private static final Logger LOGGER = LoggerFactory.getLogger(SecondaryMirrorCorrector.class);

	public static final String NAME = "M2";
	public static final MirrorGeometry GEOMETRY = new MirrorGeometry(0.9, 1.71);
	public static final int DEFAULT_NUM_TERMS = 22;

	private static final int ZENITH_COL = 2;
	private static final int HORIZON_COL = 3;
	private static final int AXIAL_COL = 4;
	private static final int RADIAL_COL = 5;

	/**
	 * Where to find the secondary's reference data.
	 *
	 * @param dataDir     directory holding the tables
	 * @param feaFile     FEA influence table
	 * @param feaSkipRows header lines of the FEA table
	 * @param gridFile    bending-mode grid table (x, y first)
	 * @param forceFile   actuator force table
	 * @param lutFile     optional look-up table, {@code null} if none
	 */
	public static record Config(Path dataDir, String feaFile, int feaSkipRows, String gridFile, String forceFile, String lutFile) {

		public Config {
			Objects.requireNonNull(dataDir, "dataDir");
			Objects.requireNonNull(feaFile, "feaFile");
			Objects.requireNonNull(gridFile, "gridFile");
			Objects.requireNonNull(forceFile, "forceFile");
		}

		public static Config defaults(Path dataDir) {
			return new Config(dataDir, "M2_GT_FEA.txt", 1, "M2_1um_grid.DAT", "M2_1um_force.DAT", null);
		}

		public Config withLutFile(String file) {
			return new Config(dataDir, feaFile, feaSkipRows, gridFile, forceFile, file);
		}
	}

	private final ReferenceTable fea;
	private final ReferenceTable forces;
	private final LutTable lut;
	private final SurfaceField positions;
	private final List<MirrorSegment> segments;

	/**
	 * @param fea    FEA influence table, at least 6 columns
	 * @param grid   bending-mode grid, x and y in the first two columns
	 * @param forces actuator force table
	 * @param lut    look-up table, may be {@code null}
	 */
	public SecondaryMirrorCorrector(ReferenceTable fea, ReferenceTable grid, ReferenceTable forces, LutTable lut) {
		grid.requireColumns(2);
		this.fea = fea.requireColumns(RADIAL_COL + 1).requireRows(grid.rowCount());
		this.forces = Objects.requireNonNull(forces, "forces");
		this.lut = lut;
		double[] x = grid.column(0);
		this.positions = SurfaceField.of(x, grid.column(1), new double[x.length]);
		this.segments = List.of(new MirrorSegment(NAME, GEOMETRY, IntStream.range(0, x.length).toArray()));
	}

	public static SecondaryMirrorCorrector load(Config config) throws IOException {
		Path dir = config.dataDir();
		ReferenceTable fea = ReferenceTableReader.read(dir.resolve(config.feaFile()), config.feaSkipRows());
		ReferenceTable grid = ReferenceTableReader.read(dir.resolve(config.gridFile()));
		ReferenceTable forces = ReferenceTableReader.read(dir.resolve(config.forceFile()));
		LutTable lut = null;
		if (config.lutFile() != null) {
			lut = LutTable.fromRows(ReferenceTableReader.read(dir.resolve(config.lutFile())).toArray());
		}
		SecondaryMirrorCorrector corrector = new SecondaryMirrorCorrector(fea, grid, forces, lut);
		LOGGER.info("Loaded {} surface model with {} samples from {}", NAME, corrector.positions.size(), dir);
		return corrector;
	}

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public MirrorGeometry geometry() {
		return GEOMETRY;
	}

	@Override
	public FrameTransform frame() {
		return FrameTransform.SECONDARY;
	}

	@Override
	public List<MirrorSegment> segments() {
		return segments;
	}

	@Override
	public SurfaceField samplePositions() {
		return positions;
	}

	@Override
	public ReferenceTable actuatorForces() {
		return forces;
	}

	@Override
	public Optional<LutTable> lut() {
		return Optional.ofNullable(lut);
	}

	@Override
	public int defaultNumTerms() {
		return DEFAULT_NUM_TERMS;
	}

	@Override
	public double[] printThrough(double zenithAngle, double preCompensationAngle) {
		return Influence.printThrough(fea.column(ZENITH_COL), fea.column(HORIZON_COL), zenithAngle, preCompensationAngle);
	}

	@Override
	public double[] thermalCorrection(ThermalGradients gradients) {
		if (gradients.hasLateralTerms()) {
			throw new ConfigurationException(NAME + " thermal model only has axial and radial gradient data");
		}
		return Influence.superpose(new double[] { gradients.axial(), gradients.radial() },
				new double[][] { fea.column(AXIAL_COL), fea.column(RADIAL_COL) });
	}
}
