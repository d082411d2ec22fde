package com.github.micycle1.mirrorsurf4j.corrector;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.mirrorsurf4j.geom.FrameTransform;
import com.github.micycle1.mirrorsurf4j.io.ReferenceTable;
import com.github.micycle1.mirrorsurf4j.io.ReferenceTableReader;
import com.github.micycle1.mirrorsurf4j.model.LutTable;
import com.github.micycle1.mirrorsurf4j.model.MirrorGeometry;
import com.github.micycle1.mirrorsurf4j.model.SurfaceField;
import com.github.micycle1.mirrorsurf4j.model.ThermalGradients;

/**
 * Surface model of the combined primary/tertiary mirror (M1M3).
 * <p>
 * Both surfaces are cut into one substrate and share one sample set. The grid
 * table lists {@code nodeType x y ...} per sample, node type {@code 1} for M1
 * and {@code 3} for M3. Gravity responses come from two tables (zenith and
 * horizon pointing) with columns {@code dx dy dz}; the thermal table holds
 * {@code x y bulkDz xDz yDz axialDz radialDz}. The Zernike fit covers all
 * samples normalized by the M1 outer radius, while export resamples M1 and M3
 * separately.
 */
public final class PrimaryTertiaryCorrector implements SurfaceCorrector {

	private static final Logger LOGGER = LoggerFactory.getLogger(PrimaryTertiaryCorrector.class);

	public static final String NAME = "M1M3";
	public static final MirrorGeometry M1_GEOMETRY = new MirrorGeometry(2.558, 4.180);
	public static final MirrorGeometry M3_GEOMETRY = new MirrorGeometry(0.550, 2.508);
	public static final int M1_NODE = 1;
	public static final int M3_NODE = 3;
	public static final int DEFAULT_NUM_TERMS = 28;

	private static final int DZ_COL = 2;
	private static final int THERMAL_FIRST_COL = 2;
	private static final int THERMAL_TERMS = 5;

	/**
	 * Where to find the primary/tertiary reference data.
	 *
	 * @param dataDir         directory holding the tables
	 * @param zenithFile      gravity response at zenith pointing
	 * @param horizonFile     gravity response at horizon pointing
	 * @param thermalFile     thermal influence table
	 * @param thermalSkipRows header lines of the thermal table
	 * @param gridFile        bending-mode grid table (node type, x, y first)
	 * @param forceFile       actuator force table
	 * @param lutFile         optional look-up table, {@code null} if none
	 */
	public static record Config(Path dataDir, String zenithFile, String horizonFile, String thermalFile, int thermalSkipRows,
			String gridFile, String forceFile, String lutFile) {

		public Config {
			Objects.requireNonNull(dataDir, "dataDir");
			Objects.requireNonNull(zenithFile, "zenithFile");
			Objects.requireNonNull(horizonFile, "horizonFile");
			Objects.requireNonNull(thermalFile, "thermalFile");
			Objects.requireNonNull(gridFile, "gridFile");
			Objects.requireNonNull(forceFile, "forceFile");
		}

		public static Config defaults(Path dataDir) {
			return new Config(dataDir, "M1M3_dxdydz_zenith.txt", "M1M3_dxdydz_horizon.txt", "M1M3_thermal_FEA.txt", 1,
					"M1M3_1um_156_grid.DAT", "M1M3_1um_156_force.DAT", "M1M3_LUT.txt");
		}

		public Config withLutFile(String file) {
			return new Config(dataDir, zenithFile, horizonFile, thermalFile, thermalSkipRows, gridFile, forceFile, file);
		}
	}

	private final ReferenceTable zenith;
	private final ReferenceTable horizon;
	private final ReferenceTable thermal;
	private final ReferenceTable forces;
	private final LutTable lut;
	private final SurfaceField positions;
	private final List<MirrorSegment> segments;

	/**
	 * @param zenith  gravity response at zenith pointing, {@code dx dy dz}
	 * @param horizon gravity response at horizon pointing, {@code dx dy dz}
	 * @param thermal thermal influence, at least 7 columns
	 * @param grid    node type, x and y per sample
	 * @param forces  actuator force table
	 * @param lut     look-up table, may be {@code null}
	 */
	public PrimaryTertiaryCorrector(ReferenceTable zenith, ReferenceTable horizon, ReferenceTable thermal, ReferenceTable grid,
			ReferenceTable forces, LutTable lut) {
		grid.requireColumns(3);
		int n = grid.rowCount();
		this.zenith = zenith.requireColumns(DZ_COL + 1).requireRows(n);
		this.horizon = horizon.requireColumns(DZ_COL + 1).requireRows(n);
		this.thermal = thermal.requireColumns(THERMAL_FIRST_COL + THERMAL_TERMS).requireRows(n);
		this.forces = Objects.requireNonNull(forces, "forces");
		this.lut = lut;
		this.positions = SurfaceField.of(grid.column(1), grid.column(2), new double[n]);

		double[] nodeType = grid.column(0);
		int[] m1 = IntStream.range(0, n).filter(i -> nodeType[i] == M1_NODE).toArray();
		int[] m3 = IntStream.range(0, n).filter(i -> nodeType[i] == M3_NODE).toArray();
		if (m1.length + m3.length != n) {
			LOGGER.warn("{} of {} grid nodes are neither M1 nor M3 and will not be exported", n - m1.length - m3.length, n);
		}
		this.segments = List.of(new MirrorSegment("M1", M1_GEOMETRY, m1), new MirrorSegment("M3", M3_GEOMETRY, m3));
	}

	public static PrimaryTertiaryCorrector load(Config config) throws IOException {
		Path dir = config.dataDir();
		ReferenceTable zenith = ReferenceTableReader.read(dir.resolve(config.zenithFile()));
		ReferenceTable horizon = ReferenceTableReader.read(dir.resolve(config.horizonFile()));
		ReferenceTable thermal = ReferenceTableReader.read(dir.resolve(config.thermalFile()), config.thermalSkipRows());
		ReferenceTable grid = ReferenceTableReader.read(dir.resolve(config.gridFile()));
		ReferenceTable forces = ReferenceTableReader.read(dir.resolve(config.forceFile()));
		LutTable lut = null;
		if (config.lutFile() != null) {
			lut = LutTable.fromRows(ReferenceTableReader.read(dir.resolve(config.lutFile())).toArray());
		}
		PrimaryTertiaryCorrector corrector = new PrimaryTertiaryCorrector(zenith, horizon, thermal, grid, forces, lut);
		LOGGER.info("Loaded {} surface model with {} samples from {}", NAME, corrector.positions.size(), dir);
		return corrector;
	}

	@Override
	public String name() {
		return NAME;
	}

	/**
	 * The M1 aperture; its outer radius normalizes the fit over both surfaces.
	 */
	@Override
	public MirrorGeometry geometry() {
		return M1_GEOMETRY;
	}

	@Override
	public FrameTransform frame() {
		return FrameTransform.PRIMARY_TERTIARY;
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
		return Influence.printThrough(zenith.column(DZ_COL), horizon.column(DZ_COL), zenithAngle, preCompensationAngle);
	}

	@Override
	public double[] thermalCorrection(ThermalGradients gradients) {
		double[] weights = { gradients.bulk(), gradients.x(), gradients.y(), gradients.axial(), gradients.radial() };
		double[][] responses = new double[THERMAL_TERMS][];
		for (int k = 0; k < THERMAL_TERMS; k++) {
			responses[k] = thermal.column(THERMAL_FIRST_COL + k);
		}
		return Influence.superpose(weights, responses);
	}
}
