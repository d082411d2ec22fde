package com.github.micycle1.mirrorsurf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.mirrorsurf4j.corrector.PrimaryTertiaryCorrector;
import com.github.micycle1.mirrorsurf4j.corrector.SecondaryMirrorCorrector;
import com.github.micycle1.mirrorsurf4j.corrector.SurfaceCorrector;
import com.github.micycle1.mirrorsurf4j.io.ResidueMapWriter;
import com.github.micycle1.mirrorsurf4j.model.AberrationCoefficients;
import com.github.micycle1.mirrorsurf4j.model.FittedResidual;
import com.github.micycle1.mirrorsurf4j.model.GridResidueMap;
import com.github.micycle1.mirrorsurf4j.model.ObservingGeometry;
import com.github.micycle1.mirrorsurf4j.model.SurfaceField;
import com.github.micycle1.mirrorsurf4j.resample.GridResampler;
import com.github.micycle1.mirrorsurf4j.zernike.ZernikeBasis;

/**
 * Public API for producing the as-built mirror surface products consumed by an
 * optical design tool.
 * <p>
 * A request runs three steps on a {@link SurfaceCorrector}:
 * <ol>
 * <li>{@link SurfaceCorrector#computeNetSurface} combines gravity
 * print-through and thermal deformation for the observing geometry;</li>
 * <li>{@link SurfaceCorrector#fitResidual} moves the surface to the tool frame
 * and removes the low-order Zernike terms;</li>
 * <li>{@link SurfaceCorrector#exportGridMaps} resamples the residual, with
 * derivatives, on the tool's regular grid.</li>
 * </ol>
 * Nothing is shared between requests; correctors are read-only once loaded.
 */
public final class MirrorSurf {

	private static final Logger LOGGER = LoggerFactory.getLogger(MirrorSurf.class);

	/** Requested grid nodes per axis, before padding. */
	public static final int DEFAULT_GRID_SIZE = 200;

	private MirrorSurf() {
	}

	/**
	 * Files and values produced by {@link #writeZernikesAndGridResidue}.
	 *
	 * @param coefficients    fitted Zernike coefficients, micrometers
	 * @param coefficientFile file the coefficients were written to
	 * @param residueFiles    residue map file per segment name
	 */
	public record Products(AberrationCoefficients coefficients, Path coefficientFile, Map<String, Path> residueFiles) {
	}

	/**
	 * Loads the secondary mirror model from the default file names in
	 * {@code dataDir}.
	 */
	public static SurfaceCorrector secondary(Path dataDir) throws IOException {
		return SecondaryMirrorCorrector.load(SecondaryMirrorCorrector.Config.defaults(dataDir));
	}

	/**
	 * Loads the primary/tertiary mirror model from the default file names in
	 * {@code dataDir}.
	 */
	public static SurfaceCorrector primaryTertiary(Path dataDir) throws IOException {
		return PrimaryTertiaryCorrector.load(PrimaryTertiaryCorrector.Config.defaults(dataDir));
	}

	/**
	 * Runs the full request and writes its products to {@code outputDir}:
	 * {@code <mirror>_zk.txt} with the Zernike coefficients and one
	 * {@code <segment>_res.txt} residue map per segment. All products are
	 * formatted and staged before any existing file is replaced.
	 *
	 * @param corrector mirror model
	 * @param observing telescope pose and temperature state
	 * @param numTerms  Zernike terms to remove
	 * @param gridSize  requested grid nodes per axis, before padding
	 * @param outputDir existing directory for the output files
	 * @return written coefficients and file paths
	 */
	public static Products writeZernikesAndGridResidue(SurfaceCorrector corrector, ObservingGeometry observing, int numTerms, int gridSize,
			Path outputDir) throws IOException {
		Objects.requireNonNull(corrector, "corrector");
		ZernikeBasis.checkTermCount(numTerms);
		GridResampler.GridLayout.of(corrector.geometry(), gridSize, gridSize);

		SurfaceField surface = corrector.computeNetSurface(observing);
		FittedResidual fitted = corrector.fitResidual(surface, numTerms);
		Map<String, GridResidueMap> maps = corrector.exportGridMaps(fitted.residual(), gridSize, gridSize);

		Path coefficientFile = outputDir.resolve(corrector.name() + "_zk.txt");
		Map<Path, String> products = new LinkedHashMap<>();
		products.put(coefficientFile, ResidueMapWriter.format(fitted.coefficients()));
		Map<String, Path> residueFiles = new LinkedHashMap<>();
		for (Map.Entry<String, GridResidueMap> e : maps.entrySet()) {
			Path file = outputDir.resolve(e.getKey() + "_res.txt");
			products.put(file, ResidueMapWriter.format(e.getValue()));
			residueFiles.put(e.getKey(), file);
		}
		ResidueMapWriter.writeAll(products);
		LOGGER.info("Wrote {} products for zenith angle {} rad to {}", corrector.name(), observing.zenithAngle(), outputDir);
		return new Products(fitted.coefficients(), coefficientFile, Collections.unmodifiableMap(residueFiles));
	}

	/**
	 * As {@link #writeZernikesAndGridResidue(SurfaceCorrector, ObservingGeometry, int, int, Path)}
	 * with the mirror's default term count and {@link #DEFAULT_GRID_SIZE}.
	 */
	public static Products writeZernikesAndGridResidue(SurfaceCorrector corrector, ObservingGeometry observing, Path outputDir)
			throws IOException {
		return writeZernikesAndGridResidue(corrector, observing, corrector.defaultNumTerms(), DEFAULT_GRID_SIZE, outputDir);
	}
}
