package com.github.micycle1.mirrorsurf4j.corrector;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.micycle1.mirrorsurf4j.ConfigurationException;
import com.github.micycle1.mirrorsurf4j.geom.FrameTransform;
import com.github.micycle1.mirrorsurf4j.io.ReferenceTable;
import com.github.micycle1.mirrorsurf4j.lut.LutInterpolator;
import com.github.micycle1.mirrorsurf4j.model.FittedResidual;
import com.github.micycle1.mirrorsurf4j.model.GridResidueMap;
import com.github.micycle1.mirrorsurf4j.model.LutTable;
import com.github.micycle1.mirrorsurf4j.model.MirrorGeometry;
import com.github.micycle1.mirrorsurf4j.model.ObservingGeometry;
import com.github.micycle1.mirrorsurf4j.model.SurfaceField;
import com.github.micycle1.mirrorsurf4j.model.ThermalGradients;

/**
 * Mirror-type specific surface model.
 * <p>
 * Implementations hold their reference tables (loaded once, read-only) and
 * supply only the mirror-specific parts: which influence tables make up the
 * print-through and thermal responses, the frame relabelling and the
 * segments. Fitting and resampling are shared and delegate to
 * {@link SurfacePipeline}.
 * <p>
 * Units: sample positions in meters, surface values in micrometers, angles in
 * radians (look-up table queries in degrees).
 */
public interface SurfaceCorrector {

	/** Assembly name, e.g. {@code M2}. */
	String name();

	/** Aperture whose outer radius normalizes coordinates for the fit. */
	MirrorGeometry geometry();

	FrameTransform frame();

	/** Surfaces resampled separately on export. */
	List<MirrorSegment> segments();

	/** Native-frame sample positions, with zero values. */
	SurfaceField samplePositions();

	/** Actuator forces as tabulated; no computation involved. */
	ReferenceTable actuatorForces();

	Optional<LutTable> lut();

	int defaultNumTerms();

	/**
	 * Gravity print-through in micrometers at each sample.
	 *
	 * @param zenithAngle          radians
	 * @param preCompensationAngle radians
	 */
	double[] printThrough(double zenithAngle, double preCompensationAngle);

	/**
	 * Thermal deformation in micrometers at each sample.
	 *
	 * @throws ConfigurationException if the gradients use a term this mirror has
	 *                                no influence data for
	 */
	double[] thermalCorrection(ThermalGradients gradients);

	/**
	 * Actuator forces from the look-up table at a zenith angle, clamped to the
	 * table's range.
	 *
	 * @param zenithAngleDeg zenith angle in degrees
	 * @throws ConfigurationException if no look-up table is configured
	 */
	default double[] lutForces(double zenithAngleDeg) {
		LutTable table = lut().orElseThrow(() -> new ConfigurationException("No look-up table configured for " + name()));
		return LutInterpolator.interpolate(table, zenithAngleDeg);
	}

	/**
	 * Net deformation (print-through plus thermal) in the native frame.
	 */
	default SurfaceField computeNetSurface(ObservingGeometry observing) {
		return SurfacePipeline.computeNetSurface(this, observing);
	}

	/**
	 * Moves {@code nativeField} to the tool frame and removes its first
	 * {@code numTerms} Zernike terms.
	 */
	default FittedResidual fitResidual(SurfaceField nativeField, int numTerms) {
		return SurfacePipeline.fitResidual(nativeField, frame(), geometry(), numTerms);
	}

	/**
	 * Resamples a tool-frame residual (m, um) on one grid per segment, in mm.
	 *
	 * @return residue maps keyed by segment name, in segment order
	 */
	default Map<String, GridResidueMap> exportGridMaps(SurfaceField residual, int nx, int ny) {
		return SurfacePipeline.exportGridMaps(residual, segments(), nx, ny);
	}
}
