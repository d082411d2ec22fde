package com.github.micycle1.mirrorsurf4j.corrector;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.mirrorsurf4j.DataShapeException;
import com.github.micycle1.mirrorsurf4j.geom.FrameTransform;
import com.github.micycle1.mirrorsurf4j.model.AberrationCoefficients;
import com.github.micycle1.mirrorsurf4j.model.FittedResidual;
import com.github.micycle1.mirrorsurf4j.model.GridResidueMap;
import com.github.micycle1.mirrorsurf4j.model.MirrorGeometry;
import com.github.micycle1.mirrorsurf4j.model.ObservingGeometry;
import com.github.micycle1.mirrorsurf4j.model.SurfaceField;
import com.github.micycle1.mirrorsurf4j.resample.GridResampler;
import com.github.micycle1.mirrorsurf4j.zernike.ZernikeBasis;
import com.github.micycle1.mirrorsurf4j.zernike.ZernikeFit;

/**
 * Stateless steps shared by every {@link SurfaceCorrector}: combining the
 * corrections, the Zernike fit and the grid export.
 */
public final class SurfacePipeline {

	private static final Logger LOGGER = LoggerFactory.getLogger(SurfacePipeline.class);

	/** Meters to millimeters. */
	public static final double M_TO_MM = 1e3;
	/** Micrometers to millimeters. */
	public static final double UM_TO_MM = 1e-3;

	private SurfacePipeline() {
	}

	public static SurfaceField computeNetSurface(SurfaceCorrector corrector, ObservingGeometry observing) {
		SurfaceField positions = corrector.samplePositions();
		double[] print = corrector.printThrough(observing.zenithAngle(), observing.preCompensationElevation());
		double[] thermal = corrector.thermalCorrection(observing.thermal());
		DataShapeException.requireLength("print-through", print.length, positions.size());
		DataShapeException.requireLength("thermal correction", thermal.length, positions.size());

		double[] net = new double[print.length];
		for (int i = 0; i < net.length; i++) {
			net[i] = print[i] + thermal[i];
		}
		SurfaceField field = positions.withValues(net);
		LOGGER.debug("{} net surface at zenith angle {} rad: {} samples, rms {} um", corrector.name(), observing.zenithAngle(), field.size(),
				field.rms());
		return field;
	}

	/**
	 * Transforms the field to the tool frame, normalizes positions by the outer
	 * radius and removes the fitted Zernike terms.
	 *
	 * @return residual in the tool frame (positions unnormalized) and the
	 *         coefficients, both in the field's value unit
	 */
	public static FittedResidual fitResidual(SurfaceField nativeField, FrameTransform frame, MirrorGeometry geometry, int numTerms) {
		ZernikeBasis.checkTermCount(numTerms);
		SurfaceField tool = frame.toTool(nativeField);
		double radius = geometry.outerRadius();
		double[] xNorm = tool.xs();
		double[] yNorm = tool.ys();
		for (int i = 0; i < xNorm.length; i++) {
			xNorm[i] /= radius;
			yNorm[i] /= radius;
		}
		double[] values = tool.values();
		AberrationCoefficients coefficients = ZernikeFit.fit(values, xNorm, yNorm, numTerms);
		SurfaceField residual = tool.withValues(ZernikeFit.residual(values, coefficients, xNorm, yNorm));
		LOGGER.debug("Fitted {} Zernike terms to {} samples: rms {} -> {}", numTerms, tool.size(), tool.rms(), residual.rms());
		return new FittedResidual(residual, coefficients);
	}

	/**
	 * Resamples a residual given in meters and micrometers onto the padded tool
	 * grid, in millimeters.
	 */
	public static GridResidueMap exportGridMap(SurfaceField residual, MirrorGeometry geometry, int nx, int ny) {
		return GridResampler.resample(residual.scaled(M_TO_MM, UM_TO_MM), geometry.scaled(M_TO_MM), nx, ny);
	}

	public static Map<String, GridResidueMap> exportGridMaps(SurfaceField residual, List<MirrorSegment> segments, int nx, int ny) {
		Map<String, GridResidueMap> maps = new LinkedHashMap<>();
		for (MirrorSegment segment : segments) {
			maps.put(segment.name(), exportGridMap(residual.subset(segment.nodes()), segment.geometry(), nx, ny));
		}
		return maps;
	}
}
