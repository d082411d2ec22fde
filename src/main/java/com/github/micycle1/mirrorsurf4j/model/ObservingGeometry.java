package com.github.micycle1.mirrorsurf4j.model;

import java.util.Objects;

/**
 * Telescope pose and environment for one surface request.
 *
 * @param zenithAngle             zenith angle in radians
 * @param preCompensationElevation elevation (radians) whose print-through the
 *                                 support system already compensates
 * @param thermal                 temperature gradients
 */
public record ObservingGeometry(double zenithAngle, double preCompensationElevation, ThermalGradients thermal) {

	public ObservingGeometry {
		if (!Double.isFinite(zenithAngle) || !Double.isFinite(preCompensationElevation)) {
			throw new IllegalArgumentException("Angles must be finite");
		}
		Objects.requireNonNull(thermal, "thermal");
	}

	public static ObservingGeometry atZenithAngle(double zenithAngle) {
		return new ObservingGeometry(zenithAngle, 0, ThermalGradients.NONE);
	}

	public ObservingGeometry withThermal(ThermalGradients gradients) {
		return new ObservingGeometry(zenithAngle, preCompensationElevation, gradients);
	}

	public ObservingGeometry withPreCompensationElevation(double elevation) {
		return new ObservingGeometry(zenithAngle, elevation, thermal);
	}
}
