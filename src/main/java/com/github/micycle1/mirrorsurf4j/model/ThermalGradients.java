package com.github.micycle1.mirrorsurf4j.model;

/**
 * Temperature state driving the thermal surface correction. Each gradient is
 * the +/-2 sigma value spanning a 1 degree differential.
 *
 * @param bulk   bulk temperature offset
 * @param x      lateral gradient along x
 * @param y      lateral gradient along y
 * @param axial  gradient along the optical axis
 * @param radial radial gradient
 */
public record ThermalGradients(double bulk, double x, double y, double axial, double radial) {

	public static final ThermalGradients NONE = new ThermalGradients(0, 0, 0, 0, 0);

	public ThermalGradients {
		if (!Double.isFinite(bulk) || !Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(axial) || !Double.isFinite(radial)) {
			throw new IllegalArgumentException("Thermal gradients must be finite");
		}
	}

	public static ThermalGradients axialRadial(double axial, double radial) {
		return new ThermalGradients(0, 0, 0, axial, radial);
	}

	public boolean hasLateralTerms() {
		return bulk != 0 || x != 0 || y != 0;
	}
}
