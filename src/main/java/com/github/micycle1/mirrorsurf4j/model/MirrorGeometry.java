package com.github.micycle1.mirrorsurf4j.model;

/**
 * Annular clear aperture of a mirror.
 *
 * @param innerRadius radius of the central hole
 * @param outerRadius radius of the outer edge
 */
public record MirrorGeometry(double innerRadius, double outerRadius) {

	public MirrorGeometry {
		if (!Double.isFinite(innerRadius) || !Double.isFinite(outerRadius)) {
			throw new IllegalArgumentException("Mirror radii must be finite");
		}
		if (innerRadius < 0) {
			throw new IllegalArgumentException("Inner radius must be >= 0");
		}
		if (innerRadius >= outerRadius) {
			throw new IllegalArgumentException("Inner radius (" + innerRadius + ") must be smaller than outer radius (" + outerRadius + ")");
		}
	}

	/**
	 * Both radii multiplied by {@code factor}, e.g. {@code 1e3} for m to mm.
	 */
	public MirrorGeometry scaled(double factor) {
		return new MirrorGeometry(innerRadius * factor, outerRadius * factor);
	}
}
