package com.github.micycle1.mirrorsurf4j.resample;

import com.github.micycle1.mirrorsurf4j.model.SurfaceField;

/**
 * A smooth surface fitted through scattered samples, evaluable anywhere in the
 * plane. Implementations must be immutable so a grid can be evaluated from
 * several threads at once.
 */
@FunctionalInterface
public interface ScatteredInterpolant {

	double value(double x, double y);

	/**
	 * Builds an interpolant from a field whose values are all finite.
	 */
	@FunctionalInterface
	interface Factory {
		ScatteredInterpolant fit(SurfaceField field);
	}
}
