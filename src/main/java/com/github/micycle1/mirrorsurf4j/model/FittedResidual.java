package com.github.micycle1.mirrorsurf4j.model;

/**
 * Outcome of an aberration fit: the part of the surface the basis did not
 * capture, and the fitted coefficients.
 *
 * @param residual     field minus the evaluated basis, at the fitted positions
 * @param coefficients fitted Zernike coefficients
 */
public record FittedResidual(SurfaceField residual, AberrationCoefficients coefficients) {
}
