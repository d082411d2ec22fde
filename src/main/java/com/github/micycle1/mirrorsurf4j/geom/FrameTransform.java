package com.github.micycle1.mirrorsurf4j.geom;

import com.github.micycle1.mirrorsurf4j.model.SurfaceField;

/**
 * Relabelling between a mirror's native coordinate frame and the frame of the
 * optical design tool.
 * <p>
 * Each transform is a pure sign flip of axes: no interpolation, no scaling, so
 * {@code toNative(toTool(f))} reproduces {@code f} exactly.
 */
public enum FrameTransform {

	/** M1 and M3 share one substrate and one native frame. */
	PRIMARY_TERTIARY(-1, 1, -1),
	SECONDARY(-1, 1, -1);

	private final double sx;
	private final double sy;
	private final double sz;

	FrameTransform(double sx, double sy, double sz) {
		this.sx = sx;
		this.sy = sy;
		this.sz = sz;
	}

	public SurfaceField toTool(SurfaceField field) {
		return apply(field);
	}

	public SurfaceField toNative(SurfaceField field) {
		// sign flips are involutions
		return apply(field);
	}

	private SurfaceField apply(SurfaceField field) {
		return SurfaceField.of(scale(field.xs(), sx), scale(field.ys(), sy), scale(field.values(), sz));
	}

	private static double[] scale(double[] v, double s) {
		double[] out = new double[v.length];
		for (int i = 0; i < v.length; i++) {
			out[i] = s * v[i];
		}
		return out;
	}
}
