package com.github.micycle1.mirrorsurf4j.corrector;

import com.github.micycle1.mirrorsurf4j.model.MirrorGeometry;

/**
 * One optical surface of a mirror assembly and the samples that belong to it.
 *
 * @param name     surface name, used to label its residue map
 * @param geometry annulus of the surface, in meters
 * @param nodes    indices of the surface's samples in the assembly's field
 */
public record MirrorSegment(String name, MirrorGeometry geometry, int[] nodes) {
}
