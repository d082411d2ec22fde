package com.github.micycle1.mirrorsurf4j.model;

import com.github.micycle1.mirrorsurf4j.DataShapeException;

/**
 * Surface residue resampled on a regular grid, in the layout read by the
 * optical design tool.
 * <p>
 * Nodes are stored row-major: row {@code j} runs over the y axis (first row is
 * the most positive y, since the consumer reads from negative y after its own
 * flip), column {@code i} over x. Each node carries the value and the partials
 * {@code d/dx}, {@code d/dy} and {@code d2/dxdy}.
 */
public final class GridResidueMap {

	public static final int FIELDS_PER_NODE = 4;

	private final int xCount;
	private final int yCount;
	private final double pitchX;
	private final double pitchY;
	private final double[] nodes;

	/**
	 * @param xCount number of grid nodes along x (padding included)
	 * @param yCount number of grid nodes along y (padding included)
	 * @param pitchX node spacing along x
	 * @param pitchY node spacing along y
	 * @param nodes  {@code 4 * xCount * yCount} finite values, row-major, 4 per
	 *               node
	 * @throws IllegalArgumentException if a node value is NaN or infinite
	 */
	public GridResidueMap(int xCount, int yCount, double pitchX, double pitchY, double[] nodes) {
		if (xCount < 1 || yCount < 1) {
			throw new IllegalArgumentException("Grid must have at least one node per axis");
		}
		DataShapeException.requireLength("grid node data", nodes.length, FIELDS_PER_NODE * xCount * yCount);
		for (int i = 0; i < nodes.length; i++) {
			if (!Double.isFinite(nodes[i])) {
				throw new IllegalArgumentException("Node " + i / FIELDS_PER_NODE + " has a non-finite value; the residue map format has no spelling for it");
			}
		}
		this.xCount = xCount;
		this.yCount = yCount;
		this.pitchX = pitchX;
		this.pitchY = pitchY;
		this.nodes = nodes.clone();
	}

	public int xCount() {
		return xCount;
	}

	public int yCount() {
		return yCount;
	}

	public double pitchX() {
		return pitchX;
	}

	public double pitchY() {
		return pitchY;
	}

	public int nodeCount() {
		return xCount * yCount;
	}

	public double value(int row, int col) {
		return nodes[offset(row, col)];
	}

	public double dx(int row, int col) {
		return nodes[offset(row, col) + 1];
	}

	public double dy(int row, int col) {
		return nodes[offset(row, col) + 2];
	}

	public double dxdy(int row, int col) {
		return nodes[offset(row, col) + 3];
	}

	/**
	 * The four values of the node at position {@code k} of the row-major
	 * enumeration.
	 */
	public double[] node(int k) {
		double[] out = new double[FIELDS_PER_NODE];
		System.arraycopy(nodes, k * FIELDS_PER_NODE, out, 0, FIELDS_PER_NODE);
		return out;
	}

	public boolean isZero(int row, int col) {
		int o = offset(row, col);
		return nodes[o] == 0 && nodes[o + 1] == 0 && nodes[o + 2] == 0 && nodes[o + 3] == 0;
	}

	private int offset(int row, int col) {
		if (row < 0 || row >= yCount || col < 0 || col >= xCount) {
			throw new IndexOutOfBoundsException("Node (" + row + ", " + col + ") outside " + yCount + "x" + xCount + " grid");
		}
		return (row * xCount + col) * FIELDS_PER_NODE;
	}
}
