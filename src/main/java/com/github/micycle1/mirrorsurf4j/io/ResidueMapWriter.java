package com.github.micycle1.mirrorsurf4j.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.mirrorsurf4j.model.AberrationCoefficients;
import com.github.micycle1.mirrorsurf4j.model.GridResidueMap;

/**
 * Text serialization of the products handed to the optical design tool.
 * <p>
 * Residue map: a header {@code "%d %d %.9E %.9E"} (node counts along x and y,
 * pitch along x and y) followed by one {@code "%.9E %.9E %.9E %.9E"} line per
 * node (value, d/dx, d/dy, d2/dxdy) in row-major order. Coefficients: one
 * {@code "%.18e"} value per line.
 */
public final class ResidueMapWriter {

	private static final Logger LOGGER = LoggerFactory.getLogger(ResidueMapWriter.class);

	private ResidueMapWriter() {
	}

	public static String format(GridResidueMap map) {
		StringBuilder sb = new StringBuilder(64 * (map.nodeCount() + 1));
		sb.append(String.format(Locale.ROOT, "%d %d %.9E %.9E\n", map.xCount(), map.yCount(), map.pitchX(), map.pitchY()));
		for (int k = 0; k < map.nodeCount(); k++) {
			double[] node = map.node(k);
			sb.append(String.format(Locale.ROOT, "%.9E %.9E %.9E %.9E\n", node[0], node[1], node[2], node[3]));
		}
		return sb.toString();
	}

	public static String format(AberrationCoefficients coefficients) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < coefficients.size(); i++) {
			sb.append(String.format(Locale.ROOT, "%.18e\n", coefficients.get(i)));
		}
		return sb.toString();
	}

	/**
	 * Writes the residue map, replacing {@code path} only on success.
	 */
	public static void write(GridResidueMap map, Path path) throws IOException {
		AtomicFiles.writeString(path, format(map));
		LOGGER.info("Wrote {}x{} residue map to {}", map.xCount(), map.yCount(), path);
	}

	/**
	 * Writes the coefficients, replacing {@code path} only on success.
	 */
	public static void write(AberrationCoefficients coefficients, Path path) throws IOException {
		AtomicFiles.writeString(path, format(coefficients));
		LOGGER.info("Wrote {} Zernike coefficients to {}", coefficients.size(), path);
	}

	/**
	 * Writes a set of already formatted products. Every file is staged before
	 * any target is replaced, so a failure while staging keeps the previous set
	 * intact.
	 *
	 * @param products text per target path, written in iteration order
	 */
	public static void writeAll(Map<Path, String> products) throws IOException {
		AtomicFiles.writeAll(products);
		LOGGER.info("Wrote {} product files", products.size());
	}
}
