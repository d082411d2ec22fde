package com.github.micycle1.mirrorsurf4j.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.mirrorsurf4j.MalformedTableException;

/**
 * Reads whitespace-delimited numeric tables.
 * <p>
 * The first {@code skipRows} lines are discarded as headers; blank lines are
 * ignored everywhere else.
 */
public final class ReferenceTableReader {

	private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceTableReader.class);

	private ReferenceTableReader() {
	}

	public static ReferenceTable read(Path path) throws IOException {
		return read(path, 0);
	}

	/**
	 * @param path     table file
	 * @param skipRows number of header lines to skip
	 * @throws IOException             if the file cannot be read (the message
	 *                                 carries the path)
	 * @throws MalformedTableException if a field is not a number or rows are
	 *                                 ragged
	 */
	public static ReferenceTable read(Path path, int skipRows) throws IOException {
		if (skipRows < 0) {
			throw new IllegalArgumentException("skipRows must be >= 0");
		}
		List<double[]> rows = new ArrayList<>();
		try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			String line;
			int lineNo = 0;
			while ((line = reader.readLine()) != null) {
				lineNo++;
				if (lineNo <= skipRows) {
					continue;
				}
				String trimmed = line.strip();
				if (trimmed.isEmpty()) {
					continue;
				}
				rows.add(parseRow(path, lineNo, trimmed));
			}
		}
		ReferenceTable table = new ReferenceTable(path.toString(), rows.toArray(double[][]::new));
		LOGGER.info("Loaded {} ({} rows x {} columns)", path, table.rowCount(), table.columnCount());
		return table;
	}

	private static double[] parseRow(Path path, int lineNo, String line) {
		String[] fields = line.split("\\s+");
		double[] row = new double[fields.length];
		for (int i = 0; i < fields.length; i++) {
			try {
				row[i] = Double.parseDouble(fields[i]);
			} catch (NumberFormatException e) {
				throw new MalformedTableException(path + ":" + lineNo + ": not a number: '" + fields[i] + "'", e);
			}
		}
		return row;
	}
}
