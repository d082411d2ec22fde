package com.github.micycle1.mirrorsurf4j.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.micycle1.mirrorsurf4j.model.AberrationCoefficients;
import com.github.micycle1.mirrorsurf4j.model.GridResidueMap;

class ResidueMapWriterTest {

	@TempDir
	Path dir;

	private static GridResidueMap smallMap() {
		double[] nodes = { //
				0, 0, 0, 0, //
				1.5, -2.25e-3, 1e-12, 0, //
				-0.001, 123456.789, 0, -7, //
				0, 0, 0, 0 };
		return new GridResidueMap(2, 2, 18.75, 0.5, nodes);
	}

	@Test
	void residueMapLayout() {
		String text = ResidueMapWriter.format(smallMap());
		String expected = "2 2 1.875000000E+01 5.000000000E-01\n" //
				+ "0.000000000E+00 0.000000000E+00 0.000000000E+00 0.000000000E+00\n" //
				+ "1.500000000E+00 -2.250000000E-03 1.000000000E-12 0.000000000E+00\n" //
				+ "-1.000000000E-03 1.234567890E+05 0.000000000E+00 -7.000000000E+00\n" //
				+ "0.000000000E+00 0.000000000E+00 0.000000000E+00 0.000000000E+00\n";
		assertEquals(expected, text);
	}

	@Test
	void coefficientLayout() {
		String text = ResidueMapWriter.format(new AberrationCoefficients(new double[] { 1, -0.125 }));
		assertEquals("1.000000000000000000e+00\n-1.250000000000000000e-01\n", text);
	}

	@Test
	void writeReplacesExistingFileAndLeavesNoTemporaries() throws IOException {
		Path file = dir.resolve("M2_res.txt");
		Files.writeString(file, "stale");
		ResidueMapWriter.write(smallMap(), file);

		List<String> lines = Files.readAllLines(file);
		assertEquals(5, lines.size());
		assertEquals("2 2 1.875000000E+01 5.000000000E-01", lines.get(0));
		try (Stream<Path> files = Files.list(dir)) {
			assertEquals(List.of(file), files.toList());
		}
	}

	@Test
	void unwritableTargetLeavesNothingBehind() {
		Path missing = dir.resolve("no-such-dir").resolve("zk.txt");
		assertThrows(IOException.class, () -> ResidueMapWriter.write(new AberrationCoefficients(new double[] { 1 }), missing));
		assertFalse(Files.exists(missing));
	}

	@Test
	void newFileGetsSameModeAsPlainWrite() throws IOException {
		assumeTrue(Files.getFileStore(dir).supportsFileAttributeView(PosixFileAttributeView.class));
		Path plain = dir.resolve("plain.txt");
		Files.writeString(plain, "x");
		Path zk = dir.resolve("M2_zk.txt");
		ResidueMapWriter.write(new AberrationCoefficients(new double[] { 1 }), zk);
		assertEquals(Files.getPosixFilePermissions(plain), Files.getPosixFilePermissions(zk));
	}

	@Test
	void replacedFileKeepsItsMode() throws IOException {
		assumeTrue(Files.getFileStore(dir).supportsFileAttributeView(PosixFileAttributeView.class));
		Path file = dir.resolve("M1_res.txt");
		Files.writeString(file, "stale");
		Set<PosixFilePermission> mode = PosixFilePermissions.fromString("rw-r-----");
		Files.setPosixFilePermissions(file, mode);
		ResidueMapWriter.write(smallMap(), file);
		assertEquals(mode, Files.getPosixFilePermissions(file));
	}

	@Test
	void productSetUntouchedWhenOneFileCannotBeStaged() throws IOException {
		Path zk = dir.resolve("M1M3_zk.txt");
		Files.writeString(zk, "stale");
		Map<Path, String> products = new LinkedHashMap<>();
		products.put(zk, ResidueMapWriter.format(new AberrationCoefficients(new double[] { 1 })));
		products.put(dir.resolve("no-such-dir").resolve("M1_res.txt"), ResidueMapWriter.format(smallMap()));

		assertThrows(IOException.class, () -> ResidueMapWriter.writeAll(products));
		assertEquals("stale", Files.readString(zk));
		try (Stream<Path> files = Files.list(dir)) {
			assertEquals(List.of(zk), files.toList());
		}
	}

	@Test
	void productSetWrittenTogether() throws IOException {
		Map<Path, String> products = new LinkedHashMap<>();
		products.put(dir.resolve("M1M3_zk.txt"), "a\n");
		products.put(dir.resolve("M1_res.txt"), "b\n");
		products.put(dir.resolve("M3_res.txt"), "c\n");
		ResidueMapWriter.writeAll(products);
		for (Map.Entry<Path, String> e : products.entrySet()) {
			assertEquals(e.getValue(), Files.readString(e.getKey()));
		}
		try (Stream<Path> files = Files.list(dir)) {
			assertEquals(3, files.count());
		}
	}

	@Test
	void nonFiniteNodesHaveNoTextForm() {
		assertThrows(IllegalArgumentException.class, () -> new GridResidueMap(1, 1, 1, 1, new double[] { 0, Double.NaN, 0, 0 }));
		assertThrows(IllegalArgumentException.class,
				() -> new GridResidueMap(1, 1, 1, 1, new double[] { Double.NEGATIVE_INFINITY, 0, 0, 0 }));
	}
}
