package com.github.micycle1.mirrorsurf4j;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.micycle1.mirrorsurf4j.corrector.SurfaceCorrector;
import com.github.micycle1.mirrorsurf4j.corrector.SyntheticMirror;
import com.github.micycle1.mirrorsurf4j.model.ObservingGeometry;
import com.github.micycle1.mirrorsurf4j.model.ThermalGradients;

class MirrorSurfTest {

	@TempDir
	Path data;

	@TempDir
	Path out;

	private static final ObservingGeometry OBSERVING = ObservingGeometry.atZenithAngle(Math.toRadians(27.0912))
			.withThermal(ThermalGradients.axialRadial(-0.0675, -0.1416));

	@Test
	void secondaryProducts() throws IOException {
		SyntheticMirror.writeSecondary(data, SyntheticMirror.rings(0.95, 1.68, 6, 30));
		SurfaceCorrector m2 = MirrorSurf.secondary(data);

		MirrorSurf.Products products = MirrorSurf.writeZernikesAndGridResidue(m2, OBSERVING, 22, 8, out);
		assertEquals(out.resolve("M2_zk.txt"), products.coefficientFile());
		assertEquals(List.of("M2"), List.copyOf(products.residueFiles().keySet()));

		List<String> zk = Files.readAllLines(products.coefficientFile());
		assertEquals(22, zk.size());
		assertEquals(products.coefficients().get(3), Double.parseDouble(zk.get(3)), Math.abs(products.coefficients().get(3)) * 1e-15);

		List<String> res = Files.readAllLines(out.resolve("M2_res.txt"));
		assertEquals(1 + 12 * 12, res.size());
		assertTrue(res.get(0).startsWith("12 12 "), res.get(0));
		assertEquals(4, res.get(1).split(" ").length);
	}

	@Test
	void defaultsUseMirrorTermCount() throws IOException {
		SyntheticMirror.writeSecondary(data, SyntheticMirror.rings(0.95, 1.68, 6, 30));
		MirrorSurf.Products products = MirrorSurf.writeZernikesAndGridResidue(MirrorSurf.secondary(data), OBSERVING, out);
		assertEquals(22, products.coefficients().size());
		String header = Files.readAllLines(products.residueFiles().get("M2")).get(0);
		assertTrue(header.startsWith("204 204 "), header);
	}

	@Test
	void invalidRequestWritesNothing() throws IOException {
		SyntheticMirror.writeSecondary(data, SyntheticMirror.rings(0.95, 1.68, 6, 30));
		SurfaceCorrector m2 = MirrorSurf.secondary(data);
		assertThrows(ConfigurationException.class, () -> MirrorSurf.writeZernikesAndGridResidue(m2, OBSERVING, 0, 8, out));
		assertThrows(ConfigurationException.class, () -> MirrorSurf.writeZernikesAndGridResidue(m2, OBSERVING, 121, 8, out));
		assertThrows(ConfigurationException.class, () -> MirrorSurf.writeZernikesAndGridResidue(m2, OBSERVING, 22, 1, out));
		try (Stream<Path> files = Files.list(out)) {
			assertEquals(0, files.count());
		}
	}

	@Test
	void primaryTertiaryWritesOneMapPerSurface() throws IOException {
		double[][] samples = SyntheticMirror.concat(SyntheticMirror.rings(2.6, 4.1, 4, 24), SyntheticMirror.rings(0.6, 2.45, 4, 24));
		SyntheticMirror.writePrimaryTertiary(data, samples);
		SurfaceCorrector m1m3 = MirrorSurf.primaryTertiary(data);

		MirrorSurf.Products products = MirrorSurf.writeZernikesAndGridResidue(m1m3, OBSERVING.withThermal(new ThermalGradients(0.1, 0.2, 0.3, 0.4, 0.5)),
				28, 6, out);
		assertEquals(28, Files.readAllLines(out.resolve("M1M3_zk.txt")).size());
		assertEquals(List.of("M1", "M3"), List.copyOf(products.residueFiles().keySet()));
		for (String surface : List.of("M1", "M3")) {
			List<String> res = Files.readAllLines(out.resolve(surface + "_res.txt"));
			assertEquals(1 + 10 * 10, res.size());
		}
	}
}
