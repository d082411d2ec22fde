package com.github.micycle1.mirrorsurf4j.corrector;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.micycle1.mirrorsurf4j.ConfigurationException;
import com.github.micycle1.mirrorsurf4j.DataShapeException;
import com.github.micycle1.mirrorsurf4j.io.ReferenceTable;
import com.github.micycle1.mirrorsurf4j.model.FittedResidual;
import com.github.micycle1.mirrorsurf4j.model.GridResidueMap;
import com.github.micycle1.mirrorsurf4j.model.LutTable;
import com.github.micycle1.mirrorsurf4j.model.ObservingGeometry;
import com.github.micycle1.mirrorsurf4j.model.SurfaceField;
import com.github.micycle1.mirrorsurf4j.model.ThermalGradients;
import com.github.micycle1.mirrorsurf4j.zernike.ZernikeBasis;

class SecondaryMirrorCorrectorTest {

	private static final double[][] SAMPLES = SyntheticMirror.rings(0.95, 1.68, 6, 30);

	@TempDir
	Path dir;

	private static SecondaryMirrorCorrector corrector() {
		return new SecondaryMirrorCorrector(SyntheticMirror.secondaryFea(SAMPLES), SyntheticMirror.grid(SAMPLES[0], SAMPLES[1]),
				SyntheticMirror.forces(), null);
	}

	@Test
	void printThroughVanishesAtPreCompensatedPose() {
		double[] print = corrector().printThrough(0.4, 0.4);
		for (double v : print) {
			assertEquals(0, v, 0);
		}
	}

	@Test
	void printThroughRemovesReferencePose() {
		double t = Math.PI / 3;
		double t0 = 0.1;
		double[] print = corrector().printThrough(t, t0);
		for (int i = 0; i < print.length; i++) {
			double z = SyntheticMirror.zenithDz(SAMPLES[0][i], SAMPLES[1][i]);
			double h = SyntheticMirror.horizonDz(SAMPLES[0][i], SAMPLES[1][i]);
			assertEquals(z * Math.cos(t) + h * Math.sin(t) - (z * Math.cos(t0) + h * Math.sin(t0)), print[i], 1e-12);
		}
	}

	@Test
	void thermalIsLinearSuperposition() {
		SecondaryMirrorCorrector m2 = corrector();
		for (double v : m2.thermalCorrection(ThermalGradients.axialRadial(0, 0))) {
			assertEquals(0, v, 0);
		}
		double[] thermal = m2.thermalCorrection(ThermalGradients.axialRadial(-0.0675, -0.1416));
		for (int i = 0; i < thermal.length; i++) {
			double x = SAMPLES[0][i];
			double y = SAMPLES[1][i];
			assertEquals(-0.0675 * SyntheticMirror.thermalDz(3, x, y) - 0.1416 * SyntheticMirror.thermalDz(4, x, y), thermal[i], 1e-12);
		}
		assertThrows(ConfigurationException.class, () -> m2.thermalCorrection(new ThermalGradients(0.1, 0, 0, 0, 0)));
	}

	@Test
	void netSurfaceSumsCorrections() {
		SecondaryMirrorCorrector m2 = corrector();
		ObservingGeometry observing = ObservingGeometry.atZenithAngle(Math.toRadians(27.0912)).withThermal(ThermalGradients.axialRadial(0.2, -0.3));
		SurfaceField net = m2.computeNetSurface(observing);
		double[] print = m2.printThrough(observing.zenithAngle(), 0);
		double[] thermal = m2.thermalCorrection(observing.thermal());
		assertEquals(SAMPLES[0].length, net.size());
		for (int i = 0; i < net.size(); i++) {
			assertEquals(SAMPLES[0][i], net.x(i));
			assertEquals(print[i] + thermal[i], net.z(i), 1e-15);
		}
	}

	@Test
	void netSurfaceVanishesAtPreCompensatedElevation() {
		double t = Math.toRadians(35);
		ObservingGeometry observing = ObservingGeometry.atZenithAngle(t).withPreCompensationElevation(t);
		SurfaceField net = corrector().computeNetSurface(observing);
		assertEquals(SAMPLES[0].length, net.size());
		for (int i = 0; i < net.size(); i++) {
			assertEquals(0, net.z(i), 0);
		}
	}

	@Test
	void netSurfaceRemovesPreCompensatedPrintThrough() {
		double t = Math.toRadians(50);
		double t0 = Math.toRadians(20);
		SurfaceField net = corrector().computeNetSurface(ObservingGeometry.atZenithAngle(t).withPreCompensationElevation(t0));
		for (int i = 0; i < net.size(); i++) {
			double z = SyntheticMirror.zenithDz(SAMPLES[0][i], SAMPLES[1][i]);
			double h = SyntheticMirror.horizonDz(SAMPLES[0][i], SAMPLES[1][i]);
			assertEquals(z * Math.cos(t) + h * Math.sin(t) - (z * Math.cos(t0) + h * Math.sin(t0)), net.z(i), 1e-12);
		}
	}

	@Test
	void mismatchedTablesRejected() {
		double[][] fewer = SyntheticMirror.rings(0.95, 1.68, 5, 30);
		ReferenceTable grid = SyntheticMirror.grid(SAMPLES[0], SAMPLES[1]);
		assertThrows(DataShapeException.class,
				() -> new SecondaryMirrorCorrector(SyntheticMirror.secondaryFea(fewer), grid, SyntheticMirror.forces(), null));
		ReferenceTable narrow = new ReferenceTable("narrow", new double[SAMPLES[0].length][4]);
		assertThrows(DataShapeException.class, () -> new SecondaryMirrorCorrector(narrow, grid, SyntheticMirror.forces(), null));
	}

	@Test
	void lookUpTableIsOptional() {
		assertThrows(ConfigurationException.class, () -> corrector().lutForces(10));

		LutTable lut = new LutTable(new double[] { 0, 60 }, new double[][] { { 0, 6 } });
		SecondaryMirrorCorrector m2 = new SecondaryMirrorCorrector(SyntheticMirror.secondaryFea(SAMPLES),
				SyntheticMirror.grid(SAMPLES[0], SAMPLES[1]), SyntheticMirror.forces(), lut);
		assertArrayEquals(new double[] { 1 }, m2.lutForces(10), 1e-12);
		assertArrayEquals(new double[] { 6 }, m2.lutForces(75));
	}

	@Test
	void zernikeTermInToolFrameIsRemovedExactly() {
		SecondaryMirrorCorrector m2 = corrector();
		double radius = m2.geometry().outerRadius();
		int k = 6; // Z7, coma
		SurfaceField positions = m2.samplePositions();
		double[] nativeValues = new double[positions.size()];
		for (int i = 0; i < nativeValues.length; i++) {
			// the tool frame flips x and the surface sign
			nativeValues[i] = -ZernikeBasis.value(k + 1, -positions.x(i) / radius, positions.y(i) / radius);
		}
		FittedResidual fitted = m2.fitResidual(positions.withValues(nativeValues), 22);
		for (int t = 0; t < 22; t++) {
			assertEquals(t == k ? 1.0 : 0.0, fitted.coefficients().get(t), 1e-9, "term " + (t + 1));
		}
		for (int i = 0; i < fitted.residual().size(); i++) {
			assertEquals(0, fitted.residual().z(i), 1e-9);
			assertEquals(-positions.x(i), fitted.residual().x(i));
		}
	}

	@Test
	void termCountCheckedFirst() {
		SurfaceField positions = corrector().samplePositions();
		assertThrows(ConfigurationException.class, () -> corrector().fitResidual(positions, 0));
		assertThrows(ConfigurationException.class, () -> corrector().fitResidual(positions, ZernikeBasis.MAX_TERMS + 1));
	}

	@Test
	void exportsOneMapInMillimeters() {
		SecondaryMirrorCorrector m2 = corrector();
		FittedResidual fitted = m2.fitResidual(m2.computeNetSurface(ObservingGeometry.atZenithAngle(0.5)), 10);
		Map<String, GridResidueMap> maps = m2.exportGridMaps(fitted.residual(), 8, 8);
		assertEquals(List.of("M2"), List.copyOf(maps.keySet()));
		GridResidueMap map = maps.get("M2");
		assertEquals(12, map.xCount());
		assertEquals(12, map.yCount());
		assertEquals(2 * 1710 * (11.0 / 7.0) / 11, map.pitchX(), 1e-9);
		boolean anyNonZero = false;
		for (int k = 0; k < map.nodeCount(); k++) {
			anyNonZero |= map.node(k)[0] != 0;
		}
		assertTrue(anyNonZero);
	}

	@Test
	void loadsDefaultFiles() throws IOException {
		SyntheticMirror.writeSecondary(dir, SAMPLES);
		SecondaryMirrorCorrector loaded = SecondaryMirrorCorrector.load(SecondaryMirrorCorrector.Config.defaults(dir));
		assertEquals(SAMPLES[0].length, loaded.samplePositions().size());
		assertEquals(2, loaded.actuatorForces().rowCount());
		assertArrayEquals(corrector().printThrough(0.3, 0), loaded.printThrough(0.3, 0), 1e-12);

		assertTrue(loaded.lut().isEmpty());

		SyntheticMirror.write(dir.resolve("M2_LUT.txt"), null, new ReferenceTable("lut", new double[][] { { 0, 90 }, { 0, 9 } }));
		SecondaryMirrorCorrector withLut = SecondaryMirrorCorrector.load(SecondaryMirrorCorrector.Config.defaults(dir).withLutFile("M2_LUT.txt"));
		assertArrayEquals(new double[] { 3 }, withLut.lutForces(30), 1e-12);

		Files.delete(dir.resolve("M2_1um_force.DAT"));
		assertThrows(IOException.class, () -> SecondaryMirrorCorrector.load(SecondaryMirrorCorrector.Config.defaults(dir)));
	}
}
