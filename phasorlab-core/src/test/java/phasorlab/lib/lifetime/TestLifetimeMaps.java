/*-
 * #%L
 * This file is part of PhasorLab.
 * %%
 * Copyright (C) 2024 - 2025 PhasorLab developers
 * %%
 * PhasorLab is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * PhasorLab is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with PhasorLab.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package phasorlab.lib.lifetime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import phasorlab.lib.datasets.Dataset;
import phasorlab.lib.filters.FilterParameters;
import phasorlab.lib.filters.PhotonCountThreshold;
import phasorlab.lib.images.PhasorField;
import phasorlab.lib.images.SyntheticDecays;
import phasorlab.lib.phasor.PhasorTools;
import phasorlab.lib.phasor.PhasorTransform;

@SuppressWarnings("javadoc")
public class TestLifetimeMaps {
	
	private static final double FREQUENCY = 80;
	
	private static PhasorField createField() {
		double omega = PhasorTools.angularFrequency(FREQUENCY);
		float[] g1 = new float[3], s1 = new float[3], g2 = new float[3], s2 = new float[3];
		// Pixel 0: mixture of 0.5 ns and 4 ns
		for (int h = 1; h <= 2; h++) {
			double[] a = PhasorTools.semicirclePoint(h * omega, 0.5);
			double[] b = PhasorTools.semicirclePoint(h * omega, 4.0);
			float g = (float)(0.4 * a[0] + 0.6 * b[0]);
			float s = (float)(0.4 * a[1] + 0.6 * b[1]);
			if (h == 1) {
				g1[0] = g;
				s1[0] = s;
			} else {
				g2[0] = g;
				s2[0] = s;
			}
		}
		// Pixel 1: single exponential of 2 ns
		double[] p1 = PhasorTools.semicirclePoint(omega, 2.0);
		double[] p2 = PhasorTools.semicirclePoint(2 * omega, 2.0);
		g1[1] = (float)p1[0];
		s1[1] = (float)p1[1];
		g2[1] = (float)p2[0];
		s2[1] = (float)p2[1];
		// Pixel 2: invalid
		g1[2] = s1[2] = g2[2] = s2[2] = Float.NaN;
		return PhasorField.create(3, 1, new int[] {1, 2}, new float[][] {g1, g2}, new float[][] {s1, s2}, new int[] {100, 100, 0});
	}
	
	@Test
	public void test_compute() {
		var maps = LifetimeMaps.compute(createField(), FREQUENCY);
		assertEquals(3, maps.getWidth());
		assertEquals(1, maps.getHeight());
		assertEquals(FREQUENCY, maps.getFrequency());
		assertEquals(2, maps.getNumValid());
		assertEquals(1, maps.getNumUnresolved());
		assertEquals(0.5, maps.getFailureFraction(), 1e-12);
		
		assertEquals(0.5, maps.getTau1()[0], 1e-4);
		assertEquals(4.0, maps.getTau2()[0], 1e-4);
		assertEquals(0.4, maps.getFraction1()[0], 1e-4);
		assertEquals(0.6, maps.getFraction2()[0], 1e-4);
		assertEquals(0.4 * 0.5 + 0.6 * 4.0, maps.getAverageLifetime()[0], 1e-3);
		
		// Apparent lifetimes exist for the single exponential, but it cannot be resolved
		assertEquals(2.0, maps.getPhiLifetime()[1], 1e-4);
		assertEquals(2.0, maps.getMLifetime()[1], 1e-4);
		assertEquals(2.0, maps.getProjLifetime()[1], 1e-4);
		assertTrue(Float.isNaN(maps.getTau1()[1]));
		assertTrue(Float.isNaN(maps.getAverageLifetime()[1]));
		
		// Invalid pixels have no lifetimes
		assertTrue(Float.isNaN(maps.getPhiLifetime()[2]));
		assertTrue(Float.isNaN(maps.getMLifetime()[2]));
		assertTrue(Float.isNaN(maps.getProjLifetime()[2]));
		assertTrue(Float.isNaN(maps.getFraction1()[2]));
	}
	
	@Test
	public void test_noFrequency() {
		var maps = LifetimeMaps.compute(createField(), Double.NaN);
		for (float v : maps.getPhiLifetime())
			assertTrue(Float.isNaN(v));
		for (float v : maps.getTau1())
			assertTrue(Float.isNaN(v));
	}
	
	@Test
	public void test_firstHarmonicOnly() {
		var field = createField();
		var single = PhasorField.create(3, 1, new int[] {1}, 
				new float[][] {field.getReal(1)}, new float[][] {field.getImaginary(1)}, field.getTotalCounts());
		var maps = LifetimeMaps.compute(single, FREQUENCY);
		assertEquals(2, maps.getNumUnresolved());
		assertEquals(2.0, maps.getPhiLifetime()[1], 1e-4);
		assertTrue(Float.isNaN(maps.getTau1()[0]));
	}
	
	@Test
	public void test_copies() {
		var maps = LifetimeMaps.compute(createField(), FREQUENCY);
		float[] phi = maps.getPhiLifetime();
		phi[1] = -1;
		assertEquals(2.0, maps.getPhiLifetime()[1], 1e-4);
	}
	
	@Test
	public void test_syntheticDecay() {
		int[] decay = SyntheticDecays.monoExponential(1000, 2.5, FREQUENCY, 64);
		var cube = SyntheticDecays.singlePixelCube("cube", 4, 4, 2, 1, decay, FREQUENCY);
		var dataset = Dataset.create(cube, PhasorTransform.create());
		assertEquals(1, LifetimeMaps.compute(dataset.getRawField(), FREQUENCY).getNumValid());
		
		dataset.setFilterParameters(FilterParameters.create(1, 0, 1, 2000));
		var maps = dataset.getLifetimeMaps();
		assertEquals(1, maps.getNumValid());
		int ind = 1 * 4 + 2;
		assertEquals(PhotonCountThreshold.LABEL_KEPT, dataset.getThresholdLabels()[ind]);
		assertEquals(2.5, maps.getPhiLifetime()[ind], 2.5 * 0.05);
		assertEquals(2.5, maps.getMLifetime()[ind], 2.5 * 0.05);
		
		// The same pixel is rejected once its count exceeds the upper bound
		dataset.setFilterParameters(FilterParameters.create(1, 0, 1, 500));
		assertEquals(0, dataset.getLifetimeMaps().getNumValid());
	}

}
