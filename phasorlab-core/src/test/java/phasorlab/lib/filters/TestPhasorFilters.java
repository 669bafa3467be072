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

package phasorlab.lib.filters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import phasorlab.lib.images.PhasorField;

@SuppressWarnings("javadoc")
public class TestPhasorFilters {
	
	@Test
	public void test_medianThenThreshold() {
		int width = 3, height = 3;
		float[] g = {0.5f, 0.5f, 0.5f, 0.5f, 0.9f, 0.5f, 0.5f, 0.5f, 0.5f};
		float[] s = {0.2f, 0.2f, 0.2f, 0.2f, 0.0f, 0.2f, 0.2f, 0.2f, 0.2f};
		// The outlier has a low count, but still contributes to smoothing its neighbours before being removed
		int[] counts = {100, 100, 100, 100, 1, 100, 100, 100, 100};
		var field = PhasorField.create(width, height, new int[] {1}, new float[][] {g}, new float[][] {s}, counts);
		
		var filtered = PhasorFilters.apply(field, FilterParameters.create(3, 1, 10, 1000));
		assertEquals(8, filtered.countValid());
		assertTrue(Float.isNaN(filtered.getG(4)));
		for (int i = 0; i < 9; i++) {
			if (i == 4)
				continue;
			assertEquals(0.5f, filtered.getG(i));
			assertEquals(0.2f, filtered.getS(i));
		}
	}
	
	@Test
	public void test_defaultsKeepCoordinates() {
		float[] g = {0.1f, 0.9f, 0.3f, 0.7f};
		float[] s = {0.4f, 0.1f, 0.2f, 0.3f};
		var field = PhasorField.create(2, 2, new int[] {1}, new float[][] {g}, new float[][] {s}, new int[] {5, 5, 5, 5});
		var filtered = PhasorFilters.apply(field, FilterParameters.create(3, 0, 0, 100));
		for (int i = 0; i < 4; i++) {
			assertEquals(g[i], filtered.getG(i));
			assertEquals(s[i], filtered.getS(i));
		}
	}

}
