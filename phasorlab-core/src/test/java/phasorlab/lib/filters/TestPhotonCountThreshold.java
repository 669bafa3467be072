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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import phasorlab.lib.images.PhasorField;

@SuppressWarnings("javadoc")
public class TestPhotonCountThreshold {
	
	private static PhasorField createField(int... counts) {
		int n = counts.length;
		float[] g = new float[n];
		float[] s = new float[n];
		java.util.Arrays.fill(g, 0.5f);
		java.util.Arrays.fill(s, 0.4f);
		return PhasorField.create(n, 1, new int[] {1, 2}, new float[][] {g, g}, new float[][] {s, s}, counts);
	}
	
	@Test
	public void test_inclusiveBounds() {
		var threshold = new PhotonCountThreshold(10, 20);
		assertFalse(threshold.accepts(9));
		assertTrue(threshold.accepts(10));
		assertTrue(threshold.accepts(20));
		assertFalse(threshold.accepts(21));
		
		assertTrue(new PhotonCountThreshold(5, 5).accepts(5));
		assertThrows(IllegalArgumentException.class, () -> new PhotonCountThreshold(6, 5));
	}
	
	@Test
	public void test_apply() {
		var field = createField(0, 9, 10, 20, 21);
		var filtered = new PhotonCountThreshold(10, 20).apply(field);
		boolean[] expected = {false, false, true, true, false};
		for (int i = 0; i < expected.length; i++) {
			assertEquals(expected[i], filtered.isValid(i));
			assertEquals(expected[i], Float.isFinite(filtered.getG(2, i)));
			assertEquals(expected[i], Float.isFinite(filtered.getS(2, i)));
			// Counts are retained
			assertEquals(field.getTotalCount(i), filtered.getTotalCount(i));
		}
		assertEquals(5, field.countValid());
	}
	
	@Test
	public void test_idempotent() {
		var field = createField(1, 50, 100, 150);
		var threshold = new PhotonCountThreshold(50, 100);
		var once = threshold.apply(field);
		var twice = threshold.apply(once);
		assertArrayEquals(once.getReal(1), twice.getReal(1));
		assertArrayEquals(once.getImaginary(1), twice.getImaginary(1));
	}
	
	@Test
	public void test_labels() {
		var field = createField(0, 10, 15, 20, 30);
		var threshold = new PhotonCountThreshold(10, 20);
		assertArrayEquals(new byte[] {
				PhotonCountThreshold.LABEL_BELOW, 
				PhotonCountThreshold.LABEL_KEPT, 
				PhotonCountThreshold.LABEL_KEPT, 
				PhotonCountThreshold.LABEL_KEPT, 
				PhotonCountThreshold.LABEL_ABOVE}, 
				threshold.createLabels(field));
		assertArrayEquals(new boolean[] {false, true, true, true, false}, threshold.createMask(field));
		assertArrayEquals(new int[] {0, 10, 15, 20, 0}, threshold.createFilteredCounts(field));
	}

}
