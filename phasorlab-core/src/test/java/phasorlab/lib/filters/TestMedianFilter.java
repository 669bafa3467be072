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
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestMedianFilter {
	
	private static float[] createRandom(int n, long seed, double nanProbability) {
		var rng = new Random(seed);
		float[] pixels = new float[n];
		for (int i = 0; i < n; i++)
			pixels[i] = rng.nextDouble() < nanProbability ? Float.NaN : (float)rng.nextGaussian();
		return pixels;
	}
	
	@Test
	public void test_invalidParameters() {
		assertThrows(IllegalArgumentException.class, () -> new MedianFilter(2, 1));
		assertThrows(IllegalArgumentException.class, () -> new MedianFilter(0, 1));
		assertThrows(IllegalArgumentException.class, () -> new MedianFilter(3, -1));
	}
	
	@Test
	public void test_noOp() {
		float[] pixels = createRandom(100, 1L, 0.1);
		for (var filter : List.of(new MedianFilter(1, 5), new MedianFilter(5, 0))) {
			assertTrue(filter.isNoOp());
			float[] output = filter.filter(pixels, 10, 10);
			assertNotSame(pixels, output);
			assertArrayEquals(pixels, output);
		}
		assertFalse(new MedianFilter(3, 1).isNoOp());
	}
	
	@Test
	public void test_inputUnchanged() {
		float[] pixels = createRandom(100, 2L, 0.0);
		float[] copy = pixels.clone();
		new MedianFilter(3, 2).filter(pixels, 10, 10);
		assertArrayEquals(copy, pixels);
	}
	
	@Test
	public void test_compareCommonsMath() {
		int width = 13, height = 9;
		float[] pixels = createRandom(width * height, 3L, 0.2);
		for (int kernelSize : new int[] {3, 5}) {
			float[] output = new MedianFilter(kernelSize, 1).filter(pixels, width, height);
			int radius = kernelSize / 2;
			var median = new Median();
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					int ind = y * width + x;
					if (Float.isNaN(pixels[ind])) {
						assertTrue(Float.isNaN(output[ind]));
						continue;
					}
					List<Double> values = new ArrayList<>();
					for (int yy = Math.max(0, y - radius); yy <= Math.min(height - 1, y + radius); yy++) {
						for (int xx = Math.max(0, x - radius); xx <= Math.min(width - 1, x + radius); xx++) {
							float val = pixels[yy * width + xx];
							if (!Float.isNaN(val))
								values.add((double)val);
						}
					}
					double expected = median.evaluate(values.stream().mapToDouble(d -> d).toArray());
					assertEquals(expected, output[ind], 1e-6);
				}
			}
		}
	}
	
	@Test
	public void test_evenNeighbourCount() {
		// Corner pixel of a 3x3 window sees 4 values
		float[] pixels = {
				1, 2, 100,
				3, 4, 100,
				100, 100, 100
		};
		float[] output = new MedianFilter(3, 1).filter(pixels, 3, 3);
		assertEquals(2.5f, output[0]);
	}
	
	@Test
	public void test_removesOutlier() {
		float[] pixels = new float[25];
		pixels[12] = 10;
		float[] output = new MedianFilter(3, 1).filter(pixels, 5, 5);
		for (float v : output)
			assertEquals(0f, v);
	}
	
	@Test
	public void test_repetitions() {
		int width = 8, height = 8;
		float[] pixels = createRandom(width * height, 4L, 0.1);
		var once = new MedianFilter(3, 1);
		float[] expected = once.filter(once.filter(pixels, width, height), width, height);
		assertArrayEquals(expected, new MedianFilter(3, 2).filter(pixels, width, height));
	}
	
	@Test
	public void test_allNaN() {
		float[] pixels = new float[9];
		java.util.Arrays.fill(pixels, Float.NaN);
		for (float v : new MedianFilter(3, 3).filter(pixels, 3, 3))
			assertTrue(Float.isNaN(v));
	}

}
