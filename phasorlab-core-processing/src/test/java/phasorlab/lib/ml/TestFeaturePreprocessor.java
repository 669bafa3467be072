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

package phasorlab.lib.ml;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import phasorlab.lib.classifiers.Normalization;

@SuppressWarnings("javadoc")
public class TestFeaturePreprocessor {
	
	private static final double[][] DATA = {
			{1, 10, 7}, 
			{2, 30, 7}, 
			{3, 20, 7}, 
			{4, 50, 7}, 
			{5, 40, 7}
	};
	
	@Test
	public void test_noOp() {
		var preprocessor = FeaturePreprocessor.builder().build(DATA);
		assertFalse(preprocessor.doesSomething());
		assertFalse(preprocessor.doesFeatureTransform());
		assertEquals(3, preprocessor.getInputLength());
		assertEquals(3, preprocessor.getOutputLength());
		
		double[][] output = preprocessor.apply(DATA);
		assertNotSame(DATA, output);
		assertNotSame(DATA[0], output[0]);
		assertArrayEquals(DATA[2], output[2]);
	}
	
	@Test
	public void test_normalizeOnly() {
		var preprocessor = FeaturePreprocessor.builder()
				.normalize(Normalization.ROBUST)
				.featureNames(Arrays.asList("a", "b", "c"))
				.build(DATA);
		assertTrue(preprocessor.doesSomething());
		assertFalse(preprocessor.doesFeatureTransform());
		assertEquals(3, preprocessor.getOutputLength());
		
		assertEquals(1, preprocessor.getWarnings().size());
		assertEquals("c", preprocessor.getWarnings().get(0).getFeatureName());
		
		double[][] output = preprocessor.apply(DATA);
		// Median 3, IQR 2
		assertEquals(-1.0, output[0][0], 1e-12);
		assertEquals(0.0, output[4][2], 1e-12);
	}
	
	@Test
	public void test_normalizeAndPCA() {
		var builder = FeaturePreprocessor.builder()
				.normalize(Normalization.ZSCORE)
				.pca(2);
		assertEquals(Normalization.ZSCORE, builder.getNormalization());
		assertEquals(2, builder.getPCAComponents());
		
		var preprocessor = builder.build(DATA);
		assertTrue(preprocessor.doesFeatureTransform());
		assertEquals(3, preprocessor.getInputLength());
		assertEquals(2, preprocessor.getOutputLength());
		
		double[][] output = preprocessor.apply(DATA);
		assertEquals(DATA.length, output.length);
		for (int c = 0; c < 2; c++) {
			double sum = 0;
			for (double[] row : output) {
				assertEquals(2, row.length);
				sum += row[c];
			}
			assertEquals(0, sum, 1e-9);
		}
	}
	
	@Test
	public void test_pcaDisabled() {
		var preprocessor = FeaturePreprocessor.builder().pca(0).build(DATA);
		assertFalse(preprocessor.doesFeatureTransform());
		assertTrue(preprocessor.getWarnings().isEmpty());
	}

}
