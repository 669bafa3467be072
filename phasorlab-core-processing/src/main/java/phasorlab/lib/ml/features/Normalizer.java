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

package phasorlab.lib.ml.features;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Class to help with simple feature normalization, by adding an offset and then multiplying by a scaling factor.
 * 
 * @author PhasorLab developers
 */
public class Normalizer {
	
	private final double[] offsets;
	private final double[] scales;
	private final List<DegenerateNormalizationWarning> warnings;
	private transient Boolean isIdentity;
	
	private Normalizer(double[] offsets, double[] scales, List<DegenerateNormalizationWarning> warnings) {
		if (offsets.length != scales.length)
			throw new IllegalArgumentException("Length of offsets and scales arrays do not match!");
		this.offsets = offsets.clone();
		this.scales = scales.clone();
		this.warnings = warnings == null ? Collections.emptyList() : ImmutableList.copyOf(warnings);
	}
	
	/**
	 * Create a {@link Normalizer} with the specified parameters.
	 * @param offsets value to add to each feature
	 * @param scales value to multiply each feature, after applying the offset
	 * @return a {@link Normalizer} initialized accordingly
	 */
	public static Normalizer createNormalizer(double[] offsets, double[] scales) {
		return new Normalizer(offsets, scales, null);
	}
	
	static Normalizer createNormalizer(double[] offsets, double[] scales, List<DegenerateNormalizationWarning> warnings) {
		return new Normalizer(offsets, scales, warnings);
	}
	
	/**
	 * Normalize a single feature.
	 * @param idx the index of the feature; this is required to identify the corresponding offset and scale
	 * @param originalValue the original value of the feature
	 * @return the normalized value of the feature
	 */
	public double normalizeFeature(int idx, double originalValue) {
		if (isIdentity())
			return originalValue;
		return (originalValue + offsets[idx]) * scales[idx];
	}
	
	/**
	 * Normalize all values in a 2D array, with one row per sample and one column per feature.
	 * @param samples input values (unchanged)
	 * @return a new array of normalized values
	 */
	public double[][] normalize(double[][] samples) {
		double[][] result = new double[samples.length][];
		for (int r = 0; r < samples.length; r++) {
			double[] row = samples[r];
			if (row.length != nFeatures())
				throw new IllegalArgumentException("Expected " + nFeatures() + " features, but row " + r + " has " + row.length);
			double[] output = new double[row.length];
			for (int c = 0; c < row.length; c++)
				output[c] = normalizeFeature(c, row[c]);
			result[r] = output;
		}
		return result;
	}
	
	/**
	 * Test is all entries of an array are identical to a specified value.
	 * @param array
	 * @param val
	 * @return true if {@code array[i] == val} for all i within the array, false otherwise.
	 */
	private static boolean allEqual(double[] array, double val) {
		for (double d : array) {
			if (d != val)
				return false;
		}
		return true;
	}
	
	/**
	 * Returns true if this normalizer does not actually do anything.
	 * This is the case if all offsets are zero and all scales are 1.
	 * @return
	 */
	public boolean isIdentity() {
		if (isIdentity == null) {
			isIdentity = Boolean.valueOf(allEqual(offsets, 0) && allEqual(scales, 1));			
		}
		return isIdentity.booleanValue();
	}
	
	/**
	 * The total number of features supported by this {@link Normalizer}
	 * @return
	 */
	public int nFeatures() {
		return scales.length;
	}
	
	/**
	 * Get the offset for the specified feature
	 * @param ind index of the feature
	 * @return
	 */
	public double getOffset(int ind) {
		return offsets[ind];
	}

	/**
	 * Get the scale factor for the specified feature
	 * @param ind index of the feature
	 * @return
	 */
	public double getScale(int ind) {
		return scales[ind];
	}
	
	/**
	 * Get warnings for columns that could not be scaled when this normalizer was created.
	 * @return
	 */
	public List<DegenerateNormalizationWarning> getWarnings() {
		return warnings;
	}
	
	@Override
	public String toString() {
		return "Normalizer (" + nFeatures() + " features" + (warnings.isEmpty() ? "" : ", " + warnings.size() + " degenerate") + ")";
	}
	
}
