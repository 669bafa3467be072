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

import phasorlab.lib.images.PhasorField;

/**
 * Exclude pixels whose raw total photon count falls outside an inclusive range.
 * <p>
 * The decision depends only on the raw photon counts stored in the {@link PhasorField}, 
 * never on (possibly smoothed) phasor coordinates.
 * 
 * @author PhasorLab developers
 */
public class PhotonCountThreshold {
	
	/**
	 * Label for pixels below the minimum count.
	 */
	public static final byte LABEL_BELOW = 0;
	
	/**
	 * Label for pixels within the range.
	 */
	public static final byte LABEL_KEPT = 1;
	
	/**
	 * Label for pixels above the maximum count.
	 */
	public static final byte LABEL_ABOVE = 2;
	
	private final int minCount;
	private final int maxCount;
	
	/**
	 * Constructor.
	 * @param minCount minimum count (inclusive)
	 * @param maxCount maximum count (inclusive)
	 */
	public PhotonCountThreshold(int minCount, int maxCount) {
		if (minCount > maxCount)
			throw new IllegalArgumentException("Minimum count " + minCount + " exceeds maximum count " + maxCount);
		this.minCount = minCount;
		this.maxCount = maxCount;
	}
	
	/**
	 * Returns true if a count is within the range.
	 * @param count
	 * @return
	 */
	public boolean accepts(int count) {
		return count >= minCount && count <= maxCount;
	}
	
	/**
	 * Create a mask of pixels within the count range.
	 * @param field
	 * @return a new array, true for pixels that are kept
	 */
	public boolean[] createMask(PhasorField field) {
		int n = field.nPixels();
		boolean[] mask = new boolean[n];
		for (int i = 0; i < n; i++)
			mask[i] = accepts(field.getTotalCount(i));
		return mask;
	}
	
	/**
	 * Create a label image showing why pixels are excluded: 
	 * {@link #LABEL_BELOW}, {@link #LABEL_KEPT} or {@link #LABEL_ABOVE}.
	 * 
	 * @param field
	 * @return a new array of labels
	 */
	public byte[] createLabels(PhasorField field) {
		int n = field.nPixels();
		byte[] labels = new byte[n];
		for (int i = 0; i < n; i++) {
			int count = field.getTotalCount(i);
			if (count < minCount)
				labels[i] = LABEL_BELOW;
			else if (count > maxCount)
				labels[i] = LABEL_ABOVE;
			else
				labels[i] = LABEL_KEPT;
		}
		return labels;
	}
	
	/**
	 * Get the raw photon counts with excluded pixels set to 0.
	 * @param field
	 * @return a new array of counts
	 */
	public int[] createFilteredCounts(PhasorField field) {
		int[] counts = field.getTotalCounts();
		for (int i = 0; i < counts.length; i++) {
			if (!accepts(counts[i]))
				counts[i] = 0;
		}
		return counts;
	}
	
	/**
	 * Apply the threshold, setting the coordinates of excluded pixels to NaN for every harmonic.
	 * 
	 * @param field the input field (unchanged)
	 * @return a new field
	 */
	public PhasorField apply(PhasorField field) {
		boolean[] mask = createMask(field);
		float[][] real = field.getRealArrays();
		float[][] imag = field.getImaginaryArrays();
		for (int h = 0; h < real.length; h++) {
			for (int i = 0; i < mask.length; i++) {
				if (!mask[i]) {
					real[h][i] = Float.NaN;
					imag[h][i] = Float.NaN;
				}
			}
		}
		return field.withCoordinates(real, imag);
	}
	
	@Override
	public String toString() {
		return "PhotonCountThreshold (" + minCount + "-" + maxCount + ")";
	}

}
