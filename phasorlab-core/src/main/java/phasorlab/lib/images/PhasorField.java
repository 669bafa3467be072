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

package phasorlab.lib.images;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable per-pixel phasor coordinates for one or more harmonics, together with the total photon count of each pixel.
 * <p>
 * Invalid pixels (no photons, or excluded by filtering) have NaN coordinates.
 * The total photon count is always the raw sum over the decay histogram: calibration and filtering 
 * create new fields that share the same counts.
 * <p>
 * Pixels are indexed in row-major order, i.e. {@code index = y * width + x}.
 * 
 * @author PhasorLab developers
 */
public class PhasorField {
	
	private final int width;
	private final int height;
	private final int[] harmonics;
	private final float[][] real;
	private final float[][] imag;
	private final int[] totalCounts;
	
	private PhasorField(int width, int height, int[] harmonics, float[][] real, float[][] imag, int[] totalCounts) {
		this.width = width;
		this.height = height;
		this.harmonics = harmonics;
		this.real = real;
		this.imag = imag;
		this.totalCounts = totalCounts;
	}
	
	/**
	 * Create a new phasor field. All arrays are copied.
	 * 
	 * @param width
	 * @param height
	 * @param harmonics the harmonics represented, in the same order as the first dimension of {@code real} and {@code imag}
	 * @param real g coordinates, one array per harmonic
	 * @param imag s coordinates, one array per harmonic
	 * @param totalCounts total photon counts per pixel
	 * @return
	 */
	public static PhasorField create(int width, int height, int[] harmonics, float[][] real, float[][] imag, int[] totalCounts) {
		Objects.requireNonNull(harmonics);
		int n = width * height;
		if (real.length != harmonics.length || imag.length != harmonics.length)
			throw new IllegalArgumentException("Number of coordinate arrays does not match number of harmonics");
		if (totalCounts.length != n)
			throw new IllegalArgumentException("Expected " + n + " total counts, but got " + totalCounts.length);
		for (int h = 0; h < harmonics.length; h++) {
			if (real[h].length != n || imag[h].length != n)
				throw new IllegalArgumentException("Coordinate arrays must have length " + n);
		}
		return new PhasorField(width, height, harmonics.clone(), deepCopy(real), deepCopy(imag), totalCounts.clone());
	}
	
	/**
	 * Create a new field with the same shape, harmonics and photon counts as this one, but different coordinates.
	 * Ownership of the provided arrays is transferred to the new field; they must not be modified afterwards.
	 * 
	 * @param real
	 * @param imag
	 * @return
	 */
	public PhasorField withCoordinates(float[][] real, float[][] imag) {
		if (real.length != harmonics.length || imag.length != harmonics.length)
			throw new IllegalArgumentException("Number of coordinate arrays does not match number of harmonics");
		for (int h = 0; h < harmonics.length; h++) {
			if (real[h].length != totalCounts.length || imag[h].length != totalCounts.length)
				throw new IllegalArgumentException("Coordinate arrays must have length " + totalCounts.length);
		}
		return new PhasorField(width, height, harmonics, real, imag, totalCounts);
	}
	
	private static float[][] deepCopy(float[][] arrays) {
		float[][] copy = new float[arrays.length][];
		for (int i = 0; i < arrays.length; i++)
			copy[i] = arrays[i].clone();
		return copy;
	}
	
	/**
	 * Number of columns.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Number of rows.
	 * @return
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Total number of pixels.
	 * @return
	 */
	public int nPixels() {
		return totalCounts.length;
	}
	
	/**
	 * Get the harmonics represented by this field. The first is the one used for all derived metrics.
	 * @return
	 */
	public int[] getHarmonics() {
		return harmonics.clone();
	}
	
	/**
	 * Returns true if coordinates are available for the specified harmonic.
	 * @param harmonic
	 * @return
	 */
	public boolean hasHarmonic(int harmonic) {
		return indexOfHarmonic(harmonic) >= 0;
	}
	
	private int indexOfHarmonic(int harmonic) {
		for (int i = 0; i < harmonics.length; i++) {
			if (harmonics[i] == harmonic)
				return i;
		}
		return -1;
	}
	
	private int requireHarmonic(int harmonic) {
		int ind = indexOfHarmonic(harmonic);
		if (ind < 0)
			throw new IllegalArgumentException("Harmonic " + harmonic + " not available, harmonics are " + Arrays.toString(harmonics));
		return ind;
	}
	
	/**
	 * Get the g coordinate of a pixel for the first harmonic.
	 * @param index pixel index
	 * @return
	 */
	public float getG(int index) {
		return real[0][index];
	}
	
	/**
	 * Get the s coordinate of a pixel for the first harmonic.
	 * @param index pixel index
	 * @return
	 */
	public float getS(int index) {
		return imag[0][index];
	}
	
	/**
	 * Get the g coordinate of a pixel for the specified harmonic.
	 * @param harmonic
	 * @param index pixel index
	 * @return
	 */
	public float getG(int harmonic, int index) {
		return real[requireHarmonic(harmonic)][index];
	}
	
	/**
	 * Get the s coordinate of a pixel for the specified harmonic.
	 * @param harmonic
	 * @param index pixel index
	 * @return
	 */
	public float getS(int harmonic, int index) {
		return imag[requireHarmonic(harmonic)][index];
	}
	
	/**
	 * Get a copy of all g coordinates for the specified harmonic.
	 * @param harmonic
	 * @return
	 */
	public float[] getReal(int harmonic) {
		return real[requireHarmonic(harmonic)].clone();
	}
	
	/**
	 * Get a copy of all s coordinates for the specified harmonic.
	 * @param harmonic
	 * @return
	 */
	public float[] getImaginary(int harmonic) {
		return imag[requireHarmonic(harmonic)].clone();
	}
	
	/**
	 * Get a copy of the coordinate arrays for all harmonics, in the order of {@link #getHarmonics()}.
	 * @return
	 */
	public float[][] getRealArrays() {
		return deepCopy(real);
	}

	/**
	 * Get a copy of the coordinate arrays for all harmonics, in the order of {@link #getHarmonics()}.
	 * @return
	 */
	public float[][] getImaginaryArrays() {
		return deepCopy(imag);
	}
	
	/**
	 * Get the raw total photon count of a pixel.
	 * @param index
	 * @return
	 */
	public int getTotalCount(int index) {
		return totalCounts[index];
	}
	
	/**
	 * Get a copy of the raw total photon counts.
	 * @return
	 */
	public int[] getTotalCounts() {
		return totalCounts.clone();
	}
	
	/**
	 * Returns true if the pixel has finite coordinates for the first harmonic.
	 * @param index
	 * @return
	 */
	public boolean isValid(int index) {
		return Float.isFinite(real[0][index]) && Float.isFinite(imag[0][index]);
	}
	
	/**
	 * Count the pixels with finite coordinates for the first harmonic.
	 * @return
	 */
	public int countValid() {
		int count = 0;
		for (int i = 0; i < totalCounts.length; i++) {
			if (isValid(i))
				count++;
		}
		return count;
	}
	
	/**
	 * Compute the photon-weighted mean phasor coordinate over all valid pixels.
	 * This is equivalent to the phasor of the summed decay of all valid pixels.
	 * 
	 * @param harmonic
	 * @return array containing {g, s}, which are NaN if there are no valid pixels
	 */
	public double[] getPooledCenter(int harmonic) {
		int h = requireHarmonic(harmonic);
		double sumG = 0, sumS = 0, sumWeights = 0;
		for (int i = 0; i < totalCounts.length; i++) {
			float g = real[h][i];
			float s = imag[h][i];
			if (!Float.isFinite(g) || !Float.isFinite(s))
				continue;
			double w = totalCounts[i];
			sumG += g * w;
			sumS += s * w;
			sumWeights += w;
		}
		if (sumWeights == 0)
			return new double[] {Double.NaN, Double.NaN};
		return new double[] {sumG / sumWeights, sumS / sumWeights};
	}
	
	@Override
	public String toString() {
		return String.format("PhasorField[%d x %d, harmonics=%s, valid=%d]", width, height, Arrays.toString(harmonics), countValid());
	}

}
