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

import java.util.Objects;

/**
 * An immutable volume of photon counts, indexed by (row, column, time bin).
 * <p>
 * The time-bin axis of each pixel is a decay histogram covering exactly one period of the laser repetition.
 * Counts are stored in a single array in row-major order, with the time bins for each pixel stored contiguously.
 * 
 * @author PhasorLab developers
 */
public class DecayCube {
	
	private final String name;
	private final int channel;
	private final int width;
	private final int height;
	private final int nBins;
	private final double binWidth;
	private final double frequency;
	
	private final int[] counts;
	
	private DecayCube(String name, int channel, int width, int height, int nBins, int[] counts, double binWidth, double frequency) {
		this.name = name;
		this.channel = channel;
		this.width = width;
		this.height = height;
		this.nBins = nBins;
		this.counts = counts;
		this.binWidth = binWidth;
		this.frequency = frequency;
	}
	
	/**
	 * Create a new decay cube from an array of counts.
	 * The array is copied, so later changes to it do not affect the cube.
	 * 
	 * @param name name of the dataset (usually derived from the file name)
	 * @param channel zero-based channel index
	 * @param width number of columns
	 * @param height number of rows
	 * @param nBins number of time bins per pixel
	 * @param counts photon counts, length {@code width * height * nBins}, with index {@code (y * width + x) * nBins + t}
	 * @param binWidth width of each time bin in ns, or NaN if unknown
	 * @param frequency laser repetition frequency in MHz, or NaN if unknown
	 * @return
	 * @throws IllegalArgumentException if the dimensions do not match the array length or any count is negative
	 */
	public static DecayCube create(String name, int channel, int width, int height, int nBins, int[] counts, double binWidth, double frequency) {
		Objects.requireNonNull(counts, "Counts must not be null");
		if (width <= 0 || height <= 0 || nBins <= 0)
			throw new IllegalArgumentException(String.format("Invalid decay cube dimensions %d x %d x %d", width, height, nBins));
		if ((long)width * height * nBins != counts.length)
			throw new IllegalArgumentException(String.format("Expected %d counts for %d x %d x %d cube, but got %d",
					(long)width * height * nBins, width, height, nBins, counts.length));
		for (int c : counts) {
			if (c < 0)
				throw new IllegalArgumentException("Photon counts must be non-negative, but found " + c);
		}
		if (frequency <= 0)
			frequency = Double.NaN;
		return new DecayCube(name == null ? "" : name, channel, width, height, nBins, counts.clone(), binWidth, frequency);
	}
	
	/**
	 * Create a decay cube with unknown bin width and laser frequency.
	 * 
	 * @param name
	 * @param width
	 * @param height
	 * @param nBins
	 * @param counts
	 * @return
	 * @see #create(String, int, int, int, int, int[], double, double)
	 */
	public static DecayCube create(String name, int width, int height, int nBins, int[] counts) {
		return create(name, 0, width, height, nBins, counts, Double.NaN, Double.NaN);
	}
	
	/**
	 * Name of the dataset this cube was read from.
	 * @return
	 */
	public String getName() {
		return name;
	}
	
	/**
	 * Zero-based channel index.
	 * @return
	 */
	public int getChannel() {
		return channel;
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
	 * Number of time bins per pixel.
	 * @return
	 */
	public int getNumBins() {
		return nBins;
	}
	
	/**
	 * Width of a time bin in ns, or NaN if unknown.
	 * @return
	 */
	public double getBinWidth() {
		return binWidth;
	}
	
	/**
	 * Laser repetition frequency in MHz, or NaN if it could not be discovered.
	 * @return
	 */
	public double getFrequency() {
		return frequency;
	}
	
	/**
	 * Returns true if the laser repetition frequency is known.
	 * @return
	 */
	public boolean hasFrequency() {
		return Double.isFinite(frequency);
	}
	
	/**
	 * Get the photon count for a single pixel and time bin.
	 * @param x column
	 * @param y row
	 * @param t time bin
	 * @return
	 */
	public int getCount(int x, int y, int t) {
		return counts[(y * width + x) * nBins + t];
	}
	
	/**
	 * Get a copy of the decay histogram for a single pixel.
	 * @param x column
	 * @param y row
	 * @return
	 */
	public int[] getDecay(int x, int y) {
		int[] decay = new int[nBins];
		System.arraycopy(counts, (y * width + x) * nBins, decay, 0, nBins);
		return decay;
	}
	
	/**
	 * Copy the decay histogram for the pixel with the specified index ({@code y * width + x}) into an array.
	 * @param index
	 * @param decay array of length {@link #getNumBins()}
	 */
	public void copyDecay(int index, int[] decay) {
		System.arraycopy(counts, index * nBins, decay, 0, nBins);
	}
	
	/**
	 * Sum the counts over the time-bin axis.
	 * @return a new array of length {@code width * height}, in row-major order
	 */
	public int[] getTotalCounts() {
		int n = width * height;
		int[] totals = new int[n];
		for (int i = 0; i < n; i++) {
			long sum = 0;
			int offset = i * nBins;
			for (int t = 0; t < nBins; t++)
				sum += counts[offset + t];
			totals[i] = (int)Math.min(Integer.MAX_VALUE, sum);
		}
		return totals;
	}
	
	@Override
	public String toString() {
		return String.format("DecayCube[%s, channel=%d, %d x %d x %d]", name, channel, width, height, nBins);
	}

}
