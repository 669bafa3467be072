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

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Spatial median filter for single-channel float images that may contain NaN values.
 * <p>
 * NaN values are treated as missing: they are ignored when computing the median of a neighbourhood, 
 * and pixels that are NaN in the input remain NaN in the output.
 * Near the image border, only the in-bounds part of the window is used.
 * For an even number of valid neighbours, the median is the mean of the two central values.
 * 
 * @author PhasorLab developers
 */
public class MedianFilter {
	
	private final int kernelSize;
	private final int repetitions;
	
	/**
	 * Constructor.
	 * @param kernelSize window size, must be odd and &geq; 1
	 * @param repetitions number of times to apply the filter, &geq; 0
	 */
	public MedianFilter(int kernelSize, int repetitions) {
		if (kernelSize < 1 || kernelSize % 2 == 0)
			throw new IllegalArgumentException("Kernel size must be odd and >= 1, but was " + kernelSize);
		if (repetitions < 0)
			throw new IllegalArgumentException("Repetitions must be >= 0, but was " + repetitions);
		this.kernelSize = kernelSize;
		this.repetitions = repetitions;
	}
	
	/**
	 * Returns true if applying this filter cannot change any value.
	 * @return
	 */
	public boolean isNoOp() {
		return kernelSize == 1 || repetitions == 0;
	}
	
	/**
	 * Filter an image.
	 * 
	 * @param pixels input pixels in row-major order (unchanged)
	 * @param width
	 * @param height
	 * @return a new array containing the filtered pixels
	 */
	public float[] filter(float[] pixels, int width, int height) {
		if (pixels.length != width * height)
			throw new IllegalArgumentException("Pixel array length " + pixels.length + " does not match " + width + " x " + height);
		float[] current = pixels.clone();
		if (isNoOp())
			return current;
		float[] next = new float[current.length];
		for (int r = 0; r < repetitions; r++) {
			filterOnce(current, next, width, height, kernelSize / 2);
			float[] temp = current;
			current = next;
			next = temp;
		}
		return current;
	}
	
	private static void filterOnce(float[] input, float[] output, int width, int height, int radius) {
		int maxNeighbours = (2 * radius + 1) * (2 * radius + 1);
		IntStream.range(0, height).parallel().forEach(y -> {
			float[] buffer = new float[maxNeighbours];
			int yStart = Math.max(0, y - radius);
			int yEnd = Math.min(height - 1, y + radius);
			for (int x = 0; x < width; x++) {
				int ind = y * width + x;
				if (Float.isNaN(input[ind])) {
					output[ind] = Float.NaN;
					continue;
				}
				int xStart = Math.max(0, x - radius);
				int xEnd = Math.min(width - 1, x + radius);
				int n = 0;
				for (int yy = yStart; yy <= yEnd; yy++) {
					int offset = yy * width;
					for (int xx = xStart; xx <= xEnd; xx++) {
						float val = input[offset + xx];
						if (!Float.isNaN(val))
							buffer[n++] = val;
					}
				}
				output[ind] = median(buffer, n);
			}
		});
	}
	
	private static float median(float[] buffer, int n) {
		Arrays.sort(buffer, 0, n);
		if (n % 2 == 1)
			return buffer[n / 2];
		return (float)((buffer[n / 2 - 1] + (double)buffer[n / 2]) / 2.0);
	}
	
	@Override
	public String toString() {
		return String.format("MedianFilter (%dx%d, repetitions=%d)", kernelSize, kernelSize, repetitions);
	}

}
