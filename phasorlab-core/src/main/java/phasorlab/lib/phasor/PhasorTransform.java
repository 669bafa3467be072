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

package phasorlab.lib.phasor;

import java.util.Arrays;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phasorlab.lib.images.DecayCube;
import phasorlab.lib.images.PhasorField;

/**
 * Convert decay histograms into phasor coordinates.
 * <p>
 * The time-bin axis of each pixel is treated as one period of a periodic signal. 
 * For harmonic {@code h}, the coordinates are the real and imaginary parts of the Fourier coefficient 
 * normalized by the total photon count:
 * <pre>
 *   g = sum(I_k * cos(2*pi*h*t_k)) / sum(I_k)
 *   s = sum(I_k * sin(2*pi*h*t_k)) / sum(I_k)
 * </pre>
 * where {@code t_k = (k + 0.5) / K} is the centre of bin {@code k} as a fraction of the period.
 * Pixels without photons have NaN coordinates.
 * 
 * @author PhasorLab developers
 */
public class PhasorTransform {
	
	private static final Logger logger = LoggerFactory.getLogger(PhasorTransform.class);
	
	/**
	 * Harmonics computed by default. The second harmonic is needed for two-component lifetime resolution.
	 */
	public static final int[] DEFAULT_HARMONICS = {1, 2};
	
	private final int[] harmonics;
	
	private PhasorTransform(int[] harmonics) {
		this.harmonics = harmonics;
	}
	
	/**
	 * Create a transform for the default harmonics (1 and 2).
	 * @return
	 */
	public static PhasorTransform create() {
		return new PhasorTransform(DEFAULT_HARMONICS.clone());
	}
	
	/**
	 * Create a transform for the specified harmonics. 
	 * The first harmonic given is the one used for all derived metrics.
	 * 
	 * @param harmonics one or more harmonics, each &geq; 1 and without duplicates
	 * @return
	 */
	public static PhasorTransform create(int... harmonics) {
		if (harmonics.length == 0)
			throw new IllegalArgumentException("At least one harmonic is required");
		if (Arrays.stream(harmonics).distinct().count() != harmonics.length)
			throw new IllegalArgumentException("Duplicate harmonics in " + Arrays.toString(harmonics));
		for (int h : harmonics) {
			if (h < 1)
				throw new IllegalArgumentException("Harmonics must be >= 1, but got " + h);
		}
		return new PhasorTransform(harmonics.clone());
	}
	
	/**
	 * Get the harmonics computed by this transform.
	 * @return
	 */
	public int[] getHarmonics() {
		return harmonics.clone();
	}
	
	/**
	 * Compute the phasor coordinates for every pixel of a decay cube.
	 * The cube is not modified.
	 * 
	 * @param cube
	 * @return a new phasor field, containing the raw total photon count of each pixel
	 * @throws IllegalArgumentException if the cube has too few time bins to represent a requested harmonic
	 */
	public PhasorField apply(DecayCube cube) {
		int nBins = cube.getNumBins();
		for (int h : harmonics) {
			if (2 * h > nBins)
				throw new IllegalArgumentException(String.format("Harmonic %d requires at least %d time bins, but %s has %d", h, 2*h, cube.getName(), nBins));
		}
		
		long startTime = System.currentTimeMillis();
		
		int nHarmonics = harmonics.length;
		double[][] cosTable = new double[nHarmonics][nBins];
		double[][] sinTable = new double[nHarmonics][nBins];
		for (int h = 0; h < nHarmonics; h++) {
			for (int k = 0; k < nBins; k++) {
				double angle = 2.0 * Math.PI * harmonics[h] * (k + 0.5) / nBins;
				cosTable[h][k] = Math.cos(angle);
				sinTable[h][k] = Math.sin(angle);
			}
		}
		
		int width = cube.getWidth();
		int height = cube.getHeight();
		int n = width * height;
		float[][] real = new float[nHarmonics][n];
		float[][] imag = new float[nHarmonics][n];
		int[] totals = new int[n];
		
		IntStream.range(0, height).parallel().forEach(y -> {
			int[] decay = new int[nBins];
			for (int x = 0; x < width; x++) {
				int ind = y * width + x;
				cube.copyDecay(ind, decay);
				long total = 0;
				for (int c : decay)
					total += c;
				totals[ind] = (int)Math.min(Integer.MAX_VALUE, total);
				for (int h = 0; h < nHarmonics; h++) {
					if (total == 0) {
						real[h][ind] = Float.NaN;
						imag[h][ind] = Float.NaN;
						continue;
					}
					double sumCos = 0, sumSin = 0;
					double[] cos = cosTable[h];
					double[] sin = sinTable[h];
					for (int k = 0; k < nBins; k++) {
						int c = decay[k];
						if (c == 0)
							continue;
						sumCos += c * cos[k];
						sumSin += c * sin[k];
					}
					real[h][ind] = (float)(sumCos / total);
					imag[h][ind] = (float)(sumSin / total);
				}
			}
		});
		
		var field = PhasorField.create(width, height, harmonics, real, imag, totals);
		logger.debug("Computed {} for {} in {} ms", field, cube.getName(), System.currentTimeMillis() - startTime);
		return field;
	}
	
	@Override
	public String toString() {
		return "PhasorTransform (harmonics=" + Arrays.toString(harmonics) + ")";
	}

}
