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

package phasorlab.lib.common;

/**
 * Core PhasorLab preferences. Currently these are not persistent.
 * <p>
 * Values here provide the defaults used when creating new datasets and calibrations; 
 * they do not affect existing objects.
 * 
 * @author PhasorLab developers
 */
public class Prefs {
	
	private static int nThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
	
	private static double defaultLaserFrequency = 80.0;
	
	private static double defaultReferenceLifetime = 4.0;
	
	private static int defaultKernelSize = 3;
	
	private static int defaultMinCount = 0;
	
	private static int defaultMaxCount = 10_000;
	
	/**
	 * Get the requested number of threads to use for parallelization.
	 * @return
	 */
	public static int getNumThreads() {
		return nThreads;
	}

	/**
	 * Set the requested number of threads. This will be clipped to be at least 1.
	 * @param n
	 */
	public static void setNumThreads(int n) {
		nThreads = Math.max(1, n);
	}
	
	/**
	 * Laser repetition frequency (MHz) suggested when a decay cube does not provide one.
	 * @return
	 */
	public static double getDefaultLaserFrequency() {
		return defaultLaserFrequency;
	}
	
	/**
	 * Set the suggested laser repetition frequency, in MHz.
	 * @param frequency must be &gt; 0
	 */
	public static void setDefaultLaserFrequency(double frequency) {
		if (!(frequency > 0))
			throw new IllegalArgumentException("Laser frequency must be > 0, but was " + frequency);
		defaultLaserFrequency = frequency;
	}
	
	/**
	 * Reference lifetime (ns) suggested for calibration.
	 * @return
	 */
	public static double getDefaultReferenceLifetime() {
		return defaultReferenceLifetime;
	}
	
	/**
	 * Set the suggested reference lifetime, in ns.
	 * @param lifetime must be &gt; 0
	 */
	public static void setDefaultReferenceLifetime(double lifetime) {
		if (!(lifetime > 0))
			throw new IllegalArgumentException("Reference lifetime must be > 0, but was " + lifetime);
		defaultReferenceLifetime = lifetime;
	}

	/**
	 * Median filter kernel size used for new datasets.
	 * @return
	 */
	public static int getDefaultKernelSize() {
		return defaultKernelSize;
	}
	
	/**
	 * Set the median filter kernel size used for new datasets.
	 * @param size odd and &geq; 1
	 */
	public static void setDefaultKernelSize(int size) {
		if (size < 1 || size % 2 == 0)
			throw new IllegalArgumentException("Kernel size must be odd and >= 1, but was " + size);
		defaultKernelSize = size;
	}

	/**
	 * Minimum photon count used for new datasets.
	 * @return
	 */
	public static int getDefaultMinCount() {
		return defaultMinCount;
	}

	/**
	 * Maximum photon count used for new datasets.
	 * @return
	 */
	public static int getDefaultMaxCount() {
		return defaultMaxCount;
	}
	
	/**
	 * Set the photon count range used for new datasets.
	 * @param minCount
	 * @param maxCount
	 */
	public static void setDefaultCountRange(int minCount, int maxCount) {
		if (minCount > maxCount)
			throw new IllegalArgumentException("Minimum count " + minCount + " exceeds maximum " + maxCount);
		defaultMinCount = minCount;
		defaultMaxCount = maxCount;
	}

}
