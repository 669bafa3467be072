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

package phasorlab.lib.lifetime;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phasorlab.lib.common.LogTools;
import phasorlab.lib.images.PhasorField;
import phasorlab.lib.phasor.PhasorTools;

/**
 * Per-pixel lifetime estimates computed from a (calibrated, filtered) {@link PhasorField}.
 * <p>
 * Pixels with invalid coordinates have NaN values in every map. 
 * Pixels that are valid but cannot be resolved into two components have NaN values in the 
 * two-component maps only; their fraction is available from {@link #getFailureFraction()}.
 * 
 * @author PhasorLab developers
 */
public class LifetimeMaps {
	
	private static final Logger logger = LoggerFactory.getLogger(LifetimeMaps.class);
	
	private final int width;
	private final int height;
	private final double frequency;
	
	private final float[] phiLifetime;
	private final float[] mLifetime;
	private final float[] projLifetime;
	private final float[] tau1;
	private final float[] tau2;
	private final float[] fraction1;
	private final float[] fraction2;
	private final float[] averageLifetime;
	
	private final int nValid;
	private final int nUnresolved;
	
	private LifetimeMaps(int width, int height, double frequency) {
		this.width = width;
		this.height = height;
		this.frequency = frequency;
		int n = width * height;
		phiLifetime = createNaNArray(n);
		mLifetime = createNaNArray(n);
		projLifetime = createNaNArray(n);
		tau1 = createNaNArray(n);
		tau2 = createNaNArray(n);
		fraction1 = createNaNArray(n);
		fraction2 = createNaNArray(n);
		averageLifetime = createNaNArray(n);
		nValid = 0;
		nUnresolved = 0;
	}
	
	private LifetimeMaps(LifetimeMaps maps, int nValid, int nUnresolved) {
		this.width = maps.width;
		this.height = maps.height;
		this.frequency = maps.frequency;
		this.phiLifetime = maps.phiLifetime;
		this.mLifetime = maps.mLifetime;
		this.projLifetime = maps.projLifetime;
		this.tau1 = maps.tau1;
		this.tau2 = maps.tau2;
		this.fraction1 = maps.fraction1;
		this.fraction2 = maps.fraction2;
		this.averageLifetime = maps.averageLifetime;
		this.nValid = nValid;
		this.nUnresolved = nUnresolved;
	}
	
	private static float[] createNaNArray(int n) {
		float[] arr = new float[n];
		Arrays.fill(arr, Float.NaN);
		return arr;
	}
	
	/**
	 * Compute lifetime maps.
	 * <p>
	 * Apparent lifetimes use the first harmonic of the field. 
	 * Two-component resolution requires harmonics 1 and 2; if either is missing, those maps are all NaN.
	 * 
	 * @param field the phasor field
	 * @param frequency laser frequency in MHz; if this is not a positive finite value, all maps are NaN
	 * @return
	 */
	public static LifetimeMaps compute(PhasorField field, double frequency) {
		Objects.requireNonNull(field);
		var maps = new LifetimeMaps(field.getWidth(), field.getHeight(), frequency);
		if (!(frequency > 0) || !Double.isFinite(frequency)) {
			LogTools.warnOnce(logger, "No laser frequency available - lifetimes cannot be computed");
			return maps;
		}
		long startTime = System.currentTimeMillis();
		
		int firstHarmonic = field.getHarmonics()[0];
		double omega = PhasorTools.angularFrequency(frequency, firstHarmonic);
		boolean canResolve = field.hasHarmonic(1) && field.hasHarmonic(2);
		if (!canResolve)
			LogTools.warnOnce(logger, "Harmonics 1 and 2 are required to resolve two lifetime components");
		double omega1 = PhasorTools.angularFrequency(frequency, 1);
		
		var validCount = new AtomicInteger();
		var unresolvedCount = new AtomicInteger();
		int w = field.getWidth();
		IntStream.range(0, field.getHeight()).parallel().forEach(y -> {
			int nValidRow = 0;
			int nUnresolvedRow = 0;
			for (int x = 0; x < w; x++) {
				int i = y * w + x;
				if (!field.isValid(i))
					continue;
				nValidRow++;
				double g = field.getG(i);
				double s = field.getS(i);
				maps.phiLifetime[i] = (float)LifetimeTools.phiLifetime(g, s, omega);
				maps.mLifetime[i] = (float)LifetimeTools.mLifetime(g, s, omega);
				maps.projLifetime[i] = (float)LifetimeTools.projLifetime(g, s, omega);
				if (!canResolve)
					continue;
				try {
					var solution = LifetimeTools.resolveTwoComponents(
							field.getG(1, i), field.getS(1, i),
							field.getG(2, i), field.getS(2, i),
							omega1);
					maps.tau1[i] = (float)solution.getTau1();
					maps.tau2[i] = (float)solution.getTau2();
					maps.fraction1[i] = (float)solution.getFraction1();
					maps.fraction2[i] = (float)solution.getFraction2();
					maps.averageLifetime[i] = (float)solution.getAverageLifetime();
				} catch (UnresolvableMixtureException e) {
					nUnresolvedRow++;
				}
			}
			validCount.addAndGet(nValidRow);
			unresolvedCount.addAndGet(canResolve ? nUnresolvedRow : nValidRow);
		});
		
		var result = new LifetimeMaps(maps, validCount.get(), unresolvedCount.get());
		LogTools.logFailureFraction(logger, "Unresolved two-component pixels", result.nUnresolved, result.nValid);
		logger.debug("Lifetime maps computed in {} ms", System.currentTimeMillis() - startTime);
		return result;
	}
	
	/**
	 * Get the width of the maps.
	 * @return
	 */
	public int getWidth() {
		return width;
	}
	
	/**
	 * Get the height of the maps.
	 * @return
	 */
	public int getHeight() {
		return height;
	}
	
	/**
	 * Get the laser frequency used for the computation, in MHz.
	 * @return
	 */
	public double getFrequency() {
		return frequency;
	}
	
	/**
	 * Phase lifetime per pixel (copy).
	 * @return
	 */
	public float[] getPhiLifetime() {
		return phiLifetime.clone();
	}
	
	/**
	 * Modulation lifetime per pixel (copy).
	 * @return
	 */
	public float[] getMLifetime() {
		return mLifetime.clone();
	}
	
	/**
	 * Projected (normal) lifetime per pixel (copy).
	 * @return
	 */
	public float[] getProjLifetime() {
		return projLifetime.clone();
	}
	
	/**
	 * Shorter two-component lifetime per pixel (copy).
	 * @return
	 */
	public float[] getTau1() {
		return tau1.clone();
	}
	
	/**
	 * Longer two-component lifetime per pixel (copy).
	 * @return
	 */
	public float[] getTau2() {
		return tau2.clone();
	}
	
	/**
	 * Fractional intensity of the shorter component per pixel (copy).
	 * @return
	 */
	public float[] getFraction1() {
		return fraction1.clone();
	}
	
	/**
	 * Fractional intensity of the longer component per pixel (copy).
	 * @return
	 */
	public float[] getFraction2() {
		return fraction2.clone();
	}
	
	/**
	 * Intensity-weighted average of the two-component lifetimes per pixel (copy).
	 * @return
	 */
	public float[] getAverageLifetime() {
		return averageLifetime.clone();
	}
	
	/**
	 * Number of pixels with valid phasor coordinates.
	 * @return
	 */
	public int getNumValid() {
		return nValid;
	}
	
	/**
	 * Number of valid pixels that could not be resolved into two components.
	 * @return
	 */
	public int getNumUnresolved() {
		return nUnresolved;
	}
	
	/**
	 * Fraction of valid pixels that could not be resolved into two components.
	 * @return the fraction, or 0 if there are no valid pixels
	 */
	public double getFailureFraction() {
		return nValid == 0 ? 0 : nUnresolved / (double)nValid;
	}
	
	@Override
	public String toString() {
		return String.format("LifetimeMaps[%d x %d, f=%.2f MHz, unresolved=%d/%d]", width, height, frequency, nUnresolved, nValid);
	}

}
