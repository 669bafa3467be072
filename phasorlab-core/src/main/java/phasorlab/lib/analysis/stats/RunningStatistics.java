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

package phasorlab.lib.analysis.stats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helper class for computing basic statistics from values as they are added.
 * <p>
 * This is useful when iterating through pixels, computing statistics only from pixels that pass a mask.
 * Non-finite values are counted separately and never contribute to the statistics.
 * <p>
 * Both the sample and population variance are available; feature statistics use the population form.
 * 
 * @author PhasorLab developers
 */
public class RunningStatistics {
	
	private static final Logger logger = LoggerFactory.getLogger(RunningStatistics.class);
	
	// See http://www.johndcook.com/standard_deviation.html
	
	private static final double LARGE_DOUBLE_THRESHOLD = Math.pow(2, 53) - 1;
	
	private long numNonFinite = 0;
	
	private long size = 0;
	private double sum = 0, min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;

	private double m1 = 0, s1 = 0;
	
	/**
	 * Default constructor.
	 */
	public RunningStatistics() {}
	
	/**
	 * Get count of the number of finite values added.
	 * @return
	 * 
	 * @see #getNumNonFinite()
	 */
	public long size() {
		return size;
	}
	
	/**
	 * Add another value; NaN and infinite values are counted but do not contribute to the statistics.
	 * 
	 * @param val
	 */
	public void addValue(double val) {
		if (!Double.isFinite(val)) {
			numNonFinite++;
			return;
		}
		size++;
		sum += val;
		if (val < min)
			min = val;
		if (val > max)
			max = val;
		if (size == 1) {
			m1 = val;
		} else {
			double mNew = m1 + (val - m1) / size;
			s1 = s1 + (val - m1)*(val - mNew);
			m1 = mNew;
		}
	}
	
	/**
	 * Get count of the number of NaN or infinite values added.
	 * @return
	 */
	public long getNumNonFinite() {
		return numNonFinite;
	}
	
	/**
	 * Get the sum of all finite values that were added.
	 * @return
	 */
	public double getSum() {
		if (Math.abs(sum) > LARGE_DOUBLE_THRESHOLD)
			logger.warn("Sum in {} is particularly large ({}), beware imprecision!", getClass().getSimpleName(), sum);
		return sum;
	}
	
	/**
	 * Get the mean of all finite values that were added.
	 * @return the mean, or NaN if no values are available
	 */
	public double getMean() {
		return (size == 0) ? Double.NaN : m1;
	}
	
	/**
	 * Get the sample variance (dividing by n-1).
	 * @return
	 */
	public double getVariance() {
		return (size <= 1) ? Double.NaN : s1 / (size - 1);
	}
	
	/**
	 * Get the population variance (dividing by n).
	 * @return the variance, which is 0 for a single value and NaN if no values are available
	 */
	public double getPopulationVariance() {
		return (size == 0) ? Double.NaN : s1 / size;
	}
	
	/**
	 * Get the sample standard deviation.
	 * @return
	 */
	public double getStdDev() {
		return Math.sqrt(getVariance());
	}
	
	/**
	 * Get the population standard deviation.
	 * @return
	 */
	public double getPopulationStdDev() {
		return Math.sqrt(getPopulationVariance());
	}
	
	/**
	 * Get the minimum finite value added.
	 * @return the minimum value, or NaN if no values are available.
	 */
	public double getMin() {
		return (size == 0) ? Double.NaN : min;
	}
	
	/**
	 * Get the maximum finite value added.
	 * @return the maximum value, or NaN if no values are available.
	 */
	public double getMax() {
		return (size == 0) ? Double.NaN : max;
	}
	
	@Override
	public String toString() {
		return String.format("%s Mean: %.3f, Std.dev: %.3f, Min: %.3f, Max: %.3f", RunningStatistics.class.getSimpleName(), getMean(), getPopulationStdDev(), getMin(), getMax());
	}
	
}
