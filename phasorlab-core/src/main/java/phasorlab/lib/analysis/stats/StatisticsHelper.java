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

import java.util.Arrays;

/**
 * Static methods for computing statistics from arrays of pixel values.
 * <p>
 * Percentiles are computed by linear interpolation between the closest ranks, 
 * so that the p-th percentile of sorted values {@code v} with {@code n} elements is taken at index {@code (n-1)*p/100}.
 * 
 * @author PhasorLab developers
 */
public class StatisticsHelper {
	
	/**
	 * Create a RunningStatistics object using all the values from a specified array.
	 * 
	 * @param values
	 * @return
	 */
	public static RunningStatistics computeRunningStatistics(double[] values) {
		RunningStatistics stats = new RunningStatistics();
		for (double v : values) {
			stats.addValue(v);
		}
		return stats;
	}
	
	/**
	 * Extract the finite values from an array and sort them.
	 * The input array is left unchanged.
	 * 
	 * @param values
	 * @return a new sorted array, containing only finite values
	 */
	public static double[] getSortedFinite(double[] values) {
		double[] sorted = Arrays.stream(values).filter(Double::isFinite).toArray();
		Arrays.sort(sorted);
		return sorted;
	}
	
	/**
	 * Compute a percentile from an array of values.
	 * Non-finite values are ignored; the input array is unchanged.
	 * 
	 * @param values
	 * @param percentile value between 0 and 100
	 * @return the percentile, or NaN if there are no finite values
	 */
	public static double getPercentile(double[] values, double percentile) {
		return getPercentiles(values, percentile)[0];
	}
	
	/**
	 * Compute several percentiles from an array of values, sorting only once.
	 * Non-finite values are ignored; the input array is unchanged.
	 * 
	 * @param values
	 * @param percentiles values between 0 and 100
	 * @return an array with one entry per requested percentile
	 */
	public static double[] getPercentiles(double[] values, double... percentiles) {
		double[] sorted = getSortedFinite(values);
		double[] result = new double[percentiles.length];
		for (int i = 0; i < percentiles.length; i++)
			result[i] = getSortedPercentile(sorted, percentiles[i]);
		return result;
	}
	
	/**
	 * Compute a percentile from an array that has already been sorted and contains only finite values.
	 * 
	 * @param sorted
	 * @param percentile value between 0 and 100
	 * @return
	 */
	public static double getSortedPercentile(double[] sorted, double percentile) {
		if (percentile < 0 || percentile > 100)
			throw new IllegalArgumentException("Percentile must be between 0 and 100, but was " + percentile);
		if (sorted.length == 0)
			return Double.NaN;
		return getInterpolatedSortedValue(sorted, (sorted.length - 1) * percentile / 100.0);
	}
	
	/**
	 * Helper function for getting value from a sorted array using linear interpolation to deal with
	 * a non-integer index.
	 */
	private static double getInterpolatedSortedValue(final double[] values, final double ind) {
		int flooredInd = (int)ind;
		double rem = ind - flooredInd;
		if (rem == 0 || flooredInd >= values.length - 1)
			return values[Math.min(flooredInd, values.length - 1)];
		return values[flooredInd] + rem * (values[flooredInd+1] - values[flooredInd]);
	}

}
