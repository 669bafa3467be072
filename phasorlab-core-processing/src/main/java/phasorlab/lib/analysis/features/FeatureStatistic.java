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

package phasorlab.lib.analysis.features;

import phasorlab.lib.analysis.stats.StatisticsHelper;

/**
 * Summary statistics that turn the valid pixel values of one measurement into a single feature.
 * <p>
 * Percentiles use linear interpolation between the closest ranks. 
 * The standard deviation is the population standard deviation.
 * 
 * @author PhasorLab developers
 */
public enum FeatureStatistic {
	
	/**
	 * Median (50th percentile).
	 */
	MEDIAN("median"),
	/**
	 * Interquartile range (75th - 25th percentile).
	 */
	IQR("iqr"),
	/**
	 * Arithmetic mean.
	 */
	MEAN("mean"),
	/**
	 * Population standard deviation.
	 */
	STD("std"),
	/**
	 * 10th percentile.
	 */
	P10("p10"),
	/**
	 * 90th percentile.
	 */
	P90("p90");
	
	private final String key;
	
	FeatureStatistic(String key) {
		this.key = key;
	}
	
	/**
	 * Get the key used to identify this statistic in feature names.
	 * @return
	 */
	public String getKey() {
		return key;
	}
	
	/**
	 * Compute the statistic from values that are sorted in ascending order and are all finite.
	 * 
	 * @param sorted
	 * @return the statistic, or NaN if the array is empty
	 */
	public double computeSorted(double[] sorted) {
		if (sorted.length == 0)
			return Double.NaN;
		switch (this) {
		case MEDIAN:
			return StatisticsHelper.getSortedPercentile(sorted, 50);
		case IQR:
			return StatisticsHelper.getSortedPercentile(sorted, 75) - StatisticsHelper.getSortedPercentile(sorted, 25);
		case MEAN:
			return StatisticsHelper.computeRunningStatistics(sorted).getMean();
		case STD:
			return StatisticsHelper.computeRunningStatistics(sorted).getPopulationStdDev();
		case P10:
			return StatisticsHelper.getSortedPercentile(sorted, 10);
		case P90:
			return StatisticsHelper.getSortedPercentile(sorted, 90);
		default:
			throw new IllegalArgumentException("Unknown statistic " + this);
		}
	}
	
	/**
	 * Compute the statistic from an array of values. Non-finite values are ignored.
	 * @param values
	 * @return the statistic, or NaN if there are no finite values
	 */
	public double compute(double[] values) {
		return computeSorted(StatisticsHelper.getSortedFinite(values));
	}
	
	/**
	 * Get the statistic with the specified key.
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if the key is unknown
	 */
	public static FeatureStatistic fromKey(String key) {
		for (var stat : values()) {
			if (stat.key.equals(key))
				return stat;
		}
		throw new IllegalArgumentException("Unknown statistic: " + key);
	}
	
	@Override
	public String toString() {
		return key;
	}

}
