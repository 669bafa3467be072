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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import phasorlab.lib.measurements.Measurement;

/**
 * A dataset-level feature, defined by a per-pixel measurement and a summary statistic.
 * 
 * @author PhasorLab developers
 */
public class FeatureDefinition {
	
	private final Measurement measurement;
	private final FeatureStatistic statistic;
	
	private FeatureDefinition(Measurement measurement, FeatureStatistic statistic) {
		this.measurement = Objects.requireNonNull(measurement);
		this.statistic = Objects.requireNonNull(statistic);
	}
	
	/**
	 * Create a feature definition.
	 * @param measurement
	 * @param statistic
	 * @return
	 */
	public static FeatureDefinition of(Measurement measurement, FeatureStatistic statistic) {
		return new FeatureDefinition(measurement, statistic);
	}
	
	/**
	 * Parse a feature definition from a key in the form {@code "metric:statistic"}.
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if the key cannot be parsed
	 */
	public static FeatureDefinition fromKey(String key) {
		int ind = key.lastIndexOf(':');
		if (ind <= 0)
			throw new IllegalArgumentException("Feature key must have the form 'metric:statistic', but was " + key);
		return of(Measurement.fromKey(key.substring(0, ind)), FeatureStatistic.fromKey(key.substring(ind + 1)));
	}
	
	/**
	 * Create all combinations of the specified measurements and statistics, ordered by measurement first.
	 * @param measurements
	 * @param statistics
	 * @return
	 */
	public static List<FeatureDefinition> combinations(Collection<Measurement> measurements, Collection<FeatureStatistic> statistics) {
		var list = new ArrayList<FeatureDefinition>();
		for (var m : measurements) {
			for (var s : statistics)
				list.add(of(m, s));
		}
		return list;
	}
	
	public Measurement getMeasurement() {
		return measurement;
	}
	
	public FeatureStatistic getStatistic() {
		return statistic;
	}
	
	/**
	 * Get the key for this feature, in the form {@code "metric:statistic"}.
	 * @return
	 */
	public String getKey() {
		return measurement.getKey() + ":" + statistic.getKey();
	}
	
	@Override
	public int hashCode() {
		return Objects.hash(measurement, statistic);
	}
	
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof FeatureDefinition))
			return false;
		var other = (FeatureDefinition)obj;
		return measurement == other.measurement && statistic == other.statistic;
	}
	
	@Override
	public String toString() {
		return getKey();
	}

}
