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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

/**
 * Table of dataset-level features: one {@link FeatureVector} per included dataset, one column per {@link FeatureDefinition}.
 * <p>
 * Datasets that could not provide every feature are not included as rows. 
 * Instead, the reason each was excluded is recorded.
 * 
 * @author PhasorLab developers
 */
public class FeatureMatrix {
	
	private final List<FeatureDefinition> features;
	private final List<FeatureVector> rows;
	private final Map<String, String> exclusions;
	
	FeatureMatrix(List<FeatureDefinition> features, List<FeatureVector> rows, Map<String, String> exclusions) {
		this.features = ImmutableList.copyOf(features);
		this.rows = ImmutableList.copyOf(rows);
		this.exclusions = Collections.unmodifiableMap(new LinkedHashMap<>(exclusions));
	}
	
	/**
	 * Create a feature matrix from existing rows.
	 * @param features column definitions
	 * @param rows feature vectors, each with one value per column
	 * @param exclusions map of excluded dataset identifiers to reasons
	 * @return
	 */
	public static FeatureMatrix create(List<FeatureDefinition> features, List<FeatureVector> rows, Map<String, String> exclusions) {
		for (var row : rows) {
			if (row.size() != features.size())
				throw new IllegalArgumentException("Row " + row.getIdentifier() + " has " + row.size() + " values, expected " + features.size());
		}
		return new FeatureMatrix(features, rows, exclusions);
	}
	
	/**
	 * Get the column definitions.
	 * @return
	 */
	public List<FeatureDefinition> getFeatures() {
		return features;
	}
	
	/**
	 * Get the column keys, in the form {@code "metric:statistic"}.
	 * @return
	 */
	public List<String> getFeatureKeys() {
		return features.stream().map(FeatureDefinition::getKey).collect(ImmutableList.toImmutableList());
	}
	
	public List<FeatureVector> getRows() {
		return rows;
	}
	
	public int nRows() {
		return rows.size();
	}
	
	public int nFeatures() {
		return features.size();
	}
	
	/**
	 * Get the values as a new 2D array, with one row per included dataset.
	 * @return
	 */
	public double[][] getValues() {
		double[][] values = new double[rows.size()][];
		for (int i = 0; i < rows.size(); i++)
			values[i] = rows.get(i).getValues();
		return values;
	}
	
	/**
	 * Get the datasets that were excluded, mapped to the reason for exclusion.
	 * @return
	 */
	public Map<String, String> getExclusions() {
		return exclusions;
	}
	
	@Override
	public String toString() {
		return "FeatureMatrix[" + rows.size() + " x " + features.size() + ", excluded=" + exclusions.size() + "]";
	}

}
