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

package phasorlab.lib.ml.clustering;

/**
 * Algorithms available to cluster an embedding.
 * 
 * @author PhasorLab developers
 */
public enum ClusteringAlgorithm {
	
	/**
	 * k-means with k-means++ initialization.
	 */
	KMEANS("kmeans"),
	
	/**
	 * Density-based clustering; points not assigned to a cluster are labelled as noise.
	 */
	DBSCAN("dbscan");
	
	private final String key;
	
	ClusteringAlgorithm(String key) {
		this.key = key;
	}
	
	/**
	 * Get the key used to identify the labels of this algorithm in exports.
	 * @return
	 */
	public String getKey() {
		return key;
	}
	
	@Override
	public String toString() {
		switch (this) {
		case KMEANS:
			return "k-means";
		case DBSCAN:
			return "DBSCAN";
		default:
			throw new IllegalArgumentException("Unknown clustering algorithm!");
		}
	}

}
