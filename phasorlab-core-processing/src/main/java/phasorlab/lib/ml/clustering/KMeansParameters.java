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

import java.util.Objects;

/**
 * Parameters for k-means clustering.
 * 
 * @author PhasorLab developers
 */
public class KMeansParameters implements ClusteringParameters {
	
	private final int k;
	private final int maxIterations;
	private final long seed;
	
	private KMeansParameters(int k, int maxIterations, long seed) {
		if (k < 1)
			throw new IllegalArgumentException("Number of clusters must be >= 1, but was " + k);
		if (maxIterations < 1)
			throw new IllegalArgumentException("Maximum iterations must be >= 1, but was " + maxIterations);
		this.k = k;
		this.maxIterations = maxIterations;
		this.seed = seed;
	}
	
	/**
	 * Create parameters.
	 * @param k number of clusters
	 * @param maxIterations maximum number of iterations
	 * @param seed random seed for initialization
	 * @return
	 */
	public static KMeansParameters create(int k, int maxIterations, long seed) {
		return new KMeansParameters(k, maxIterations, seed);
	}
	
	/**
	 * Create parameters with 300 iterations and seed 42.
	 * @param k number of clusters
	 * @return
	 */
	public static KMeansParameters create(int k) {
		return create(k, 300, 42L);
	}
	
	@Override
	public ClusteringAlgorithm getAlgorithm() {
		return ClusteringAlgorithm.KMEANS;
	}
	
	@Override
	public int getMinimumPoints() {
		return k;
	}
	
	public int getK() {
		return k;
	}
	
	public int getMaxIterations() {
		return maxIterations;
	}
	
	public long getSeed() {
		return seed;
	}
	
	@Override
	public int hashCode() {
		return Objects.hash(k, maxIterations, seed);
	}
	
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof KMeansParameters))
			return false;
		var other = (KMeansParameters)obj;
		return k == other.k && maxIterations == other.maxIterations && seed == other.seed;
	}
	
	@Override
	public String toString() {
		return "KMeansParameters (k=" + k + ", maxIterations=" + maxIterations + ", seed=" + seed + ")";
	}

}
