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

package phasorlab.lib.ml.embedding;

import java.util.EnumMap;
import java.util.List;

import com.google.common.collect.ImmutableList;

import phasorlab.lib.analysis.features.FeatureMatrix;
import phasorlab.lib.analysis.features.FeatureVector;
import phasorlab.lib.ml.clustering.ClusteringAlgorithm;

/**
 * 2D coordinates for each row of a {@link FeatureMatrix}, with optional cluster labels.
 * <p>
 * Instances are immutable; adding cluster labels creates a new embedding.
 * 
 * @author PhasorLab developers
 */
public class Embedding {
	
	private final FeatureMatrix features;
	private final double[][] coordinates;
	private final UMAPParameters parameters;
	private final EnumMap<ClusteringAlgorithm, int[]> labels;
	
	private Embedding(FeatureMatrix features, double[][] coordinates, UMAPParameters parameters, EnumMap<ClusteringAlgorithm, int[]> labels) {
		this.features = features;
		this.coordinates = coordinates;
		this.parameters = parameters;
		this.labels = labels;
	}
	
	/**
	 * Create an embedding.
	 * @param features the feature matrix that was embedded
	 * @param coordinates one {x, y} row per row of the feature matrix
	 * @param parameters the parameters used to compute the embedding
	 * @return
	 */
	public static Embedding create(FeatureMatrix features, double[][] coordinates, UMAPParameters parameters) {
		if (coordinates.length != features.nRows())
			throw new IllegalArgumentException("Expected " + features.nRows() + " coordinates, but got " + coordinates.length);
		double[][] copy = new double[coordinates.length][];
		for (int i = 0; i < coordinates.length; i++) {
			if (coordinates[i].length != 2)
				throw new IllegalArgumentException("Embedding coordinates must be 2D");
			copy[i] = coordinates[i].clone();
		}
		return new Embedding(features, copy, parameters, new EnumMap<>(ClusteringAlgorithm.class));
	}
	
	/**
	 * Create a copy of this embedding with cluster labels for the specified algorithm, 
	 * replacing any previous labels for the same algorithm.
	 * @param algorithm
	 * @param clusterLabels one label per row
	 * @return
	 */
	public Embedding withClusterLabels(ClusteringAlgorithm algorithm, int[] clusterLabels) {
		if (clusterLabels.length != size())
			throw new IllegalArgumentException("Expected " + size() + " labels, but got " + clusterLabels.length);
		var map = new EnumMap<>(labels);
		map.put(algorithm, clusterLabels.clone());
		return new Embedding(features, coordinates, parameters, map);
	}
	
	/**
	 * Create a copy of this embedding without any cluster labels.
	 * @return
	 */
	public Embedding withoutClusterLabels() {
		if (labels.isEmpty())
			return this;
		return new Embedding(features, coordinates, parameters, new EnumMap<>(ClusteringAlgorithm.class));
	}
	
	public FeatureMatrix getFeatureMatrix() {
		return features;
	}
	
	/**
	 * Get the identities and feature values of the embedded rows.
	 * @return
	 */
	public List<FeatureVector> getRows() {
		return features.getRows();
	}
	
	public UMAPParameters getParameters() {
		return parameters;
	}
	
	public int size() {
		return coordinates.length;
	}
	
	public double getX(int row) {
		return coordinates[row][0];
	}
	
	public double getY(int row) {
		return coordinates[row][1];
	}
	
	/**
	 * Get a copy of all coordinates.
	 * @return
	 */
	public double[][] getCoordinates() {
		double[][] copy = new double[coordinates.length][];
		for (int i = 0; i < coordinates.length; i++)
			copy[i] = coordinates[i].clone();
		return copy;
	}
	
	/**
	 * Returns true if labels are available for the specified algorithm.
	 * @param algorithm
	 * @return
	 */
	public boolean hasClusterLabels(ClusteringAlgorithm algorithm) {
		return labels.containsKey(algorithm);
	}
	
	/**
	 * Get the algorithms for which labels are available.
	 * @return
	 */
	public List<ClusteringAlgorithm> getClusteringAlgorithms() {
		return ImmutableList.copyOf(labels.keySet());
	}
	
	/**
	 * Get a copy of the cluster labels for the specified algorithm.
	 * @param algorithm
	 * @return the labels, or null if the embedding has not been clustered with this algorithm
	 */
	public int[] getClusterLabels(ClusteringAlgorithm algorithm) {
		int[] l = labels.get(algorithm);
		return l == null ? null : l.clone();
	}
	
	@Override
	public String toString() {
		return "Embedding[" + size() + " points, clustered=" + labels.keySet() + "]";
	}

}
