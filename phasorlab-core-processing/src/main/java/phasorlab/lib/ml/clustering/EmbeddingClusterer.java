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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.MersenneTwister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phasorlab.lib.ml.InsufficientDataException;
import phasorlab.lib.ml.embedding.Embedding;

/**
 * Cluster the points of an {@link Embedding}.
 * <p>
 * Cluster labels are numbered from 0 in order of first appearance, so that results do not depend upon 
 * the order in which clusters are reported. DBSCAN noise points are labelled {@link #NOISE}.
 * 
 * @author PhasorLab developers
 */
public class EmbeddingClusterer {
	
	private static final Logger logger = LoggerFactory.getLogger(EmbeddingClusterer.class);
	
	/**
	 * Label for points that do not belong to any cluster.
	 */
	public static final int NOISE = -1;
	
	private EmbeddingClusterer() {
		throw new AssertionError();
	}
	
	/**
	 * Cluster an embedding, and return a copy with the labels added.
	 * 
	 * @param embedding
	 * @param params
	 * @return
	 * @throws InsufficientDataException if there are fewer points than the algorithm requires
	 */
	public static Embedding cluster(Embedding embedding, ClusteringParameters params) throws InsufficientDataException {
		Objects.requireNonNull(embedding, "An embedding is required for clustering");
		int[] labels = cluster(embedding.getCoordinates(), params);
		return embedding.withClusterLabels(params.getAlgorithm(), labels);
	}
	
	/**
	 * Cluster points.
	 * 
	 * @param points one row per point
	 * @param params
	 * @return one label per point
	 * @throws InsufficientDataException if there are fewer points than the algorithm requires
	 */
	public static int[] cluster(double[][] points, ClusteringParameters params) throws InsufficientDataException {
		int nRequired = Math.max(1, params.getMinimumPoints());
		if (points.length < nRequired)
			throw new InsufficientDataException("Clustering with " + params, nRequired, points.length);
		
		var clusterable = new ArrayList<ClusterablePoint>();
		for (int i = 0; i < points.length; i++)
			clusterable.add(new ClusterablePoint(i, points[i]));
		
		List<? extends Cluster<ClusterablePoint>> clusters;
		switch (params.getAlgorithm()) {
		case KMEANS:
			var kmeans = (KMeansParameters)params;
			var kmeansClusterer = new KMeansPlusPlusClusterer<ClusterablePoint>(
					kmeans.getK(), kmeans.getMaxIterations(), new EuclideanDistance(), new MersenneTwister(kmeans.getSeed()));
			clusters = kmeansClusterer.cluster(clusterable);
			break;
		case DBSCAN:
			var dbscan = (DBSCANParameters)params;
			clusters = new DBSCANClusterer<ClusterablePoint>(dbscan.getEps(), dbscan.getMinPts()).cluster(clusterable);
			break;
		default:
			throw new IllegalArgumentException("Unsupported clustering algorithm " + params.getAlgorithm());
		}
		
		int[] rawLabels = new int[points.length];
		Arrays.fill(rawLabels, NOISE);
		int c = 0;
		for (var cluster : clusters) {
			for (var point : cluster.getPoints())
				rawLabels[point.index] = c;
			c++;
		}
		int[] labels = relabelByFirstAppearance(rawLabels);
		long nNoise = Arrays.stream(labels).filter(l -> l == NOISE).count();
		logger.info("Clustering complete! {} clusters created ({} noise points)", clusters.size(), nNoise);
		return labels;
	}
	
	private static int[] relabelByFirstAppearance(int[] labels) {
		int max = Arrays.stream(labels).max().orElse(NOISE);
		int[] mapping = new int[max + 1];
		Arrays.fill(mapping, NOISE);
		int next = 0;
		int[] result = new int[labels.length];
		for (int i = 0; i < labels.length; i++) {
			int l = labels[i];
			if (l == NOISE) {
				result[i] = NOISE;
				continue;
			}
			if (mapping[l] == NOISE)
				mapping[l] = next++;
			result[i] = mapping[l];
		}
		return result;
	}
	
	
	static class ClusterablePoint implements Clusterable {
		
		private final int index;
		private final double[] point;
		
		ClusterablePoint(int index, double[] point) {
			this.index = index;
			this.point = point;
		}

		@Override
		public double[] getPoint() {
			return point;
		}
		
	}

}
