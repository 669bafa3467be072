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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.fitting.SimpleCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.primitives.Doubles;

import smile.neighbor.LinearSearch;
import smile.neighbor.Neighbor;

import phasorlab.lib.common.GeneralTools;
import phasorlab.lib.ml.InsufficientDataException;

/**
 * Uniform Manifold Approximation and Projection (UMAP) of feature vectors into two dimensions.
 * <p>
 * A fuzzy k-nearest-neighbor graph is built in the input space and a 2D layout is optimized 
 * by stochastic gradient descent with negative sampling.
 * Nearest neighbors are found exhaustively with Smile, and the layout is initialized randomly, 
 * both of which are appropriate for tables with one row per dataset.
 * Every row is embedded, even when the neighbor graph is disconnected.
 * <p>
 * Identical input rows are embedded once, and therefore receive identical coordinates.
 * Results are deterministic for a given seed.
 * 
 * @author PhasorLab developers
 */
public class UMAP {
	
	private static final Logger logger = LoggerFactory.getLogger(UMAP.class);
	
	private static final int N_COMPONENTS = 2;
	private static final double INIT_RANGE = 10.0;
	private static final double GRADIENT_CLIP = 4.0;
	private static final double SMOOTH_K_TOLERANCE = 1e-5;
	private static final double MIN_K_DIST_SCALE = 1e-3;
	private static final int N_SMOOTH_ITERATIONS = 64;
	private static final double REPULSION_STRENGTH = 1.0;
	
	private final UMAPParameters params;
	
	/**
	 * Constructor.
	 * @param params
	 */
	public UMAP(UMAPParameters params) {
		this.params = Objects.requireNonNull(params);
	}
	
	public UMAPParameters getParameters() {
		return params;
	}
	
	/**
	 * Compute a 2D embedding.
	 * 
	 * @param data input data, one row per sample; all rows must have the same length and contain only finite values
	 * @return an array with one {x, y} row per input row
	 * @throws InsufficientDataException if there are fewer than {@code nNeighbors + 1} rows
	 */
	public double[][] fit(double[][] data) throws InsufficientDataException {
		int nRows = data.length;
		int nNeighbors = params.getNumNeighbors();
		if (nRows < nNeighbors + 1)
			throw new InsufficientDataException("UMAP with " + nNeighbors + " neighbors", nNeighbors + 1, nRows);
		int nCols = data[0].length;
		for (var row : data) {
			if (row.length != nCols)
				throw new IllegalArgumentException("All rows must have the same length");
			for (double v : row) {
				if (!Double.isFinite(v))
					throw new IllegalArgumentException("UMAP input must be finite");
			}
		}
		long startTime = System.currentTimeMillis();
		
		// Embed identical rows only once
		var uniqueIndex = new LinkedHashMap<List<Double>, Integer>();
		int[] mapping = new int[nRows];
		var unique = new ArrayList<double[]>();
		for (int i = 0; i < nRows; i++) {
			var key = Doubles.asList(data[i].clone());
			Integer ind = uniqueIndex.get(key);
			if (ind == null) {
				ind = unique.size();
				uniqueIndex.put(key, ind);
				unique.add(data[i]);
			}
			mapping[i] = ind;
		}
		if (unique.size() < nRows)
			logger.debug("Embedding {} unique rows of {}", unique.size(), nRows);
		
		double[][] uniqueEmbedding = fitUnique(unique.toArray(double[][]::new));
		
		double[][] result = new double[nRows][];
		for (int i = 0; i < nRows; i++)
			result[i] = uniqueEmbedding[mapping[i]].clone();
		logger.info("UMAP embedding of {} rows computed in {} ms", nRows, System.currentTimeMillis() - startTime);
		return result;
	}
	
	private double[][] fitUnique(double[][] data) {
		int n = data.length;
		if (n == 1)
			return new double[1][N_COMPONENTS];
		
		int k = Math.min(params.getNumNeighbors(), n);
		int[][] knnIndices = new int[n][k];
		double[][] knnDists = new double[n][k];
		computeNearestNeighbors(data, params.getMetric(), knnIndices, knnDists);
		
		double[] rhos = new double[n];
		double[] sigmas = new double[n];
		smoothKnnDist(knnDists, k, rhos, sigmas);
		
		double[][] graph = computeFuzzySimplicialSet(knnIndices, knnDists, rhos, sigmas);
		
		double[] ab = findABParams(params.getSpread(), params.getMinDist());
		logger.debug("UMAP curve parameters a={}, b={}", ab[0], ab[1]);
		
		RandomGenerator rng = new MersenneTwister(params.getSeed());
		double[][] embedding = new double[n][N_COMPONENTS];
		for (double[] row : embedding) {
			for (int d = 0; d < N_COMPONENTS; d++)
				row[d] = (rng.nextDouble() * 2 - 1) * INIT_RANGE;
		}
		optimizeLayout(embedding, graph, ab[0], ab[1], rng);
		return embedding;
	}
	
	/**
	 * Exhaustive nearest neighbor search using Smile's {@link LinearSearch}. 
	 * Each point is its own first neighbor; the others are ordered by distance, then by index.
	 */
	static void computeNearestNeighbors(double[][] data, DistanceMetric metric, int[][] knnIndices, double[][] knnDists) {
		int n = data.length;
		int k = knnIndices[0].length;
		var search = new LinearSearch<>(data, metric);
		Comparator<Neighbor<double[], double[]>> order = Comparator
				.comparingDouble((Neighbor<double[], double[]> neighbor) -> neighbor.distance)
				.thenComparingInt(neighbor -> neighbor.index);
		for (int i = 0; i < n; i++) {
			// Query with a copy, so that the point itself is a candidate like any other
			var neighbors = search.knn(data[i].clone(), k);
			Arrays.sort(neighbors, order);
			knnIndices[i][0] = i;
			knnDists[i][0] = 0;
			int j = 1;
			for (var neighbor : neighbors) {
				if (neighbor.index == i)
					continue;
				if (j == k)
					break;
				knnIndices[i][j] = neighbor.index;
				knnDists[i][j] = neighbor.distance;
				j++;
			}
		}
	}
	
	/**
	 * Find, for each point, the distance to its nearest neighbor (rho) and a bandwidth (sigma) 
	 * such that the sum of neighbor memberships equals log2(k).
	 */
	static void smoothKnnDist(double[][] knnDists, int k, double[] rhos, double[] sigmas) {
		int n = knnDists.length;
		double target = Math.log(k) / Math.log(2);
		double meanDistances = Arrays.stream(knnDists).flatMapToDouble(Arrays::stream).average().orElse(0);
		
		for (int i = 0; i < n; i++) {
			double[] dists = knnDists[i];
			double lo = 0;
			double hi = Double.POSITIVE_INFINITY;
			double mid = 1.0;
			
			double rho = 0;
			for (double d : dists) {
				if (d > 0) {
					rho = d;
					break;
				}
			}
			rhos[i] = rho;
			
			for (int iter = 0; iter < N_SMOOTH_ITERATIONS; iter++) {
				double psum = 0;
				for (int j = 1; j < dists.length; j++) {
					double d = dists[j] - rho;
					psum += d > 0 ? Math.exp(-d / mid) : 1.0;
				}
				if (Math.abs(psum - target) < SMOOTH_K_TOLERANCE)
					break;
				if (psum > target) {
					hi = mid;
					mid = (lo + hi) / 2.0;
				} else {
					lo = mid;
					if (hi == Double.POSITIVE_INFINITY)
						mid *= 2;
					else
						mid = (lo + hi) / 2.0;
				}
			}
			
			if (rho > 0) {
				double meanIth = Arrays.stream(dists).average().orElse(0);
				mid = Math.max(mid, MIN_K_DIST_SCALE * meanIth);
			} else
				mid = Math.max(mid, MIN_K_DIST_SCALE * meanDistances);
			sigmas[i] = mid;
		}
	}
	
	/**
	 * Compute symmetric membership strengths, combined by fuzzy union {@code a + b - a*b}.
	 */
	static double[][] computeFuzzySimplicialSet(int[][] knnIndices, double[][] knnDists, double[] rhos, double[] sigmas) {
		int n = knnIndices.length;
		double[][] directed = new double[n][n];
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < knnIndices[i].length; j++) {
				int ind = knnIndices[i][j];
				if (ind == i)
					continue;
				double val;
				double d = knnDists[i][j] - rhos[i];
				if (d <= 0 || sigmas[i] == 0)
					val = 1.0;
				else
					val = Math.exp(-d / sigmas[i]);
				directed[i][ind] = val;
			}
		}
		double[][] graph = new double[n][n];
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				double a = directed[i][j];
				double b = directed[j][i];
				graph[i][j] = a + b - a * b;
			}
		}
		return graph;
	}
	
	/**
	 * Fit the parameters of the curve {@code 1 / (1 + a*d^(2b))} used to model distances in the embedding, 
	 * so that it approximates 1 for {@code d < minDist} and {@code exp(-(d - minDist) / spread)} beyond.
	 * 
	 * @param spread
	 * @param minDist
	 * @return array containing {a, b}
	 */
	public static double[] findABParams(double spread, double minDist) {
		var points = new WeightedObservedPoints();
		int nPoints = 300;
		double maxX = spread * 3;
		for (int i = 0; i < nPoints; i++) {
			double x = maxX * i / (nPoints - 1);
			double y = x < minDist ? 1.0 : Math.exp(-(x - minDist) / spread);
			points.add(x, y);
		}
		var fitter = SimpleCurveFitter.create(new DistanceCurve(), new double[] {1.0, 1.0})
				.withMaxIterations(10_000);
		return fitter.fit(points.toList());
	}
	
	private static class DistanceCurve implements ParametricUnivariateFunction {

		@Override
		public double value(double x, double... parameters) {
			double a = parameters[0];
			double b = parameters[1];
			return 1.0 / (1.0 + a * Math.pow(x, 2 * b));
		}

		@Override
		public double[] gradient(double x, double... parameters) {
			if (x <= 0)
				return new double[] {0, 0};
			double a = parameters[0];
			double b = parameters[1];
			double xb = Math.pow(x, 2 * b);
			double denom = 1.0 + a * xb;
			denom *= denom;
			return new double[] {
					-xb / denom,
					-a * xb * 2 * Math.log(x) / denom
			};
		}
		
	}
	
	private void optimizeLayout(double[][] embedding, double[][] graph, double a, double b, RandomGenerator rng) {
		int n = embedding.length;
		int nEpochs = params.getNumEpochs();
		
		double maxWeight = 0;
		for (double[] row : graph) {
			for (double w : row)
				maxWeight = Math.max(maxWeight, w);
		}
		if (maxWeight <= 0)
			return;
		
		// Collect edges, discarding those too weak to be sampled
		var heads = new ArrayList<Integer>();
		var tails = new ArrayList<Integer>();
		var weights = new ArrayList<Double>();
		double threshold = maxWeight / nEpochs;
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				double w = graph[i][j];
				if (w > 0 && w >= threshold) {
					heads.add(i);
					tails.add(j);
					weights.add(w);
				}
			}
		}
		int nEdges = heads.size();
		double[] epochsPerSample = new double[nEdges];
		for (int e = 0; e < nEdges; e++)
			epochsPerSample[e] = maxWeight / weights.get(e);
		
		int negativeRate = params.getNegativeSampleRate();
		double[] epochsPerNegativeSample = new double[nEdges];
		for (int e = 0; e < nEdges; e++)
			epochsPerNegativeSample[e] = negativeRate > 0 ? epochsPerSample[e] / negativeRate : Double.POSITIVE_INFINITY;
		double[] epochOfNextSample = epochsPerSample.clone();
		double[] epochOfNextNegativeSample = epochsPerNegativeSample.clone();
		
		double initialAlpha = params.getLearningRate();
		double alpha = initialAlpha;
		for (int epoch = 0; epoch < nEpochs; epoch++) {
			for (int e = 0; e < nEdges; e++) {
				if (epochOfNextSample[e] > epoch)
					continue;
				int j = heads.get(e);
				int k = tails.get(e);
				double[] current = embedding[j];
				double[] other = embedding[k];
				
				double distSquared = squaredDistance(current, other);
				double gradCoeff = 0;
				if (distSquared > 0) {
					gradCoeff = -2.0 * a * b * Math.pow(distSquared, b - 1.0);
					gradCoeff /= a * Math.pow(distSquared, b) + 1.0;
				}
				for (int d = 0; d < N_COMPONENTS; d++) {
					double grad = clip(gradCoeff * (current[d] - other[d]));
					current[d] += grad * alpha;
					other[d] -= grad * alpha;
				}
				epochOfNextSample[e] += epochsPerSample[e];
				
				int nNegative = negativeRate > 0 ? (int)((epoch - epochOfNextNegativeSample[e]) / epochsPerNegativeSample[e]) : 0;
				for (int p = 0; p < nNegative; p++) {
					int s = rng.nextInt(n);
					other = embedding[s];
					distSquared = squaredDistance(current, other);
					if (distSquared > 0) {
						gradCoeff = 2.0 * REPULSION_STRENGTH * b;
						gradCoeff /= (0.001 + distSquared) * (a * Math.pow(distSquared, b) + 1.0);
					} else if (j == s)
						continue;
					else
						gradCoeff = 0;
					for (int d = 0; d < N_COMPONENTS; d++) {
						double grad = gradCoeff > 0 ? clip(gradCoeff * (current[d] - other[d])) : GRADIENT_CLIP;
						current[d] += grad * alpha;
					}
				}
				if (nNegative > 0)
					epochOfNextNegativeSample[e] += nNegative * epochsPerNegativeSample[e];
			}
			alpha = initialAlpha * (1.0 - (double)epoch / nEpochs);
		}
	}
	
	private static double squaredDistance(double[] p1, double[] p2) {
		double sum = 0;
		for (int d = 0; d < p1.length; d++) {
			double diff = p1[d] - p2[d];
			sum += diff * diff;
		}
		return sum;
	}
	
	private static double clip(double val) {
		return GeneralTools.clipValue(val, -GRADIENT_CLIP, GRADIENT_CLIP);
	}
	
	@Override
	public String toString() {
		return "UMAP (" + params + ")";
	}

}
