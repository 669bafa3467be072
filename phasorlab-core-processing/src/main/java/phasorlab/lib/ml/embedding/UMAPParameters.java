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

import java.util.Objects;

/**
 * Parameters for a {@link UMAP} embedding.
 * Instances are immutable; use {@link #builder()} to create them.
 * 
 * @author PhasorLab developers
 */
public class UMAPParameters {
	
	private int nNeighbors = 15;
	private double minDist = 0.1;
	private double spread = 1.0;
	private DistanceMetric metric = DistanceMetric.EUCLIDEAN;
	private long seed = 42L;
	private int nEpochs = 500;
	private double learningRate = 1.0;
	private int negativeSampleRate = 5;
	
	private UMAPParameters() {}
	
	/**
	 * Get the default parameters.
	 * @return
	 */
	public static UMAPParameters getDefault() {
		return builder().build();
	}
	
	/**
	 * Create a new builder, initialized with default values.
	 * @return
	 */
	public static Builder builder() {
		return new Builder(new UMAPParameters());
	}
	
	/**
	 * Create a new builder, initialized with the values of these parameters.
	 * @return
	 */
	public Builder toBuilder() {
		return new Builder(copy());
	}
	
	private UMAPParameters copy() {
		var params = new UMAPParameters();
		params.nNeighbors = nNeighbors;
		params.minDist = minDist;
		params.spread = spread;
		params.metric = metric;
		params.seed = seed;
		params.nEpochs = nEpochs;
		params.learningRate = learningRate;
		params.negativeSampleRate = negativeSampleRate;
		return params;
	}
	
	/**
	 * Number of neighbors (including the point itself) used to build the neighborhood graph.
	 * @return
	 */
	public int getNumNeighbors() {
		return nNeighbors;
	}
	
	/**
	 * Minimum distance between points in the embedding.
	 * @return
	 */
	public double getMinDist() {
		return minDist;
	}
	
	public double getSpread() {
		return spread;
	}
	
	public DistanceMetric getMetric() {
		return metric;
	}
	
	public long getSeed() {
		return seed;
	}
	
	public int getNumEpochs() {
		return nEpochs;
	}
	
	public double getLearningRate() {
		return learningRate;
	}
	
	public int getNegativeSampleRate() {
		return negativeSampleRate;
	}
	
	@Override
	public int hashCode() {
		return Objects.hash(nNeighbors, minDist, spread, metric, seed, nEpochs, learningRate, negativeSampleRate);
	}
	
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof UMAPParameters))
			return false;
		var other = (UMAPParameters)obj;
		return nNeighbors == other.nNeighbors && Double.compare(minDist, other.minDist) == 0 &&
				Double.compare(spread, other.spread) == 0 && metric == other.metric && seed == other.seed &&
				nEpochs == other.nEpochs && Double.compare(learningRate, other.learningRate) == 0 &&
				negativeSampleRate == other.negativeSampleRate;
	}
	
	@Override
	public String toString() {
		return String.format("UMAPParameters (n_neighbors=%d, min_dist=%.3f, metric=%s, seed=%d, epochs=%d)",
				nNeighbors, minDist, metric, seed, nEpochs);
	}
	
	
	/**
	 * Builder for {@link UMAPParameters}.
	 */
	public static class Builder {
		
		private final UMAPParameters params;
		
		private Builder(UMAPParameters params) {
			this.params = params;
		}
		
		/**
		 * Number of neighbors, must be &geq; 2.
		 * @param nNeighbors
		 * @return this builder
		 */
		public Builder nNeighbors(int nNeighbors) {
			if (nNeighbors < 2)
				throw new IllegalArgumentException("Number of neighbors must be >= 2, but was " + nNeighbors);
			params.nNeighbors = nNeighbors;
			return this;
		}
		
		/**
		 * Minimum distance, must be &geq; 0.
		 * @param minDist
		 * @return this builder
		 */
		public Builder minDist(double minDist) {
			if (!(minDist >= 0) || !Double.isFinite(minDist))
				throw new IllegalArgumentException("Minimum distance must be >= 0, but was " + minDist);
			params.minDist = minDist;
			return this;
		}
		
		/**
		 * Effective scale of embedded points, must be &gt; 0.
		 * @param spread
		 * @return this builder
		 */
		public Builder spread(double spread) {
			if (!(spread > 0) || !Double.isFinite(spread))
				throw new IllegalArgumentException("Spread must be > 0, but was " + spread);
			params.spread = spread;
			return this;
		}
		
		/**
		 * Distance metric in the input space.
		 * @param metric
		 * @return this builder
		 */
		public Builder metric(DistanceMetric metric) {
			params.metric = Objects.requireNonNull(metric);
			return this;
		}
		
		/**
		 * Seed for the random number generator.
		 * @param seed
		 * @return this builder
		 */
		public Builder seed(long seed) {
			params.seed = seed;
			return this;
		}
		
		/**
		 * Number of optimization epochs, must be &geq; 1.
		 * @param nEpochs
		 * @return this builder
		 */
		public Builder nEpochs(int nEpochs) {
			if (nEpochs < 1)
				throw new IllegalArgumentException("Number of epochs must be >= 1, but was " + nEpochs);
			params.nEpochs = nEpochs;
			return this;
		}
		
		/**
		 * Initial learning rate, must be &gt; 0.
		 * @param learningRate
		 * @return this builder
		 */
		public Builder learningRate(double learningRate) {
			if (!(learningRate > 0) || !Double.isFinite(learningRate))
				throw new IllegalArgumentException("Learning rate must be > 0, but was " + learningRate);
			params.learningRate = learningRate;
			return this;
		}
		
		/**
		 * Number of negative samples per positive sample, must be &geq; 0.
		 * @param rate
		 * @return this builder
		 */
		public Builder negativeSampleRate(int rate) {
			if (rate < 0)
				throw new IllegalArgumentException("Negative sample rate must be >= 0, but was " + rate);
			params.negativeSampleRate = rate;
			return this;
		}
		
		/**
		 * Build the parameters.
		 * @return
		 */
		public UMAPParameters build() {
			return params.copy();
		}
		
	}

}
