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

import smile.math.distance.Distance;
import smile.math.distance.EuclideanDistance;
import smile.math.distance.ManhattanDistance;

/**
 * Distance metrics for finding nearest neighbors in feature space.
 * <p>
 * Each metric is a Smile {@link Distance}, so that it can be used directly for neighbor search.
 * 
 * @author PhasorLab developers
 */
public enum DistanceMetric implements Distance<double[]> {
	
	/**
	 * Straight-line distance.
	 */
	EUCLIDEAN(new EuclideanDistance()),
	
	/**
	 * Sum of absolute differences.
	 */
	MANHATTAN(new ManhattanDistance()),
	
	/**
	 * One minus the cosine of the angle between two vectors. 
	 * Two zero vectors have distance 0; a zero and a non-zero vector have distance 1.
	 */
	COSINE(new CosineDistance());
	
	private final Distance<double[]> delegate;
	
	DistanceMetric(Distance<double[]> delegate) {
		this.delegate = delegate;
	}
	
	/**
	 * Compute the distance between two vectors of the same length.
	 * @param a
	 * @param b
	 * @return
	 */
	public double distance(double[] a, double[] b) {
		if (a.length != b.length)
			throw new IllegalArgumentException("Vectors have different lengths: " + a.length + " and " + b.length);
		return delegate.d(a, b);
	}
	
	@Override
	public double d(double[] x, double[] y) {
		return distance(x, y);
	}
	
	@Override
	public String toString() {
		return name().toLowerCase();
	}
	
	private static class CosineDistance implements Distance<double[]> {
		
		private static final long serialVersionUID = 1L;

		@Override
		public double d(double[] a, double[] b) {
			double dot = 0, normA = 0, normB = 0;
			for (int i = 0; i < a.length; i++) {
				dot += a[i] * b[i];
				normA += a[i] * a[i];
				normB += b[i] * b[i];
			}
			if (normA == 0 && normB == 0)
				return 0;
			if (normA == 0 || normB == 0)
				return 1;
			return Math.max(0, 1.0 - dot / Math.sqrt(normA * normB));
		}
		
	}

}
