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

package phasorlab.lib.ml.features;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phasorlab.lib.analysis.stats.RunningStatistics;
import phasorlab.lib.analysis.stats.StatisticsHelper;
import phasorlab.lib.classifiers.Normalization;

/**
 * Helper class for preprocessing feature tables, with one row per sample and one column per feature.
 * 
 * @author PhasorLab developers
 */
public class Preprocessing {
	
	private static final Logger logger = LoggerFactory.getLogger(Preprocessing.class);
	
	private Preprocessing() {
		throw new AssertionError();
	}

	/**
	 * Create a principal components analysis projection to reduce features.
	 * @param data input data used to create the projector (centred internally)
	 * @param maxComponents maximum number of output features; the number used is at most the number of rows and columns
	 * @return a {@link PCAProjector} that can be applied to new data
	 */
	public static PCAProjector createPCAProjector(double[][] data, int maxComponents) {
		return new PCAProjector(data, maxComponents);
	}

	/**
	 * Create a simple normalizer to rescale input data.
	 * <p>
	 * If a column has zero spread (standard deviation or IQR, depending upon the method), 
	 * it is centred but not scaled, and a {@link DegenerateNormalizationWarning} is recorded 
	 * with the normalizer and logged.
	 * 
	 * @param normalization the method of normalization to apply
	 * @param samples the input samples used to determine the normalization parameters
	 * @param featureNames optional names of the columns, used for warnings; may be null
	 * @return a {@link Normalizer} that may be applied to new data
	 */
	public static Normalizer createNormalizer(final Normalization normalization, final double[][] samples, final List<String> featureNames) {
		int nFeatures = samples.length == 0 ? (featureNames == null ? 0 : featureNames.size()) : samples[0].length;
		var offsets = new double[nFeatures];
		var scales = new double[nFeatures];
		Arrays.fill(scales, 1.0);

		if (normalization == Normalization.NONE || samples.length == 0)
			return Normalizer.createNormalizer(offsets, scales);

		var warnings = new ArrayList<DegenerateNormalizationWarning>();
		double[] column = new double[samples.length];
		for (int c = 0; c < nFeatures; c++) {
			for (int r = 0; r < samples.length; r++)
				column[r] = samples[r][c];
			double center, spread;
			if (normalization == Normalization.ZSCORE) {
				RunningStatistics stats = StatisticsHelper.computeRunningStatistics(column);
				center = stats.getMean();
				spread = stats.getPopulationStdDev();
			} else {
				double[] sorted = StatisticsHelper.getSortedFinite(column);
				center = StatisticsHelper.getSortedPercentile(sorted, 50);
				spread = StatisticsHelper.getSortedPercentile(sorted, 75) - StatisticsHelper.getSortedPercentile(sorted, 25);
			}
			offsets[c] = Double.isFinite(center) ? -center : 0.0;
			if (spread > 0 && Double.isFinite(spread))
				scales[c] = 1.0 / spread;
			else {
				String name = featureNames == null || c >= featureNames.size() ? null : featureNames.get(c);
				var warning = new DegenerateNormalizationWarning(c, name, normalization, spread);
				logger.warn("{}", warning);
				warnings.add(warning);
			}
		}
		return Normalizer.createNormalizer(offsets, scales, warnings);
	}


	/**
	 * Helper class to apply PCA projection.
	 */
	public static class PCAProjector {

		private final double[] mean;
		private final RealMatrix components;
		private final double[] singularValues;

		PCAProjector(double[][] data, int maxComponents) {
			if (data.length == 0)
				throw new IllegalArgumentException("Cannot compute PCA without data");
			if (maxComponents < 1)
				throw new IllegalArgumentException("Number of components must be >= 1");
			int nRows = data.length;
			int nCols = data[0].length;
			
			mean = new double[nCols];
			for (double[] row : data) {
				for (int c = 0; c < nCols; c++)
					mean[c] += row[c] / nRows;
			}
			var centred = MatrixUtils.createRealMatrix(nRows, nCols);
			for (int r = 0; r < nRows; r++) {
				for (int c = 0; c < nCols; c++)
					centred.setEntry(r, c, data[r][c] - mean[c]);
			}
			
			var svd = new SingularValueDecomposition(centred);
			int k = Math.min(maxComponents, Math.min(nRows, nCols));
			var v = svd.getV().getSubMatrix(0, nCols - 1, 0, k - 1);
			// Fix the sign of each component so that results are reproducible
			for (int j = 0; j < k; j++) {
				int maxInd = 0;
				for (int i = 1; i < nCols; i++) {
					if (Math.abs(v.getEntry(i, j)) > Math.abs(v.getEntry(maxInd, j)))
						maxInd = i;
				}
				if (v.getEntry(maxInd, j) < 0) {
					for (int i = 0; i < nCols; i++)
						v.setEntry(i, j, -v.getEntry(i, j));
				}
			}
			components = v;
			singularValues = Arrays.copyOf(svd.getSingularValues(), k);
			logger.info("Reduced dimensions from {} to {}", nCols, k);
		}
		
		/**
		 * Number of output components.
		 * @return
		 */
		public int nComponents() {
			return components.getColumnDimension();
		}
		
		/**
		 * Number of input features.
		 * @return
		 */
		public int nFeatures() {
			return mean.length;
		}
		
		/**
		 * Get the singular values of the retained components, in descending order.
		 * @return
		 */
		public double[] getSingularValues() {
			return singularValues.clone();
		}

		/**
		 * Apply the projection.
		 * @param data input data, one row per sample
		 * @return projected data, with {@link #nComponents()} columns
		 */
		public double[][] project(double[][] data) {
			if (data.length == 0)
				return new double[0][nComponents()];
			var centred = MatrixUtils.createRealMatrix(data.length, mean.length);
			for (int r = 0; r < data.length; r++) {
				if (data[r].length != mean.length)
					throw new IllegalArgumentException("Expected " + mean.length + " features, but row " + r + " has " + data[r].length);
				for (int c = 0; c < mean.length; c++)
					centred.setEntry(r, c, data[r][c] - mean[c]);
			}
			return centred.multiply(components).getData();
		}
		
		@Override
		public String toString() {
			return "PCAProjector (" + nFeatures() + " -> " + nComponents() + ")";
		}

	}

}
