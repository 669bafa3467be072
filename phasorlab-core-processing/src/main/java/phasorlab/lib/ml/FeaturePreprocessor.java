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

package phasorlab.lib.ml;

import java.util.Collections;
import java.util.List;

import phasorlab.lib.classifiers.Normalization;
import phasorlab.lib.ml.features.DegenerateNormalizationWarning;
import phasorlab.lib.ml.features.Normalizer;
import phasorlab.lib.ml.features.Preprocessing;
import phasorlab.lib.ml.features.Preprocessing.PCAProjector;

/**
 * Create a preprocessor for a feature table.
 * This can include simple normalization (rescaling) and PCA projection.
 * 
 * @author PhasorLab developers
 */
public class FeaturePreprocessor {
	
	private Normalizer normalizer;
	private PCAProjector pca;
	private int inputLength;
	private int outputLength;
	
	private FeaturePreprocessor() {}
	
	/**
	 * Apply preprocessing.
	 * @param data input values, one row per sample (unchanged)
	 * @return a new array of preprocessed values
	 */
	public double[][] apply(double[][] data) {
		double[][] result = data;
		if (normalizer != null)
			result = normalizer.normalize(result);
		if (pca != null)
			result = pca.project(result);
		if (result == data) {
			result = new double[data.length][];
			for (int i = 0; i < data.length; i++)
				result[i] = data[i].clone();
		}
		return result;
	}
	
	/**
	 * Returns true if this preprocessor transforms the features beyond a simple normalization.
	 * In practice, for the current implementation this means PCA.
	 * @return
	 */
	public boolean doesFeatureTransform() {
		return pca != null;
	}
	
	/**
	 * Returns true if this preprocessor has any effect.
	 * @return
	 */
	public boolean doesSomething() {
		return (normalizer != null && !normalizer.isIdentity()) || pca != null;
	}
	
	/**
	 * Get the number of features required of the input.
	 * @return
	 */
	public int getInputLength() {
		return inputLength;
	}
	
	/**
	 * Get the number of features expected in the output.
	 * @return
	 */
	public int getOutputLength() {
		return outputLength;
	}
	
	/**
	 * Get any warnings recorded while fitting the normalization.
	 * @return
	 */
	public List<DegenerateNormalizationWarning> getWarnings() {
		return normalizer == null ? Collections.emptyList() : normalizer.getWarnings();
	}
	
	/**
	 * Create a {@link Builder} to build a custom {@link FeaturePreprocessor}.
	 * @return
	 */
	public static FeaturePreprocessor.Builder builder() {
		return new Builder();
	}
	
	@Override
	public String toString() {
		String name = "FeaturePreprocessor";
		if (!doesSomething())
			return name + " (null)";
		if (normalizer != null) {
			if (pca != null)
				return name + " (" + normalizer + ", " + pca + ")";
			else
				return name + " (" + normalizer + ")";
		} else
			return name + " (" + pca + ")";
	}
	
	
	/**
	 * Builder to create a custom {@link FeaturePreprocessor}.
	 */
	public static class Builder {
		
		private Normalization normalization = Normalization.NONE;
		private int pcaComponents = -1;
		private List<String> featureNames;
		
		private Builder() {}
		
		/**
		 * Specify the normalization to apply before any PCA.
		 * @param normalization
		 * @return this builder
		 */
		public Builder normalize(Normalization normalization) {
			this.normalization = normalization == null ? Normalization.NONE : normalization;
			return this;
		}
		
		/**
		 * Request PCA with at most the specified number of components. 
		 * Values &lt; 1 mean that PCA is not applied.
		 * @param maxComponents
		 * @return this builder
		 */
		public Builder pca(int maxComponents) {
			this.pcaComponents = maxComponents;
			return this;
		}
		
		/**
		 * Set feature names, used when reporting degenerate columns.
		 * @param names
		 * @return this builder
		 */
		public Builder featureNames(List<String> names) {
			this.featureNames = names;
			return this;
		}
		
		/**
		 * Get the normalization that will be applied.
		 * @return
		 */
		public Normalization getNormalization() {
			return normalization;
		}
		
		/**
		 * Get the maximum number of PCA components, or a value &lt; 1 if PCA is not requested.
		 * @return
		 */
		public int getPCAComponents() {
			return pcaComponents;
		}
		
		/**
		 * Build a new preprocessor, fitted to the training data.
		 * @param trainingData one row per sample, one column per feature
		 * @return
		 */
		public FeaturePreprocessor build(double[][] trainingData) {
			int nFeatures = trainingData.length == 0 ? 0 : trainingData[0].length;
			var preprocessor = new FeaturePreprocessor();
			preprocessor.inputLength = nFeatures;
			preprocessor.outputLength = nFeatures;
			double[][] data = trainingData;
			if (normalization != Normalization.NONE) {
				preprocessor.normalizer = Preprocessing.createNormalizer(normalization, trainingData, featureNames);
				data = preprocessor.normalizer.normalize(trainingData);
			}
			if (pcaComponents > 0 && trainingData.length > 0) {
				preprocessor.pca = Preprocessing.createPCAProjector(data, pcaComponents);
				preprocessor.outputLength = preprocessor.pca.nComponents();
			}
			return preprocessor;
		}
		
	}

}
