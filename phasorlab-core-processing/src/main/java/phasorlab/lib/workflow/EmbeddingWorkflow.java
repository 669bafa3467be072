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

package phasorlab.lib.workflow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phasorlab.lib.analysis.features.FeatureAggregator;
import phasorlab.lib.analysis.features.FeatureDefinition;
import phasorlab.lib.analysis.features.FeatureMatrix;
import phasorlab.lib.analysis.features.FeatureStatistic;
import phasorlab.lib.classifiers.Normalization;
import phasorlab.lib.datasets.Dataset;
import phasorlab.lib.io.EmbeddingExport;
import phasorlab.lib.measurements.Measurement;
import phasorlab.lib.ml.FeaturePreprocessor;
import phasorlab.lib.ml.InsufficientDataException;
import phasorlab.lib.ml.clustering.ClusteringParameters;
import phasorlab.lib.ml.clustering.EmbeddingClusterer;
import phasorlab.lib.ml.embedding.Embedding;
import phasorlab.lib.ml.embedding.UMAP;
import phasorlab.lib.ml.embedding.UMAPParameters;
import phasorlab.lib.ml.features.DegenerateNormalizationWarning;

/**
 * Feature aggregation, preprocessing, embedding and clustering for a selection of datasets.
 * <p>
 * Results are cached. Changing the dataset selection, features, preprocessing or UMAP parameters 
 * discards the embedding (and with it, any cluster labels); {@link #invalidate()} does the same 
 * when the datasets themselves have changed.
 * 
 * @author PhasorLab developers
 */
public class EmbeddingWorkflow {
	
	private static final Logger logger = LoggerFactory.getLogger(EmbeddingWorkflow.class);
	
	/**
	 * Features used if none are specified.
	 */
	public static final List<FeatureDefinition> DEFAULT_FEATURES = Collections.unmodifiableList(
			FeatureDefinition.combinations(
					Arrays.asList(Measurement.G, Measurement.S, Measurement.PHI_LIFETIME, Measurement.M_LIFETIME),
					Arrays.asList(FeatureStatistic.MEDIAN, FeatureStatistic.IQR)));
	
	private List<Dataset> datasets = Collections.emptyList();
	private List<FeatureDefinition> features = DEFAULT_FEATURES;
	private Normalization normalization = Normalization.ROBUST;
	private int pcaComponents = -1;
	private UMAPParameters umapParameters = UMAPParameters.getDefault();
	
	private FeatureMatrix featureMatrix;
	private FeaturePreprocessor preprocessor;
	private Embedding embedding;
	
	/**
	 * Set the datasets to embed.
	 * @param datasets
	 */
	public synchronized void setDatasets(Collection<Dataset> datasets) {
		var list = Collections.unmodifiableList(new ArrayList<>(datasets));
		if (list.equals(this.datasets))
			return;
		this.datasets = list;
		invalidate();
	}
	
	public synchronized List<Dataset> getDatasets() {
		return datasets;
	}
	
	/**
	 * Set the features to compute for each dataset.
	 * @param features
	 */
	public synchronized void setFeatures(Collection<FeatureDefinition> features) {
		if (features.isEmpty())
			throw new IllegalArgumentException("At least one feature is required");
		var list = Collections.unmodifiableList(new ArrayList<>(features));
		if (list.equals(this.features))
			return;
		this.features = list;
		invalidate();
	}
	
	public synchronized List<FeatureDefinition> getFeatures() {
		return features;
	}
	
	/**
	 * Set the normalization applied to the feature columns.
	 * @param normalization
	 */
	public synchronized void setNormalization(Normalization normalization) {
		Objects.requireNonNull(normalization);
		if (normalization == this.normalization)
			return;
		this.normalization = normalization;
		invalidateEmbedding();
	}
	
	public synchronized Normalization getNormalization() {
		return normalization;
	}
	
	/**
	 * Set the maximum number of PCA components, or a value &lt; 1 to skip PCA.
	 * @param maxComponents
	 */
	public synchronized void setPCAComponents(int maxComponents) {
		int value = maxComponents < 1 ? -1 : maxComponents;
		if (value == this.pcaComponents)
			return;
		this.pcaComponents = value;
		invalidateEmbedding();
	}
	
	public synchronized int getPCAComponents() {
		return pcaComponents;
	}
	
	/**
	 * Set the UMAP parameters.
	 * @param params
	 */
	public synchronized void setUMAPParameters(UMAPParameters params) {
		Objects.requireNonNull(params);
		if (params.equals(this.umapParameters))
			return;
		this.umapParameters = params;
		invalidateEmbedding();
	}
	
	public synchronized UMAPParameters getUMAPParameters() {
		return umapParameters;
	}
	
	/**
	 * Discard all cached results, including features.
	 * This should be called whenever the pixel data of a selected dataset changes.
	 */
	public synchronized void invalidate() {
		featureMatrix = null;
		invalidateEmbedding();
	}
	
	private void invalidateEmbedding() {
		if (embedding != null)
			logger.debug("Discarding embedding");
		preprocessor = null;
		embedding = null;
	}
	
	/**
	 * Get the feature matrix, computing it if necessary.
	 * @return
	 * @throws InterruptedException if interrupted during computation
	 */
	public synchronized FeatureMatrix computeFeatures() throws InterruptedException {
		if (featureMatrix == null)
			featureMatrix = new FeatureAggregator(features).aggregate(datasets);
		return featureMatrix;
	}
	
	/**
	 * Get the embedding, computing it if necessary.
	 * 
	 * @return
	 * @throws InsufficientDataException if too few datasets remain after excluding those without valid features
	 * @throws InterruptedException if interrupted during computation
	 */
	public synchronized Embedding computeEmbedding() throws InsufficientDataException, InterruptedException {
		if (embedding != null)
			return embedding;
		var matrix = computeFeatures();
		var values = matrix.getValues();
		var newPreprocessor = FeaturePreprocessor.builder()
				.normalize(normalization)
				.pca(pcaComponents)
				.featureNames(matrix.getFeatureKeys())
				.build(values);
		var coordinates = new UMAP(umapParameters).fit(newPreprocessor.apply(values));
		preprocessor = newPreprocessor;
		embedding = Embedding.create(matrix, coordinates, umapParameters);
		return embedding;
	}
	
	/**
	 * Get the current embedding without computing it.
	 * @return the embedding, or null if it has not been computed or has been discarded
	 */
	public synchronized Embedding getEmbedding() {
		return embedding;
	}
	
	/**
	 * Get warnings for feature columns that could not be normalized in the last embedding.
	 * @return
	 */
	public synchronized List<DegenerateNormalizationWarning> getNormalizationWarnings() {
		return preprocessor == null ? Collections.emptyList() : preprocessor.getWarnings();
	}
	
	/**
	 * Cluster the current embedding. Labels from a previous run of the same algorithm are replaced.
	 * 
	 * @param params
	 * @return the embedding with cluster labels
	 * @throws IllegalStateException if no embedding is available
	 * @throws InsufficientDataException if the embedding has too few points for the algorithm
	 */
	public synchronized Embedding cluster(ClusteringParameters params) throws InsufficientDataException {
		if (embedding == null)
			throw new IllegalStateException("An embedding must be computed before clustering");
		embedding = EmbeddingClusterer.cluster(embedding, params);
		return embedding;
	}
	
	/**
	 * Remove all cluster labels from the current embedding.
	 */
	public synchronized void clearClusters() {
		if (embedding != null)
			embedding = embedding.withoutClusterLabels();
	}
	
	/**
	 * Create an export table for the current embedding.
	 * @return
	 * @throws IllegalStateException if no embedding is available
	 */
	public synchronized EmbeddingExport export() {
		if (embedding == null)
			throw new IllegalStateException("No embedding available to export");
		return EmbeddingExport.create(embedding);
	}

}
