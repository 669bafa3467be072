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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import phasorlab.lib.analysis.features.FeatureDefinition;
import phasorlab.lib.classifiers.Normalization;
import phasorlab.lib.datasets.Dataset;
import phasorlab.lib.datasets.SyntheticDatasets;
import phasorlab.lib.ml.InsufficientDataException;
import phasorlab.lib.ml.clustering.ClusteringAlgorithm;
import phasorlab.lib.ml.clustering.KMeansParameters;
import phasorlab.lib.ml.embedding.UMAPParameters;

@SuppressWarnings("javadoc")
public class TestEmbeddingWorkflow {
	
	private static List<Dataset> createDatasets() {
		var datasets = new ArrayList<Dataset>();
		for (int i = 0; i < 8; i++) {
			double tau = i < 4 ? 1.0 : 4.0;
			datasets.add(SyntheticDatasets.createNoisy("image " + i, 0, tau, i));
		}
		return datasets;
	}
	
	private static EmbeddingWorkflow createWorkflow(List<Dataset> datasets) {
		var workflow = new EmbeddingWorkflow();
		workflow.setDatasets(datasets);
		workflow.setUMAPParameters(UMAPParameters.builder().nNeighbors(3).nEpochs(50).build());
		return workflow;
	}
	
	@Test
	public void test_defaults() {
		var workflow = new EmbeddingWorkflow();
		assertEquals(EmbeddingWorkflow.DEFAULT_FEATURES, workflow.getFeatures());
		assertEquals(8, EmbeddingWorkflow.DEFAULT_FEATURES.size());
		assertEquals("g:median", EmbeddingWorkflow.DEFAULT_FEATURES.get(0).getKey());
		assertEquals(Normalization.ROBUST, workflow.getNormalization());
		assertEquals(-1, workflow.getPCAComponents());
		assertTrue(workflow.getDatasets().isEmpty());
		assertNull(workflow.getEmbedding());
	}
	
	@Test
	public void test_requiresEmbedding() {
		var workflow = createWorkflow(createDatasets());
		assertThrows(IllegalStateException.class, () -> workflow.cluster(KMeansParameters.create(2)));
		assertThrows(IllegalStateException.class, () -> workflow.export());
		// No effect without an embedding
		workflow.clearClusters();
		assertNull(workflow.getEmbedding());
	}
	
	@Test
	public void test_embedAndCluster() throws Exception {
		var datasets = createDatasets();
		var workflow = createWorkflow(datasets);
		
		var embedding = workflow.computeEmbedding();
		assertEquals(datasets.size(), embedding.size());
		assertSame(embedding, workflow.getEmbedding());
		assertSame(embedding, workflow.computeEmbedding());
		assertEquals("image 0", embedding.getRows().get(0).getName());
		assertTrue(workflow.getNormalizationWarnings().isEmpty());
		
		var clustered = workflow.cluster(KMeansParameters.create(2));
		assertTrue(clustered.hasClusterLabels(ClusteringAlgorithm.KMEANS));
		assertSame(clustered, workflow.getEmbedding());
		for (int label : clustered.getClusterLabels(ClusteringAlgorithm.KMEANS))
			assertTrue(label == 0 || label == 1);
		
		var export = workflow.export();
		assertEquals(datasets.size(), export.getRows().size());
		assertNotNull(export.getRows().get(3).getClusterLabel("kmeans"));
		
		workflow.clearClusters();
		assertFalse(workflow.getEmbedding().hasClusterLabels(ClusteringAlgorithm.KMEANS));
	}
	
	@Test
	public void test_invalidation() throws Exception {
		var datasets = createDatasets();
		var workflow = createWorkflow(datasets);
		var features = workflow.computeFeatures();
		var embedding = workflow.computeEmbedding();
		
		// Unchanged settings keep the embedding
		workflow.setDatasets(new ArrayList<>(datasets));
		workflow.setNormalization(Normalization.ROBUST);
		workflow.setPCAComponents(0);
		workflow.setUMAPParameters(UMAPParameters.builder().nNeighbors(3).nEpochs(50).build());
		workflow.setFeatures(EmbeddingWorkflow.DEFAULT_FEATURES);
		assertSame(embedding, workflow.getEmbedding());
		
		// Preprocessing changes keep the features
		workflow.setNormalization(Normalization.ZSCORE);
		assertNull(workflow.getEmbedding());
		assertSame(features, workflow.computeFeatures());
		
		workflow.computeEmbedding();
		workflow.setPCAComponents(2);
		assertNull(workflow.getEmbedding());
		workflow.computeEmbedding();
		workflow.setUMAPParameters(UMAPParameters.builder().nNeighbors(3).nEpochs(50).seed(1).build());
		assertNull(workflow.getEmbedding());
		assertSame(features, workflow.computeFeatures());
		
		// Dataset and feature changes discard everything
		workflow.setDatasets(datasets.subList(0, 6));
		assertEquals(6, workflow.computeFeatures().nRows());
		workflow.setFeatures(Arrays.asList(FeatureDefinition.fromKey("g:mean")));
		assertEquals(1, workflow.computeFeatures().nFeatures());
		
		var before = workflow.computeFeatures();
		workflow.invalidate();
		assertNotSame(before, workflow.computeFeatures());
	}
	
	@Test
	public void test_exclusions() throws Exception {
		var datasets = createDatasets();
		datasets.add(SyntheticDatasets.create("no frequency", 0, 2.0, Double.NaN));
		var workflow = createWorkflow(datasets);
		var embedding = workflow.computeEmbedding();
		assertEquals(datasets.size() - 1, embedding.size());
		assertTrue(embedding.getFeatureMatrix().getExclusions().containsKey("no frequency (C1)"));
	}
	
	@Test
	public void test_insufficientData() {
		var workflow = createWorkflow(createDatasets().subList(0, 3));
		var e = assertThrows(InsufficientDataException.class, () -> workflow.computeEmbedding());
		assertEquals(4, e.getRequired());
		assertEquals(3, e.getAvailable());
		assertNull(workflow.getEmbedding());
	}
	
	@Test
	public void test_normalizationWarnings() throws Exception {
		var workflow = createWorkflow(createDatasets());
		workflow.setFeatures(Arrays.asList(
				FeatureDefinition.fromKey("g:median"),
				FeatureDefinition.fromKey("photon_count:median")));
		workflow.computeEmbedding();
		var warnings = workflow.getNormalizationWarnings();
		assertEquals(1, warnings.size());
		assertEquals("photon_count:median", warnings.get(0).getFeatureName());
		assertEquals(1, warnings.get(0).getFeatureIndex());
	}
	
	@Test
	public void test_invalidSettings() {
		var workflow = new EmbeddingWorkflow();
		assertThrows(IllegalArgumentException.class, () -> workflow.setFeatures(Collections.emptyList()));
		assertThrows(NullPointerException.class, () -> workflow.setNormalization(null));
	}

}
