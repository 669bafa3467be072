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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import phasorlab.lib.analysis.features.FeatureDefinition;
import phasorlab.lib.analysis.features.FeatureMatrix;
import phasorlab.lib.analysis.features.FeatureVector;
import phasorlab.lib.ml.clustering.ClusteringAlgorithm;

@SuppressWarnings("javadoc")
public class TestEmbedding {
	
	private static FeatureMatrix createMatrix() {
		return FeatureMatrix.create(
				Collections.singletonList(FeatureDefinition.fromKey("g:median")),
				Arrays.asList(
						new FeatureVector("a", 0, "default", new double[] {0.1}),
						new FeatureVector("b", 0, "default", new double[] {0.2}),
						new FeatureVector("c", 1, "treated", new double[] {0.3})),
				Collections.emptyMap());
	}
	
	@Test
	public void test_create() {
		double[][] coords = {{0, 1}, {2, 3}, {4, 5}};
		var embedding = Embedding.create(createMatrix(), coords, UMAPParameters.getDefault());
		assertEquals(3, embedding.size());
		assertEquals(2, embedding.getX(1));
		assertEquals(5, embedding.getY(2));
		assertEquals("c", embedding.getRows().get(2).getName());
		
		coords[0][0] = 100;
		assertEquals(0, embedding.getX(0));
		embedding.getCoordinates()[0][0] = 100;
		assertEquals(0, embedding.getX(0));
		
		assertThrows(IllegalArgumentException.class, () -> Embedding.create(createMatrix(), new double[2][2], UMAPParameters.getDefault()));
		assertThrows(IllegalArgumentException.class, () -> Embedding.create(createMatrix(), new double[3][3], UMAPParameters.getDefault()));
	}
	
	@Test
	public void test_clusterLabels() {
		var embedding = Embedding.create(createMatrix(), new double[3][2], UMAPParameters.getDefault());
		assertFalse(embedding.hasClusterLabels(ClusteringAlgorithm.KMEANS));
		assertNull(embedding.getClusterLabels(ClusteringAlgorithm.KMEANS));
		
		var clustered = embedding
				.withClusterLabels(ClusteringAlgorithm.DBSCAN, new int[] {0, -1, 0})
				.withClusterLabels(ClusteringAlgorithm.KMEANS, new int[] {0, 1, 1});
		assertFalse(embedding.hasClusterLabels(ClusteringAlgorithm.KMEANS));
		assertTrue(clustered.hasClusterLabels(ClusteringAlgorithm.KMEANS));
		assertEquals(List.of(ClusteringAlgorithm.KMEANS, ClusteringAlgorithm.DBSCAN), clustered.getClusteringAlgorithms());
		assertArrayEquals(new int[] {0, -1, 0}, clustered.getClusterLabels(ClusteringAlgorithm.DBSCAN));
		
		var relabelled = clustered.withClusterLabels(ClusteringAlgorithm.KMEANS, new int[] {1, 1, 0});
		assertArrayEquals(new int[] {1, 1, 0}, relabelled.getClusterLabels(ClusteringAlgorithm.KMEANS));
		assertArrayEquals(new int[] {0, 1, 1}, clustered.getClusterLabels(ClusteringAlgorithm.KMEANS));
		
		assertTrue(clustered.withoutClusterLabels().getClusteringAlgorithms().isEmpty());
		assertThrows(IllegalArgumentException.class, () -> embedding.withClusterLabels(ClusteringAlgorithm.KMEANS, new int[2]));
	}

}
