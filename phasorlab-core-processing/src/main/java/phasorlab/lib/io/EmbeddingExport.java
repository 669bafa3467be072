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

package phasorlab.lib.io;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phasorlab.lib.ml.embedding.Embedding;

/**
 * Table combining the identity, embedding coordinates, cluster labels and features of each embedded dataset.
 * <p>
 * Features are keyed by {@code "metric:statistic"} and cluster labels by algorithm key.
 * The table is written as JSON, using {@link GsonTools}.
 * 
 * @author PhasorLab developers
 */
public class EmbeddingExport {
	
	private static final Logger logger = LoggerFactory.getLogger(EmbeddingExport.class);
	
	private final List<String> featureKeys;
	private final List<Row> rows;
	
	private EmbeddingExport(List<String> featureKeys, List<Row> rows) {
		this.featureKeys = featureKeys;
		this.rows = rows;
	}
	
	/**
	 * Create an export table from an embedding.
	 * @param embedding
	 * @return
	 */
	public static EmbeddingExport create(Embedding embedding) {
		Objects.requireNonNull(embedding);
		var matrix = embedding.getFeatureMatrix();
		var keys = matrix.getFeatureKeys();
		var algorithms = embedding.getClusteringAlgorithms();
		var labels = new ArrayList<int[]>();
		for (var algorithm : algorithms)
			labels.add(embedding.getClusterLabels(algorithm));
		
		var rows = new ArrayList<Row>();
		var vectors = embedding.getRows();
		for (int i = 0; i < vectors.size(); i++) {
			var vector = vectors.get(i);
			var clusters = new LinkedHashMap<String, Integer>();
			for (int a = 0; a < algorithms.size(); a++)
				clusters.put(algorithms.get(a).getKey(), labels.get(a)[i]);
			var features = new LinkedHashMap<String, Double>();
			for (int f = 0; f < keys.size(); f++)
				features.put(keys.get(f), vector.getValue(f));
			rows.add(new Row(vector.getName(), vector.getChannel(), vector.getGroup(),
					embedding.getX(i), embedding.getY(i), clusters, features));
		}
		return new EmbeddingExport(new ArrayList<>(keys), rows);
	}
	
	/**
	 * Get the feature keys, in column order.
	 * @return
	 */
	public List<String> getFeatureKeys() {
		return Collections.unmodifiableList(featureKeys);
	}
	
	public List<Row> getRows() {
		return Collections.unmodifiableList(rows);
	}
	
	/**
	 * Get the table as a JSON string.
	 * @return
	 */
	public String toJson() {
		return GsonTools.getInstance(true).toJson(this);
	}
	
	/**
	 * Write the table as JSON.
	 * @param writer
	 * @throws IOException
	 */
	public void writeJson(Writer writer) throws IOException {
		GsonTools.getInstance(true).toJson(this, writer);
		writer.flush();
	}
	
	/**
	 * Write the table as JSON to a file, using UTF-8.
	 * @param path
	 * @throws IOException
	 */
	public void writeJson(Path path) throws IOException {
		try (var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			writeJson(writer);
		}
		logger.info("Exported {} rows to {}", rows.size(), path);
	}
	
	/**
	 * Read a table previously written with {@link #writeJson(Path)}.
	 * @param path
	 * @return
	 * @throws IOException
	 */
	public static EmbeddingExport readJson(Path path) throws IOException {
		try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return GsonTools.getInstance().fromJson(reader, EmbeddingExport.class);
		}
	}
	
	@Override
	public String toString() {
		return "EmbeddingExport[" + rows.size() + " rows, " + featureKeys.size() + " features]";
	}
	
	
	/**
	 * One exported dataset.
	 */
	public static class Row {
		
		private final String name;
		private final int channel;
		private final String group;
		private final double x;
		private final double y;
		private final Map<String, Integer> clusters;
		private final Map<String, Double> features;
		
		private Row(String name, int channel, String group, double x, double y, Map<String, Integer> clusters, Map<String, Double> features) {
			this.name = name;
			this.channel = channel;
			this.group = group;
			this.x = x;
			this.y = y;
			this.clusters = clusters;
			this.features = features;
		}
		
		public String getName() {
			return name;
		}
		
		public int getChannel() {
			return channel;
		}
		
		public String getGroup() {
			return group;
		}
		
		public double getX() {
			return x;
		}
		
		public double getY() {
			return y;
		}
		
		/**
		 * Get the cluster label for an algorithm key.
		 * @param algorithmKey
		 * @return the label, or null if the embedding was not clustered with the algorithm
		 */
		public Integer getClusterLabel(String algorithmKey) {
			return clusters.get(algorithmKey);
		}
		
		/**
		 * Get a feature value.
		 * @param featureKey key in the form {@code "metric:statistic"}
		 * @return the value, or NaN if the feature is not present
		 */
		public double getFeature(String featureKey) {
			var val = features.get(featureKey);
			return val == null ? Double.NaN : val.doubleValue();
		}
		
		/**
		 * Get all features, in column order.
		 * @return
		 */
		public Map<String, Double> getFeatures() {
			return Collections.unmodifiableMap(features);
		}
		
	}

}
