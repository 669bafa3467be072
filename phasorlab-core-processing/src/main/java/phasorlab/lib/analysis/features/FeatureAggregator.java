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

package phasorlab.lib.analysis.features;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phasorlab.lib.analysis.stats.StatisticsHelper;
import phasorlab.lib.common.ThreadTools;
import phasorlab.lib.datasets.Dataset;
import phasorlab.lib.measurements.Measurement;

/**
 * Compute dataset-level features from the valid pixels of each dataset.
 * <p>
 * A dataset is excluded (rather than given missing values) if it lacks a laser frequency while a lifetime 
 * feature is requested, or if any requested measurement has no valid pixel.
 * 
 * @author PhasorLab developers
 */
public class FeatureAggregator {
	
	private static final Logger logger = LoggerFactory.getLogger(FeatureAggregator.class);
	
	private final List<FeatureDefinition> features;
	
	/**
	 * Constructor.
	 * @param features the features to compute; duplicates are removed
	 */
	public FeatureAggregator(Collection<FeatureDefinition> features) {
		Objects.requireNonNull(features);
		if (features.isEmpty())
			throw new IllegalArgumentException("At least one feature is required");
		this.features = new ArrayList<>(new LinkedHashSet<>(features));
	}
	
	/**
	 * Get the features computed by this aggregator.
	 * @return
	 */
	public List<FeatureDefinition> getFeatures() {
		return new ArrayList<>(features);
	}
	
	/**
	 * Compute features for a single dataset.
	 * 
	 * @param dataset
	 * @return the feature vector
	 * @throws IllegalArgumentException if the dataset cannot provide all features; the message gives the reason
	 */
	public FeatureVector computeFeatures(Dataset dataset) throws IllegalArgumentException {
		var result = extract(dataset);
		if (result.vector == null)
			throw new IllegalArgumentException(result.exclusion);
		return result.vector;
	}
	
	/**
	 * Compute features for all datasets, in parallel.
	 * The rows of the matrix are in the same order as the datasets provided.
	 * 
	 * @param datasets
	 * @return
	 * @throws InterruptedException if interrupted while waiting for the computation to complete
	 */
	public FeatureMatrix aggregate(Collection<Dataset> datasets) throws InterruptedException {
		long startTime = System.currentTimeMillis();
		var tasks = new ArrayList<Callable<ExtractionResult>>();
		for (var dataset : datasets)
			tasks.add(() -> extract(dataset));
		
		var pool = ThreadTools.createWorkerPool("feature-aggregator-");
		List<Future<ExtractionResult>> futures;
		try {
			futures = pool.invokeAll(tasks);
		} finally {
			pool.shutdownNow();
		}
		
		var rows = new ArrayList<FeatureVector>();
		var exclusions = new LinkedHashMap<String, String>();
		for (var future : futures) {
			ExtractionResult result;
			try {
				result = future.get();
			} catch (ExecutionException e) {
				var cause = e.getCause();
				if (cause instanceof RuntimeException)
					throw (RuntimeException)cause;
				throw new IllegalStateException("Feature extraction failed", cause);
			}
			if (result.vector != null)
				rows.add(result.vector);
			else {
				logger.warn("Excluding {}: {}", result.identifier, result.exclusion);
				exclusions.put(result.identifier, result.exclusion);
			}
		}
		logger.info("Computed {} features for {} datasets in {} ms ({} excluded)", 
				features.size(), rows.size(), System.currentTimeMillis() - startTime, exclusions.size());
		return new FeatureMatrix(features, rows, exclusions);
	}
	
	private ExtractionResult extract(Dataset dataset) {
		String identifier = dataset.getName() + " (C" + (dataset.getChannel() + 1) + ")";
		boolean hasFrequency = dataset.hasFrequency();
		var sortedValues = new EnumMap<Measurement, double[]>(Measurement.class);
		for (var feature : features) {
			var measurement = feature.getMeasurement();
			if (sortedValues.containsKey(measurement))
				continue;
			if (measurement.requiresFrequency() && !hasFrequency)
				return ExtractionResult.excluded(identifier, "no laser frequency available for " + measurement.getKey());
			double[] sorted = StatisticsHelper.getSortedFinite(dataset.pixelValues(measurement));
			if (sorted.length == 0)
				return ExtractionResult.excluded(identifier, "no valid pixels for " + measurement.getKey());
			sortedValues.put(measurement, sorted);
		}
		double[] values = new double[features.size()];
		for (int i = 0; i < values.length; i++) {
			var feature = features.get(i);
			values[i] = feature.getStatistic().computeSorted(sortedValues.get(feature.getMeasurement()));
		}
		return ExtractionResult.included(new FeatureVector(dataset.getName(), dataset.getChannel(), dataset.getGroupDisplayName(), values));
	}
	
	
	private static class ExtractionResult {
		
		private final String identifier;
		private final FeatureVector vector;
		private final String exclusion;
		
		private ExtractionResult(String identifier, FeatureVector vector, String exclusion) {
			this.identifier = identifier;
			this.vector = vector;
			this.exclusion = exclusion;
		}
		
		static ExtractionResult included(FeatureVector vector) {
			return new ExtractionResult(vector.getIdentifier(), vector, null);
		}
		
		static ExtractionResult excluded(String identifier, String reason) {
			return new ExtractionResult(identifier, null, reason);
		}
		
	}

}
