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

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phasorlab.lib.datasets.CalibrationStatus;
import phasorlab.lib.datasets.Dataset;
import phasorlab.lib.filters.FilterParameters;
import phasorlab.lib.filters.FilterParameters.PartialParameters;
import phasorlab.lib.images.DecayCube;
import phasorlab.lib.images.DecayCubeProvider;
import phasorlab.lib.phasor.Calibration;
import phasorlab.lib.phasor.CalibrationParameters;
import phasorlab.lib.phasor.PhasorTransform;
import phasorlab.lib.roi.PhasorROIs;
import phasorlab.lib.roi.ROIMask;

/**
 * Top-level state of an analysis: the loaded datasets, the shared calibration, the phasor ROIs 
 * and the embedding workflow.
 * <p>
 * When the calibration parameters change, every calibrated dataset is marked as stale until 
 * the new calibration is applied.
 * 
 * @author PhasorLab developers
 */
public class PhasorSession {
	
	private static final Logger logger = LoggerFactory.getLogger(PhasorSession.class);
	
	private final PhasorTransform transform;
	private final Calibration calibration = new Calibration();
	private final List<Dataset> datasets = new CopyOnWriteArrayList<>();
	private final EmbeddingWorkflow embeddingWorkflow = new EmbeddingWorkflow();
	
	private volatile PhasorROIs rois = PhasorROIs.empty();
	
	/**
	 * Create a session using the default transform (harmonics 1 and 2).
	 */
	public PhasorSession() {
		this(PhasorTransform.create());
	}
	
	/**
	 * Create a session using a specific transform.
	 * @param transform
	 */
	public PhasorSession(PhasorTransform transform) {
		this.transform = Objects.requireNonNull(transform);
		calibration.addCalibrationListener((c, previous, current) -> markCalibratedStale());
	}
	
	public PhasorTransform getTransform() {
		return transform;
	}
	
	public Calibration getCalibration() {
		return calibration;
	}
	
	public EmbeddingWorkflow getEmbeddingWorkflow() {
		return embeddingWorkflow;
	}
	
	/**
	 * Set the calibration reference from a decay cube, using the session's transform.
	 * @param cube
	 */
	public void setCalibrationReference(DecayCube cube) {
		calibration.setReference(cube, transform);
	}
	
	/**
	 * Transform a decay cube and add it as a new dataset.
	 * @param cube
	 * @return the new dataset
	 * @throws IllegalArgumentException if a dataset with the same name and channel already exists
	 */
	public Dataset addDataset(DecayCube cube) {
		var dataset = Dataset.create(cube, transform);
		addDataset(dataset);
		return dataset;
	}
	
	/**
	 * Read every requested channel of a file and add each as a new dataset.
	 * Nothing is added unless all channels can be read.
	 * 
	 * @param provider reader for the file format
	 * @param path
	 * @param channels zero-based channel indices
	 * @return the new datasets
	 * @throws IOException if the file cannot be read by the provider, or a channel could not be read
	 * @throws IllegalArgumentException if any dataset with the same name and channel already exists
	 */
	public List<Dataset> addDatasets(DecayCubeProvider provider, Path path, int... channels) throws IOException {
		if (Arrays.stream(channels).distinct().count() != channels.length)
			throw new IllegalArgumentException("Duplicate channels in " + Arrays.toString(channels));
		if (!provider.supports(path))
			throw new IOException("Unsupported file: " + path);
		var added = new ArrayList<Dataset>();
		for (int c : channels)
			added.add(Dataset.create(provider.read(path, c), transform));
		synchronized (this) {
			for (var dataset : added) {
				if (findDataset(dataset.getName(), dataset.getChannel()) != null)
					throw new IllegalArgumentException("Dataset " + dataset.getName() + " (channel " + dataset.getChannel() + ") already exists");
			}
			for (var dataset : added)
				addDataset(dataset);
		}
		return added;
	}
	
	/**
	 * Add an existing dataset.
	 * @param dataset
	 * @throws IllegalArgumentException if a dataset with the same name and channel already exists
	 */
	public synchronized void addDataset(Dataset dataset) {
		Objects.requireNonNull(dataset);
		if (findDataset(dataset.getName(), dataset.getChannel()) != null)
			throw new IllegalArgumentException("Dataset " + dataset.getName() + " (channel " + dataset.getChannel() + ") already exists");
		datasets.add(dataset);
		logger.info("Added {}", dataset);
	}
	
	/**
	 * Find a dataset by name and channel.
	 * @param name
	 * @param channel
	 * @return the dataset, or null if none is found
	 */
	public Dataset findDataset(String name, int channel) {
		for (var existing : datasets) {
			if (existing.getName().equals(name) && existing.getChannel() == channel)
				return existing;
		}
		return null;
	}
	
	/**
	 * Remove a dataset.
	 * @param dataset
	 * @return true if the dataset was removed
	 */
	public synchronized boolean removeDataset(Dataset dataset) {
		boolean removed = datasets.remove(dataset);
		if (removed && embeddingWorkflow.getDatasets().contains(dataset)) {
			var selection = new ArrayList<>(embeddingWorkflow.getDatasets());
			selection.remove(dataset);
			embeddingWorkflow.setDatasets(selection);
		}
		return removed;
	}
	
	/**
	 * Get an unmodifiable snapshot of the datasets.
	 * @return
	 */
	public List<Dataset> getDatasets() {
		return Collections.unmodifiableList(new ArrayList<>(datasets));
	}
	
	/**
	 * Get the distinct groups of all datasets, as displayed.
	 * @return
	 */
	public List<String> getGroups() {
		return datasets.stream().map(Dataset::getGroupDisplayName).distinct().sorted().collect(Collectors.toList());
	}
	
	/**
	 * Set the group of several datasets.
	 * Cached features and embeddings are discarded, since they record the group of each dataset.
	 * @param selected
	 * @param group
	 */
	public void setGroup(Collection<Dataset> selected, String group) {
		for (var dataset : selected)
			dataset.setGroup(group);
		embeddingWorkflow.invalidate();
	}
	
	/**
	 * Set the laser frequency of several datasets, recomputing their lifetimes.
	 * @param selected
	 * @param frequency frequency in MHz, must be &gt; 0
	 * @throws IllegalArgumentException if the frequency is invalid, in which case no dataset is changed
	 */
	public void setFrequency(Collection<Dataset> selected, double frequency) {
		if (!(frequency > 0) || !Double.isFinite(frequency))
			throw new IllegalArgumentException("Laser frequency must be > 0, but was " + frequency);
		for (var dataset : selected)
			dataset.setFrequency(frequency);
		logger.info("Set laser frequency of {} datasets to {} MHz", selected.size(), frequency);
		embeddingWorkflow.invalidate();
	}
	
	/**
	 * Apply the current calibration parameters to the selected datasets.
	 * The calibration frequency, if known, replaces the frequency of each dataset.
	 * 
	 * @param selected
	 */
	public void calibrate(Collection<Dataset> selected) {
		CalibrationParameters params = calibration.getParameters();
		double frequency = calibration.getFrequency();
		for (var dataset : selected)
			dataset.calibrate(params, frequency);
		logger.info("Applied {} to {} datasets", params, selected.size());
		embeddingWorkflow.invalidate();
	}
	
	/**
	 * Get the filter parameters shared by the selected datasets.
	 * @param selected
	 * @return
	 */
	public PartialParameters getFilterParameters(Collection<Dataset> selected) {
		return FilterParameters.consensus(selected.stream().map(Dataset::getFilterParameters).collect(Collectors.toList()));
	}
	
	/**
	 * Update the filter parameters of the selected datasets. 
	 * Parameters absent from the update are left unchanged for each dataset.
	 * 
	 * @param selected
	 * @param update
	 */
	public void setFilterParameters(Collection<Dataset> selected, PartialParameters update) {
		Objects.requireNonNull(update);
		// Validate everything before changing anything
		var updated = new LinkedHashMap<Dataset, FilterParameters>();
		for (var dataset : selected)
			updated.put(dataset, update.applyTo(dataset.getFilterParameters()));
		for (var entry : updated.entrySet())
			entry.getKey().setFilterParameters(entry.getValue());
		embeddingWorkflow.invalidate();
	}
	
	/**
	 * Get the current ROIs.
	 * @return
	 */
	public PhasorROIs getROIs() {
		return rois;
	}
	
	/**
	 * Replace the ROIs.
	 * @param rois
	 */
	public void setROIs(PhasorROIs rois) {
		this.rois = Objects.requireNonNull(rois);
	}
	
	/**
	 * Map the current ROIs onto the selected datasets. 
	 * The ROIs are read once, so later changes do not affect the masks returned.
	 * 
	 * @param selected
	 * @return masks for each dataset, one per ROI
	 */
	public Map<Dataset, List<ROIMask>> mapROIs(Collection<Dataset> selected) {
		var snapshot = rois;
		var map = new LinkedHashMap<Dataset, List<ROIMask>>();
		for (var dataset : selected)
			map.put(dataset, dataset.createROIMasks(snapshot));
		return map;
	}
	
	private void markCalibratedStale() {
		int n = 0;
		for (var dataset : datasets) {
			if (dataset.getCalibrationStatus() == CalibrationStatus.CALIBRATED) {
				dataset.markStale();
				n++;
			}
		}
		if (n > 0)
			logger.info("Calibration changed - {} datasets marked as stale", n);
	}
	
	@Override
	public String toString() {
		return "PhasorSession[" + datasets.size() + " datasets, " + rois.size() + " ROIs]";
	}

}
