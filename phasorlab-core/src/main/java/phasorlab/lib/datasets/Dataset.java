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

package phasorlab.lib.datasets;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phasorlab.lib.common.ColorTools;
import phasorlab.lib.common.GeneralTools;
import phasorlab.lib.filters.FilterParameters;
import phasorlab.lib.filters.PhasorFilters;
import phasorlab.lib.filters.PhotonCountThreshold;
import phasorlab.lib.images.DecayCube;
import phasorlab.lib.images.PhasorField;
import phasorlab.lib.lifetime.LifetimeMaps;
import phasorlab.lib.measurements.Measurement;
import phasorlab.lib.phasor.CalibrationParameters;
import phasorlab.lib.phasor.PhasorTransform;
import phasorlab.lib.roi.PhasorROIs;
import phasorlab.lib.roi.ROIMask;

/**
 * One FLIM image channel together with everything derived from it.
 * <p>
 * The raw phasor field never changes. Calibration, filtering and lifetime estimation are recomputed 
 * into new objects whenever their inputs change, and replace the previous results only once complete.
 * <p>
 * Methods are synchronized so that readers always see a consistent set of derived results.
 * 
 * @author PhasorLab developers
 */
public class Dataset {
	
	private static final Logger logger = LoggerFactory.getLogger(Dataset.class);
	
	/**
	 * Name displayed for the empty group.
	 */
	public static final String DEFAULT_GROUP = "default";
	
	private final String name;
	private final int channel;
	private final PhasorField raw;
	
	private String group = "";
	private double frequency;
	
	private CalibrationStatus status = CalibrationStatus.UNCALIBRATED;
	private CalibrationParameters calibrationParameters = CalibrationParameters.getDefault();
	private FilterParameters filterParameters = FilterParameters.getDefault();
	
	private PhasorField calibrated;
	private PhasorField filtered;
	private LifetimeMaps lifetimeMaps;
	
	private Dataset(String name, int channel, PhasorField raw, double frequency) {
		if (GeneralTools.blankString(name, true))
			throw new IllegalArgumentException("Dataset name must not be blank");
		this.name = name;
		this.channel = channel;
		this.raw = Objects.requireNonNull(raw);
		this.frequency = frequency > 0 ? frequency : Double.NaN;
		this.calibrated = raw;
		this.filtered = PhasorFilters.apply(raw, filterParameters);
		this.lifetimeMaps = LifetimeMaps.compute(filtered, this.frequency);
	}
	
	/**
	 * Create a dataset by transforming a decay cube.
	 * The laser frequency is taken from the cube, if available.
	 * 
	 * @param cube
	 * @param transform
	 * @return
	 */
	public static Dataset create(DecayCube cube, PhasorTransform transform) {
		return new Dataset(cube.getName(), cube.getChannel(), transform.apply(cube), cube.getFrequency());
	}
	
	/**
	 * Create a dataset from an existing raw phasor field.
	 * 
	 * @param name
	 * @param channel
	 * @param raw
	 * @param frequency laser frequency in MHz, or NaN if unknown
	 * @return
	 */
	public static Dataset create(String name, int channel, PhasorField raw, double frequency) {
		return new Dataset(name, channel, raw, frequency);
	}
	
	public String getName() {
		return name;
	}
	
	/**
	 * Get the zero-based channel index.
	 * @return
	 */
	public int getChannel() {
		return channel;
	}
	
	/**
	 * Get the group name, which is an empty string for the default group.
	 * @return
	 */
	public synchronized String getGroup() {
		return group;
	}
	
	/**
	 * Get the group name for display, replacing the empty group by {@link #DEFAULT_GROUP}.
	 * @return
	 */
	public synchronized String getGroupDisplayName() {
		return group.isEmpty() ? DEFAULT_GROUP : group;
	}
	
	/**
	 * Set the group. Null or blank values reset to the default group.
	 * @param group
	 */
	public synchronized void setGroup(String group) {
		this.group = group == null ? "" : group.strip();
	}
	
	/**
	 * Get the display color for the group, derived from the group name alone.
	 * @return packed RGB value
	 */
	public synchronized int getGroupColor() {
		return ColorTools.getColorForName(getGroupDisplayName());
	}
	
	/**
	 * Get a name for display, including the channel and group.
	 * @return
	 */
	public synchronized String getDisplayName() {
		return name + " (C" + (channel + 1) + ") [" + getGroupDisplayName() + "]";
	}
	
	/**
	 * Get the laser frequency in MHz.
	 * @return the frequency, or NaN if unknown
	 */
	public synchronized double getFrequency() {
		return frequency;
	}
	
	/**
	 * Returns true if the laser frequency is known, and lifetimes can be computed.
	 * @return
	 */
	public synchronized boolean hasFrequency() {
		return Double.isFinite(frequency);
	}
	
	/**
	 * Set the laser frequency and recompute lifetimes.
	 * @param frequency frequency in MHz, must be &gt; 0
	 */
	public synchronized void setFrequency(double frequency) {
		if (!(frequency > 0) || !Double.isFinite(frequency))
			throw new IllegalArgumentException("Laser frequency must be > 0, but was " + frequency);
		if (this.frequency == frequency)
			return;
		var maps = LifetimeMaps.compute(filtered, frequency);
		this.frequency = frequency;
		this.lifetimeMaps = maps;
	}
	
	public synchronized CalibrationStatus getCalibrationStatus() {
		return status;
	}
	
	/**
	 * Get the calibration parameters that were last applied.
	 * @return
	 */
	public synchronized CalibrationParameters getCalibrationParameters() {
		return calibrationParameters;
	}
	
	public synchronized FilterParameters getFilterParameters() {
		return filterParameters;
	}
	
	/**
	 * Apply calibration parameters, then recompute filtering and lifetimes.
	 * 
	 * @param params the parameters to apply
	 * @param calibrationFrequency laser frequency used for calibration in MHz; 
	 *                             if this is a positive value, it replaces the dataset's frequency
	 */
	public synchronized void calibrate(CalibrationParameters params, double calibrationFrequency) {
		Objects.requireNonNull(params);
		double newFrequency = calibrationFrequency > 0 && Double.isFinite(calibrationFrequency) ? calibrationFrequency : frequency;
		var newCalibrated = params.apply(raw);
		var newFiltered = PhasorFilters.apply(newCalibrated, filterParameters);
		var newMaps = LifetimeMaps.compute(newFiltered, newFrequency);
		
		this.calibrationParameters = params;
		this.frequency = newFrequency;
		this.calibrated = newCalibrated;
		this.filtered = newFiltered;
		this.lifetimeMaps = newMaps;
		this.status = CalibrationStatus.CALIBRATED;
		logger.debug("Calibrated {} with {}", name, params);
	}
	
	/**
	 * Mark a calibrated dataset as stale, because the calibration parameters have changed.
	 * This has no effect on uncalibrated datasets.
	 */
	public synchronized void markStale() {
		if (status == CalibrationStatus.CALIBRATED) {
			status = CalibrationStatus.STALE;
			logger.debug("Calibration of {} is stale", name);
		}
	}
	
	/**
	 * Set the filter parameters, and recompute filtering and lifetimes.
	 * @param params
	 */
	public synchronized void setFilterParameters(FilterParameters params) {
		Objects.requireNonNull(params);
		if (params.equals(filterParameters))
			return;
		var newFiltered = PhasorFilters.apply(calibrated, params);
		var newMaps = LifetimeMaps.compute(newFiltered, frequency);
		this.filterParameters = params;
		this.filtered = newFiltered;
		this.lifetimeMaps = newMaps;
	}
	
	/**
	 * Get the raw (uncalibrated, unfiltered) phasor field.
	 * @return
	 */
	public PhasorField getRawField() {
		return raw;
	}
	
	/**
	 * Get the calibrated phasor field, before filtering.
	 * @return
	 */
	public synchronized PhasorField getCalibratedField() {
		return calibrated;
	}
	
	/**
	 * Get the calibrated and filtered phasor field.
	 * @return
	 */
	public synchronized PhasorField getFilteredField() {
		return filtered;
	}
	
	public synchronized LifetimeMaps getLifetimeMaps() {
		return lifetimeMaps;
	}
	
	private PhotonCountThreshold getThreshold() {
		return new PhotonCountThreshold(filterParameters.getMinCount(), filterParameters.getMaxCount());
	}
	
	/**
	 * Get the raw photon counts, with pixels excluded by the threshold set to 0.
	 * @return
	 */
	public synchronized int[] getFilteredCounts() {
		return getThreshold().createFilteredCounts(raw);
	}
	
	/**
	 * Get a label image showing which pixels are below, within or above the photon count range.
	 * @return
	 * @see PhotonCountThreshold#createLabels(PhasorField)
	 */
	public synchronized byte[] getThresholdLabels() {
		return getThreshold().createLabels(raw);
	}
	
	/**
	 * Create ROI masks using the current filtered field.
	 * @param rois
	 * @return
	 */
	public synchronized List<ROIMask> createROIMasks(PhasorROIs rois) {
		return rois.createMasks(name, filtered);
	}
	
	/**
	 * Get the finite values of a measurement for all pixels that pass the filters.
	 * 
	 * @param measurement
	 * @return a new array, which is empty if there are no valid pixels
	 */
	public synchronized double[] pixelValues(Measurement measurement) {
		var field = filtered;
		var maps = lifetimeMaps;
		int n = field.nPixels();
		float[] values;
		switch (measurement) {
		case PHOTON_COUNT:
			values = new float[n];
			for (int i = 0; i < n; i++)
				values[i] = field.getTotalCount(i);
			break;
		case G:
			values = field.getReal(field.getHarmonics()[0]);
			break;
		case S:
			values = field.getImaginary(field.getHarmonics()[0]);
			break;
		case PHI_LIFETIME:
			values = maps.getPhiLifetime();
			break;
		case M_LIFETIME:
			values = maps.getMLifetime();
			break;
		case PROJ_LIFETIME:
			values = maps.getProjLifetime();
			break;
		case GEO_TAU1:
			values = maps.getTau1();
			break;
		case GEO_TAU2:
			values = maps.getTau2();
			break;
		case GEO_FRAC1:
			values = maps.getFraction1();
			break;
		case GEO_FRAC2:
			values = maps.getFraction2();
			break;
		case AVG_LIFETIME:
			values = maps.getAverageLifetime();
			break;
		default:
			throw new IllegalArgumentException("Unsupported measurement: " + measurement);
		}
		double[] result = new double[n];
		int count = 0;
		for (int i = 0; i < n; i++) {
			if (field.isValid(i) && Float.isFinite(values[i]))
				result[count++] = values[i];
		}
		return count == n ? result : Arrays.copyOf(result, count);
	}
	
	/**
	 * Get the valid pixel values of the standard summary measurements.
	 * @return an ordered map from measurement to values
	 * @see Measurement#getSummaryMeasurements()
	 */
	public synchronized Map<Measurement, double[]> summarize() {
		var map = new LinkedHashMap<Measurement, double[]>();
		for (var m : Measurement.getSummaryMeasurements())
			map.put(m, pixelValues(m));
		return map;
	}
	
	@Override
	public String toString() {
		return "Dataset[" + getDisplayName() + ", " + getCalibrationStatus() + "]";
	}

}
