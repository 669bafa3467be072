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

package phasorlab.lib.roi;

import java.util.Objects;

import phasorlab.lib.images.PhasorField;

/**
 * Label image marking the pixels of one dataset whose phasor coordinates fall inside one ROI.
 * <p>
 * Member pixels have the value {@code roiIndex + 1}, all other pixels are 0. 
 * The mask is a snapshot: it is not updated if the ROI or the dataset changes afterwards.
 * 
 * @author PhasorLab developers
 */
public class ROIMask {
	
	private final String datasetName;
	private final PhasorROI roi;
	private final int label;
	private final int width;
	private final int height;
	private final int[] labels;
	private final int nMembers;
	private final int nValid;
	
	private ROIMask(String datasetName, PhasorROI roi, int label, int width, int height, int[] labels, int nMembers, int nValid) {
		this.datasetName = datasetName;
		this.roi = roi;
		this.label = label;
		this.width = width;
		this.height = height;
		this.labels = labels;
		this.nMembers = nMembers;
		this.nValid = nValid;
	}
	
	/**
	 * Create a mask for a ROI using the first-harmonic coordinates of a field.
	 * 
	 * @param datasetName name of the dataset the field belongs to
	 * @param field filtered phasor field; invalid pixels are never members
	 * @param roi the ROI
	 * @param roiIndex index of the ROI in its list, used to define the label
	 * @return
	 */
	public static ROIMask create(String datasetName, PhasorField field, PhasorROI roi, int roiIndex) {
		Objects.requireNonNull(field);
		Objects.requireNonNull(roi);
		if (roiIndex < 0)
			throw new IllegalArgumentException("ROI index must be >= 0");
		int label = roiIndex + 1;
		int n = field.nPixels();
		int[] labels = new int[n];
		int nMembers = 0;
		int nValid = 0;
		for (int i = 0; i < n; i++) {
			if (!field.isValid(i))
				continue;
			nValid++;
			if (roi.contains(field.getG(i), field.getS(i))) {
				labels[i] = label;
				nMembers++;
			}
		}
		return new ROIMask(datasetName, roi, label, field.getWidth(), field.getHeight(), labels, nMembers, nValid);
	}
	
	public String getDatasetName() {
		return datasetName;
	}
	
	/**
	 * Get the ROI as it was when the mask was created.
	 * @return
	 */
	public PhasorROI getROI() {
		return roi;
	}
	
	public int getLabel() {
		return label;
	}
	
	public int getWidth() {
		return width;
	}
	
	public int getHeight() {
		return height;
	}
	
	/**
	 * Get a copy of the label array, in row-major order.
	 * @return
	 */
	public int[] getLabels() {
		return labels.clone();
	}
	
	/**
	 * Query if a pixel belongs to the ROI.
	 * @param index
	 * @return
	 */
	public boolean isMember(int index) {
		return labels[index] != 0;
	}
	
	public int getNumMembers() {
		return nMembers;
	}
	
	/**
	 * Get the fraction of valid pixels inside the ROI.
	 * @return the fraction, or NaN if there are no valid pixels
	 */
	public double getMemberFraction() {
		return nValid == 0 ? Double.NaN : nMembers / (double)nValid;
	}
	
	@Override
	public String toString() {
		return "ROIMask[" + datasetName + ", " + roi.getName() + ", members=" + nMembers + "]";
	}

}
