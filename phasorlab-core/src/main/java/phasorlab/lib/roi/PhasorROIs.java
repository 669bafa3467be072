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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

import phasorlab.lib.common.ColorTools;
import phasorlab.lib.common.GeneralTools;
import phasorlab.lib.images.PhasorField;

/**
 * Immutable, ordered collection of {@link PhasorROI} objects with unique names.
 * <p>
 * Modifying methods return a new collection, so that any list already used for mapping remains unchanged.
 * 
 * @author PhasorLab developers
 */
public class PhasorROIs {
	
	private static final PhasorROIs EMPTY = new PhasorROIs(ImmutableList.of());
	
	private final ImmutableList<PhasorROI> rois;
	
	private PhasorROIs(ImmutableList<PhasorROI> rois) {
		this.rois = rois;
	}
	
	/**
	 * Get an empty collection.
	 * @return
	 */
	public static PhasorROIs empty() {
		return EMPTY;
	}
	
	/**
	 * Create a collection from existing ROIs.
	 * @param rois
	 * @return
	 * @throws IllegalArgumentException if the names are not unique
	 */
	public static PhasorROIs of(Collection<PhasorROI> rois) {
		var list = ImmutableList.copyOf(rois);
		long nNames = list.stream().map(PhasorROI::getName).distinct().count();
		if (nNames != list.size())
			throw new IllegalArgumentException("ROI names must be unique");
		return new PhasorROIs(list);
	}
	
	/**
	 * Get the ROIs, in order.
	 * @return
	 */
	public List<PhasorROI> getROIs() {
		return rois;
	}
	
	public int size() {
		return rois.size();
	}
	
	public boolean isEmpty() {
		return rois.isEmpty();
	}
	
	/**
	 * Get the index of the ROI with the specified name.
	 * @param name
	 * @return the index, or -1 if there is no ROI with the name
	 */
	public int indexOf(String name) {
		for (int i = 0; i < rois.size(); i++) {
			if (rois.get(i).getName().equals(name))
				return i;
		}
		return -1;
	}
	
	/**
	 * Get the ROI with the specified name.
	 * @param name
	 * @return the ROI, or null if there is no ROI with the name
	 */
	public PhasorROI get(String name) {
		int ind = indexOf(name);
		return ind < 0 ? null : rois.get(ind);
	}
	
	/**
	 * Add a ROI.
	 * @param roi
	 * @return a new collection
	 * @throws IllegalArgumentException if a ROI with the same name already exists
	 */
	public PhasorROIs add(PhasorROI roi) {
		Objects.requireNonNull(roi);
		if (indexOf(roi.getName()) >= 0)
			throw new IllegalArgumentException("A ROI named '" + roi.getName() + "' already exists");
		return new PhasorROIs(ImmutableList.<PhasorROI>builder().addAll(rois).add(roi).build());
	}
	
	/**
	 * Add a new ROI with a generated unique name and a default color.
	 * @param centerG
	 * @param centerS
	 * @param radius
	 * @return a new collection
	 */
	public PhasorROIs add(double centerG, double centerS, double radius) {
		var names = rois.stream().map(PhasorROI::getName).collect(Collectors.toList());
		String name = GeneralTools.generateDistinctName("ROI", names);
		return add(PhasorROI.create(name, centerG, centerS, radius, ColorTools.getDefaultROIColor(rois.size())));
	}
	
	/**
	 * Replace the ROI that has the same name as the one provided, keeping its position in the list.
	 * @param roi
	 * @return a new collection
	 * @throws IllegalArgumentException if there is no ROI with the same name
	 */
	public PhasorROIs replace(PhasorROI roi) {
		int ind = indexOf(roi.getName());
		if (ind < 0)
			throw new IllegalArgumentException("No ROI named '" + roi.getName() + "'");
		var list = new ArrayList<>(rois);
		list.set(ind, roi);
		return new PhasorROIs(ImmutableList.copyOf(list));
	}
	
	/**
	 * Remove the ROI with the specified name, if present.
	 * @param name
	 * @return a new collection, or this collection if no ROI was removed
	 */
	public PhasorROIs remove(String name) {
		int ind = indexOf(name);
		if (ind < 0)
			return this;
		var list = new ArrayList<>(rois);
		list.remove(ind);
		return new PhasorROIs(ImmutableList.copyOf(list));
	}
	
	/**
	 * Create one mask per ROI for the specified field. 
	 * The label of each mask is the ROI's index in this collection plus one. ROIs may overlap.
	 * 
	 * @param datasetName
	 * @param field
	 * @return
	 */
	public List<ROIMask> createMasks(String datasetName, PhasorField field) {
		var masks = new ArrayList<ROIMask>(rois.size());
		for (int i = 0; i < rois.size(); i++)
			masks.add(ROIMask.create(datasetName, field, rois.get(i), i));
		return masks;
	}
	
	@Override
	public String toString() {
		return "PhasorROIs" + rois.stream().map(PhasorROI::getName).collect(Collectors.toList());
	}

}
