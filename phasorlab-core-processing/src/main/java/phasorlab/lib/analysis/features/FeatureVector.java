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

import java.util.Objects;

/**
 * Feature values for one dataset, together with the identity of the dataset.
 * 
 * @author PhasorLab developers
 */
public class FeatureVector {
	
	private final String name;
	private final int channel;
	private final String group;
	private final double[] values;
	
	/**
	 * Constructor.
	 * @param name dataset name
	 * @param channel zero-based channel index
	 * @param group group name, as displayed
	 * @param values feature values, in the order of the columns of the matrix the vector belongs to
	 */
	public FeatureVector(String name, int channel, String group, double[] values) {
		this.name = Objects.requireNonNull(name);
		this.channel = channel;
		this.group = group == null ? "" : group;
		this.values = values.clone();
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
	
	/**
	 * Get a string that identifies the dataset, combining name and channel.
	 * @return
	 */
	public String getIdentifier() {
		return name + " (C" + (channel + 1) + ")";
	}
	
	public int size() {
		return values.length;
	}
	
	public double getValue(int index) {
		return values[index];
	}
	
	/**
	 * Get a copy of the feature values.
	 * @return
	 */
	public double[] getValues() {
		return values.clone();
	}
	
	@Override
	public String toString() {
		return "FeatureVector[" + getIdentifier() + ", group=" + group + ", n=" + values.length + "]";
	}

}
