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

package phasorlab.lib.ml.features;

import phasorlab.lib.classifiers.Normalization;

/**
 * Record that a feature column could not be scaled because its spread was zero.
 * The column is still centred, but left unscaled.
 * 
 * @author PhasorLab developers
 */
public class DegenerateNormalizationWarning {
	
	private final int featureIndex;
	private final String featureName;
	private final Normalization normalization;
	private final double spread;
	
	DegenerateNormalizationWarning(int featureIndex, String featureName, Normalization normalization, double spread) {
		this.featureIndex = featureIndex;
		this.featureName = featureName;
		this.normalization = normalization;
		this.spread = spread;
	}
	
	/**
	 * Index of the affected column.
	 * @return
	 */
	public int getFeatureIndex() {
		return featureIndex;
	}
	
	/**
	 * Name of the affected column, if known.
	 * @return the name, or null
	 */
	public String getFeatureName() {
		return featureName;
	}
	
	public Normalization getNormalization() {
		return normalization;
	}
	
	/**
	 * The spread (IQR or standard deviation) that was found, which is zero or not finite.
	 * @return
	 */
	public double getSpread() {
		return spread;
	}
	
	@Override
	public String toString() {
		String name = featureName == null ? "column " + featureIndex : featureName;
		String what = normalization == Normalization.ROBUST ? "IQR" : "standard deviation";
		return "Feature " + name + " has " + what + " " + spread + " - centred but not scaled";
	}

}
