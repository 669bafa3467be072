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

package phasorlab.lib.classifiers;

/**
 * Methods for normalizing features.
 * 
 * @author PhasorLab developers
 */
public enum Normalization {

	/**
	 * Do not normalize features.
	 */
	NONE,
	
	/**
	 * Normalize by subtracting the mean and dividing by the (population) standard deviation.
	 */
	ZSCORE,
	
	/**
	 * Normalize by subtracting the median and dividing by the interquartile range.
	 */
	ROBUST;

	@Override
	public String toString() {
		switch (this) {
		case NONE:
			return "None";
		case ZSCORE:
			return "Mean & standard deviation";
		case ROBUST:
			return "Median & IQR";
		default:
			throw new IllegalArgumentException("Unknown normalization method!");
		}
	}

}
