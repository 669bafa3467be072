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

/**
 * Calibration state of a {@link Dataset}.
 * 
 * @author PhasorLab developers
 */
public enum CalibrationStatus {
	
	/**
	 * No calibration has been applied.
	 */
	UNCALIBRATED("Uncalibrated"),
	
	/**
	 * The current calibration parameters have been applied.
	 */
	CALIBRATED("Calibrated"),
	
	/**
	 * A calibration was applied, but the calibration parameters have changed since.
	 */
	STALE("Stale");
	
	private final String displayName;
	
	CalibrationStatus(String displayName) {
		this.displayName = displayName;
	}
	
	@Override
	public String toString() {
		return displayName;
	}

}
