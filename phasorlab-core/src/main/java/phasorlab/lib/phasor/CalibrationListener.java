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

package phasorlab.lib.phasor;

/**
 * Listener notified whenever the parameters of a {@link Calibration} change.
 * 
 * @author PhasorLab developers
 */
@FunctionalInterface
public interface CalibrationListener {
	
	/**
	 * Called after the calibration parameters have changed.
	 * 
	 * @param calibration the calibration that changed
	 * @param previous the parameters before the change
	 * @param current the parameters after the change
	 */
	void calibrationChanged(Calibration calibration, CalibrationParameters previous, CalibrationParameters current);

}
