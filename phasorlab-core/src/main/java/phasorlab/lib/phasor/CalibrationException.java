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
 * Exception thrown when calibration parameters cannot be computed, 
 * because the reference, laser frequency or reference lifetime is missing or invalid.
 * <p>
 * This is fatal to the calibration operation only: existing calibration parameters are left unchanged.
 * 
 * @author PhasorLab developers
 */
public class CalibrationException extends Exception {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor.
	 * @param message description of the violated precondition
	 */
	public CalibrationException(String message) {
		super(message);
	}

}
