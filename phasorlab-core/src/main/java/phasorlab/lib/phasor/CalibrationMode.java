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
 * Methods of deriving calibration parameters from a reference measurement.
 * 
 * @author PhasorLab developers
 */
public enum CalibrationMode {
	
	/**
	 * The reference is a single-exponential sample of known lifetime. 
	 * Its measured phasor is mapped onto the theoretical position on the universal semicircle.
	 */
	REFERENCE_LIFETIME,
	
	/**
	 * The reference is the instrument response function, i.e. a sample of zero lifetime.
	 * Calibration divides by the reference phasor, which is equivalent to mapping it onto (1, 0).
	 */
	IRF;
	
	@Override
	public String toString() {
		switch (this) {
		case REFERENCE_LIFETIME:
			return "Reference phasor";
		case IRF:
			return "IRF";
		default:
			throw new IllegalArgumentException("Unknown calibration mode!");
		}
	}

}
