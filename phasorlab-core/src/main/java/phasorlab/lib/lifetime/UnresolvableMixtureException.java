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

package phasorlab.lib.lifetime;

/**
 * Exception thrown when a phasor coordinate cannot be resolved into two lifetime components.
 * <p>
 * This is expected to occur for many pixels in a typical image, and is caught when computing 
 * lifetime maps. For that reason, no stack trace is filled in.
 * 
 * @author PhasorLab developers
 */
public class UnresolvableMixtureException extends Exception {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor.
	 * @param message the reason the mixture could not be resolved
	 */
	public UnresolvableMixtureException(String message) {
		super(message, null, false, false);
	}

}
