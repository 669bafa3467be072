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

package phasorlab.lib.ml;

/**
 * Exception thrown when there are too few samples for an analysis to be performed.
 * 
 * @author PhasorLab developers
 */
public class InsufficientDataException extends Exception {

	private static final long serialVersionUID = 1L;
	
	private final int required;
	private final int available;
	
	/**
	 * Constructor.
	 * @param message description of the analysis that could not be performed
	 * @param required the minimum number of samples needed
	 * @param available the number of samples provided
	 */
	public InsufficientDataException(String message, int required, int available) {
		super(message + " (requires at least " + required + " samples, but got " + available + ")");
		this.required = required;
		this.available = available;
	}
	
	/**
	 * Minimum number of samples needed.
	 * @return
	 */
	public int getRequired() {
		return required;
	}
	
	/**
	 * Number of samples provided.
	 * @return
	 */
	public int getAvailable() {
		return available;
	}

}
