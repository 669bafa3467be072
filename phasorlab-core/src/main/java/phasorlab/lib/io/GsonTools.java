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

package phasorlab.lib.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Access a {@link Gson} instance configured for PhasorLab output.
 * <p>
 * NaN and infinite values are written as-is, since they are used throughout to represent missing values.
 * 
 * @author PhasorLab developers
 */
public class GsonTools {
	
	private static final GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues();
	
	private GsonTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get the default Gson.
	 * @return
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}
	
	/**
	 * Get the default Gson, optionally with pretty printing enabled.
	 * 
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}

}
