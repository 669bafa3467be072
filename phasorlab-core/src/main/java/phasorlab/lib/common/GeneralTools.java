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

package phasorlab.lib.common;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * A collection of generally-useful static methods.
 * 
 * @author PhasorLab developers
 */
public class GeneralTools {
	
	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Check if a string is blank, i.e. it is null or its length is 0.
	 * @param s
	 * @param trim If true, any string will be trimmed before its length checked.
	 * @return True if the string is null or empty.
	 */
	public static boolean blankString(final String s, final boolean trim) {
		return s == null || (trim ? s.trim().length() == 0 : s.length() == 0);
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return value < min ? min : (value > max ? max : value);
	}
	
	/**
	 * Clip a value to be within a specific range.
	 * 
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}
	
	/**
	 * Generate a name that is distinct from the names in an existing collection, while being based on a provided name.
	 * <p>
	 * Names are generated in the form {@code "base (i)"} where {@code i} is an integer.
	 * If the base already has this form, the existing integer is stripped first; 
	 * for example {@code "ROI (1)"} becomes {@code "ROI (2)"} rather than {@code "ROI (1) (1)"}.
	 * 
	 * @param base the (non-empty) base from which the name should be derived
	 * @param existingNames a collection of names that are already in use, and therefore must be avoided
	 * @return the distinct name
	 */
	public static String generateDistinctName(String base, Collection<String> existingNames) {
		if (!existingNames.contains(base))
			return base;
		
		if (Pattern.matches(".* (\\([\\d]+\\))$", base))
			base = base.substring(0, base.lastIndexOf(" ("));
		
		int lastInd = 0;
		var pattern = Pattern.compile(Pattern.quote(base) + " \\(([\\d]+)\\)");
		for (var existing : existingNames) {
			var matcher = pattern.matcher(existing);
			if (matcher.matches())
				lastInd = Math.max(lastInd, Integer.parseInt(matcher.group(1)));
		}
		return base + " (" + (lastInd + 1) + ")";
	}

}
