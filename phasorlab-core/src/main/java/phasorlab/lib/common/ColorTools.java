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

import java.util.Random;

/**
 * Static functions to help work with RGB colors using packed ints.
 * <p>
 * Colors are used for ROI display and to distinguish dataset groups; PhasorLab never renders them itself.
 * 
 * @author PhasorLab developers
 */
public final class ColorTools {

	// Suppressed default constructor for non-instantiability
	private ColorTools() {
		throw new AssertionError();
	}
	
	/**
	 * Packed int representing red.
	 */
	public static final int RED = packRGB(255, 0, 0);

	/**
	 * Packed int representing green.
	 */
	public static final int GREEN = packRGB(0, 255, 0);

	/**
	 * Packed int representing blue.
	 */
	public static final int BLUE = packRGB(0, 0, 255);

	/**
	 * Packed int representing magenta.
	 */
	public static final int MAGENTA = packRGB(255, 0, 255);

	/**
	 * Packed int representing cyan.
	 */
	public static final int CYAN = packRGB(0, 255, 255);

	/**
	 * Packed int representing yellow.
	 */
	public static final int YELLOW = packRGB(255, 255, 0);
	
	private static final int[] DEFAULT_ROI_COLORS = {
			packRGB(148, 0, 211),  // dark violet
			packRGB(154, 205, 50), // yellow green
			MAGENTA,
			RED,
			CYAN,
			YELLOW
	};
	
	/**
	 * Make a packed RGB value from specified input values.
	 * The alpha channel is set to 255.
	 * <p>
	 * Input r, g, and b should be in the range 0-255; only the lower 8 bits are used.
	 * 
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 */
	public static int packRGB(int r, int g, int b) {
		return ((255 & 0xff)<<24) + 
			   ((r & 0xff)<<16) + 
			   ((g & 0xff)<<8) + 
			    (b & 0xff);
	}

	/**
	 * Extract the 8-bit red value from a packed RGB value.
	 * 
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return (rgb >> 16) & 0xff;
	}
	
	/**
	 * Extract the 8-bit green value from a packed RGB value.
	 * 
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return (rgb >> 8) & 0xff;
	}

	/**
	 * Extract the 8-bit blue value from a packed RGB value.
	 * 
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return (rgb & 0xff);
	}
	
	/**
	 * Get a color derived from a name.
	 * <p>
	 * The same name always gives the same color, without any shared state. 
	 * Very dark colors are rejected so that the result remains visible on a dark background.
	 * 
	 * @param name the name; null is treated as an empty string
	 * @return packed RGB value
	 */
	public static int getColorForName(String name) {
		var random = new Random(name == null ? 0 : name.hashCode());
		int r = 0, g = 0, b = 0;
		while (r < 40 && g < 40 && b < 40) {
			r = random.nextInt(256);
			g = random.nextInt(256);
			b = random.nextInt(256);
		}
		return packRGB(r, g, b);
	}
	
	/**
	 * Get a default display color for the n-th ROI, cycling through a small fixed palette.
	 * @param index
	 * @return packed RGB value
	 */
	public static int getDefaultROIColor(int index) {
		return DEFAULT_ROI_COLORS[Math.floorMod(index, DEFAULT_ROI_COLORS.length)];
	}

}
