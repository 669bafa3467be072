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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestColorTools {
	
	@Test
	public void test_packRGB() {
		int rgb = ColorTools.packRGB(10, 20, 30);
		assertEquals(10, ColorTools.red(rgb));
		assertEquals(20, ColorTools.green(rgb));
		assertEquals(30, ColorTools.blue(rgb));
		assertEquals(255, (rgb >> 24) & 0xff);
		assertEquals(255, ColorTools.red(ColorTools.RED));
		assertEquals(0, ColorTools.green(ColorTools.RED));
	}
	
	@Test
	public void test_colorForName() {
		assertEquals(ColorTools.getColorForName("treated"), ColorTools.getColorForName("treated"));
		assertNotEquals(ColorTools.getColorForName("treated"), ColorTools.getColorForName("control"));
		for (String name : new String[] {"", "default", "a", "b", "group 1", null}) {
			int rgb = ColorTools.getColorForName(name);
			assertTrue(ColorTools.red(rgb) >= 40 || ColorTools.green(rgb) >= 40 || ColorTools.blue(rgb) >= 40);
		}
	}
	
	@Test
	public void test_defaultROIColors() {
		assertNotEquals(ColorTools.getDefaultROIColor(0), ColorTools.getDefaultROIColor(1));
		int n = 0;
		while (ColorTools.getDefaultROIColor(n + 1) != ColorTools.getDefaultROIColor(0))
			n++;
		assertEquals(ColorTools.getDefaultROIColor(0), ColorTools.getDefaultROIColor(n + 1));
		assertEquals(ColorTools.getDefaultROIColor(n), ColorTools.getDefaultROIColor(-1));
	}

}
