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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGeneralTools {
	
	@Test
	public void test_blankString() {
		assertTrue(GeneralTools.blankString(null, false));
		assertTrue(GeneralTools.blankString("", false));
		assertFalse(GeneralTools.blankString("  ", false));
		assertTrue(GeneralTools.blankString("  ", true));
		assertFalse(GeneralTools.blankString(" a ", true));
	}
	
	@Test
	public void test_clipValue() {
		assertEquals(5, GeneralTools.clipValue(10, 0, 5));
		assertEquals(0, GeneralTools.clipValue(-1, 0, 5));
		assertEquals(3, GeneralTools.clipValue(3, 0, 5));
		assertEquals(1.0, GeneralTools.clipValue(1.5, 0.0, 1.0));
		assertEquals(0.0, GeneralTools.clipValue(-1e-12, 0.0, 1.0));
		assertTrue(Double.isNaN(GeneralTools.clipValue(Double.NaN, 0.0, 1.0)));
	}
	
	@Test
	public void test_generateDistinctName() {
		assertEquals("ROI", GeneralTools.generateDistinctName("ROI", Collections.emptyList()));
		assertEquals("ROI (1)", GeneralTools.generateDistinctName("ROI", Arrays.asList("ROI")));
		assertEquals("ROI (3)", GeneralTools.generateDistinctName("ROI", Arrays.asList("ROI", "ROI (2)")));
		assertEquals("ROI (2)", GeneralTools.generateDistinctName("ROI (1)", Arrays.asList("ROI", "ROI (1)")));
		assertEquals("Other", GeneralTools.generateDistinctName("Other", Arrays.asList("ROI", "ROI (1)")));
	}

}
