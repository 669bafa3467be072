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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestGsonTools {
	
	@Test
	public void test_specialValues() {
		String json = GsonTools.getInstance().toJson(List.of(Double.NaN, 1.0, Double.POSITIVE_INFINITY));
		assertEquals("[NaN,1.0,Infinity]", json);
		double[] read = GsonTools.getInstance().fromJson(json, double[].class);
		assertTrue(Double.isNaN(read[0]));
		assertEquals(Double.POSITIVE_INFINITY, read[2]);
	}
	
	@Test
	public void test_pretty() {
		var map = Map.of("a", 1);
		assertEquals("{\"a\":1}", GsonTools.getInstance(false).toJson(map));
		assertTrue(GsonTools.getInstance(true).toJson(map).contains("\n"));
	}

}
