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

package phasorlab.lib.measurements;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestMeasurement {
	
	@Test
	public void test_keys() {
		for (var m : Measurement.values())
			assertEquals(m, Measurement.fromKey(m.getKey()));
		assertEquals(Measurement.PHI_LIFETIME, Measurement.fromKey("phi_lifetime"));
		assertThrows(IllegalArgumentException.class, () -> Measurement.fromKey("unknown"));
	}
	
	@Test
	public void test_frequency() {
		assertFalse(Measurement.G.requiresFrequency());
		assertFalse(Measurement.PHOTON_COUNT.requiresFrequency());
		assertTrue(Measurement.AVG_LIFETIME.requiresFrequency());
		assertTrue(Measurement.getSummaryMeasurements().contains(Measurement.PHOTON_COUNT));
	}

}
