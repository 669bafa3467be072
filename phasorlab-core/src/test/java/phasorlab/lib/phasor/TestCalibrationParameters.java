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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import phasorlab.lib.images.SyntheticDecays;
import phasorlab.lib.phasor.CalibrationParameters.Provenance;

@SuppressWarnings("javadoc")
public class TestCalibrationParameters {
	
	@Test
	public void test_default() {
		var params = CalibrationParameters.getDefault();
		assertEquals(Provenance.DEFAULT, params.getProvenance());
		assertTrue(params.isIdentity());
		assertEquals(0, params.getPhase(3));
		assertEquals(1, params.getModulation(3));
		
		var field = SyntheticDecays.field(2, 1, new float[] {0.3f, Float.NaN}, new float[] {0.4f, Float.NaN});
		var applied = params.apply(field);
		assertEquals(0.3f, applied.getG(0));
		assertEquals(0.4f, applied.getS(0));
		assertFalse(applied.isValid(1));
	}
	
	@Test
	public void test_manualHarmonics() {
		var params = CalibrationParameters.createManual(0.2, 1.5);
		assertEquals(Provenance.MANUAL, params.getProvenance());
		assertEquals(0.2, params.getPhase(1));
		assertEquals(0.4, params.getPhase(2), 1e-12);
		assertEquals(1.5, params.getModulation(2));
		assertFalse(params.isIdentity());
	}
	
	@Test
	public void test_computedHarmonics() {
		var params = CalibrationParameters.createComputed(new double[] {0.1, 0.3}, new double[] {1.1, 1.2});
		assertEquals(0.3, params.getPhase(2));
		assertEquals(1.2, params.getModulation(2));
		assertThrows(IllegalArgumentException.class, () -> params.getPhase(3));
		assertThrows(IllegalArgumentException.class, () -> params.getModulation(0));
	}
	
	@Test
	public void test_invalid() {
		assertThrows(IllegalArgumentException.class, () -> CalibrationParameters.createManual(Double.NaN, 1));
		assertThrows(IllegalArgumentException.class, () -> CalibrationParameters.createManual(0, 0));
		assertThrows(IllegalArgumentException.class, () -> CalibrationParameters.createManual(0, Double.POSITIVE_INFINITY));
		assertThrows(IllegalArgumentException.class, () -> CalibrationParameters.createComputed(new double[] {0}, new double[] {1, 1}));
	}
	
	@Test
	public void test_apply() {
		var params = CalibrationParameters.createManual(Math.PI / 2, 2);
		var field = SyntheticDecays.field(1, 1, new float[] {0.25f}, new float[] {0});
		var applied = params.apply(field);
		assertEquals(0, applied.getG(0), 1e-6);
		assertEquals(0.5, applied.getS(0), 1e-6);
		// Input is unchanged
		assertEquals(0.25f, field.getG(0));
	}
	
	@Test
	public void test_equality() {
		assertEquals(CalibrationParameters.createManual(0.1, 1.1), CalibrationParameters.createManual(0.1, 1.1));
		assertNotEquals(CalibrationParameters.createManual(0.1, 1.1), CalibrationParameters.createComputed(new double[] {0.1}, new double[] {1.1}));
		assertNotEquals(CalibrationParameters.getDefault(), CalibrationParameters.createManual(0.0, 1.0));
	}

}
