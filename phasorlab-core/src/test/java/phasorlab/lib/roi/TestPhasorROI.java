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

package phasorlab.lib.roi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;

import phasorlab.lib.common.ColorTools;

@SuppressWarnings("javadoc")
public class TestPhasorROI {
	
	@Test
	public void test_invalid() {
		assertThrows(IllegalArgumentException.class, () -> PhasorROI.create(" ", 0.5, 0.3, 0.1, ColorTools.RED));
		assertThrows(IllegalArgumentException.class, () -> PhasorROI.create(null, 0.5, 0.3, 0.1, ColorTools.RED));
		assertThrows(IllegalArgumentException.class, () -> PhasorROI.create("ROI", Double.NaN, 0.3, 0.1, ColorTools.RED));
		assertThrows(IllegalArgumentException.class, () -> PhasorROI.create("ROI", 0.5, 0.3, 0, ColorTools.RED));
		assertThrows(IllegalArgumentException.class, () -> PhasorROI.create("ROI", 0.5, 0.3, -0.1, ColorTools.RED));
	}
	
	@Test
	public void test_contains() {
		var roi = PhasorROI.create("ROI", 0.5, 0.25, 0.25, ColorTools.RED);
		assertTrue(roi.contains(0.5, 0.25));
		// Boundary is inclusive
		assertTrue(roi.contains(0.75, 0.25));
		assertTrue(roi.contains(0.5, 0.0));
		assertFalse(roi.contains(0.76, 0.25));
		assertFalse(roi.contains(Double.NaN, 0.25));
		assertFalse(roi.contains(0.5, Double.NaN));
	}
	
	@Test
	public void test_translationSymmetry() {
		var rng = new Random(100L);
		var roi = PhasorROI.create("ROI", 0.4, 0.3, 0.1, ColorTools.GREEN);
		for (int i = 0; i < 1000; i++) {
			double g = rng.nextDouble();
			double s = rng.nextDouble() * 0.5;
			double dg = rng.nextDouble() - 0.5;
			double ds = rng.nextDouble() - 0.5;
			assertEquals(roi.contains(g, s), roi.translate(dg, ds).contains(g + dg, s + ds), 
					() -> "Translation changed membership for " + g + ", " + s);
		}
	}
	
	@Test
	public void test_geometry() {
		var roi = PhasorROI.create("ROI", 0.4, 0.3, 0.1, ColorTools.BLUE);
		var envelope = roi.getEnvelope();
		assertEquals(0.3, envelope.getMinX(), 1e-12);
		assertEquals(0.5, envelope.getMaxX(), 1e-12);
		assertEquals(0.2, envelope.getMinY(), 1e-12);
		assertEquals(0.4, envelope.getMaxY(), 1e-12);
		
		var geometry = roi.getGeometry();
		assertTrue(geometry.isValid());
		assertEquals(Math.PI * 0.01, geometry.getArea(), Math.PI * 0.01 * 0.01);
		var factory = new GeometryFactory();
		assertTrue(geometry.contains(factory.createPoint(new Coordinate(0.4, 0.3))));
		assertFalse(geometry.contains(factory.createPoint(new Coordinate(0.55, 0.3))));
	}
	
	@Test
	public void test_immutable() {
		var roi = PhasorROI.create("ROI", 0.4, 0.3, 0.1, ColorTools.BLUE);
		var moved = roi.withCenter(0.6, 0.2);
		assertEquals(0.4, roi.getCenterG());
		assertEquals(0.6, moved.getCenterG());
		assertEquals(0.2, moved.getCenterS());
		assertEquals("ROI", moved.getName());
		
		assertEquals(0.2, roi.withRadius(0.2).getRadius());
		assertEquals(ColorTools.RED, roi.withColor(ColorTools.RED).getColor());
		
		assertEquals(roi, PhasorROI.create("ROI", 0.4, 0.3, 0.1, ColorTools.BLUE));
		assertEquals(roi.hashCode(), PhasorROI.create("ROI", 0.4, 0.3, 0.1, ColorTools.BLUE).hashCode());
		assertNotEquals(roi, moved);
	}

}
