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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import phasorlab.lib.common.ColorTools;
import phasorlab.lib.images.PhasorField;

@SuppressWarnings("javadoc")
public class TestPhasorROIs {
	
	@Test
	public void test_names() {
		var rois = PhasorROIs.empty();
		assertTrue(rois.isEmpty());
		rois = rois.add(0.5, 0.3, 0.1).add(0.2, 0.4, 0.1).add(0.8, 0.2, 0.05);
		assertEquals(3, rois.size());
		assertEquals("ROI", rois.getROIs().get(0).getName());
		assertEquals("ROI (1)", rois.getROIs().get(1).getName());
		assertEquals("ROI (2)", rois.getROIs().get(2).getName());
		assertEquals(ColorTools.getDefaultROIColor(1), rois.get("ROI (1)").getColor());
		assertEquals(2, rois.indexOf("ROI (2)"));
		assertEquals(-1, rois.indexOf("missing"));
		assertNull(rois.get("missing"));
		
		var roi = PhasorROI.create("ROI", 0, 0, 1, ColorTools.RED);
		var existing = rois;
		assertThrows(IllegalArgumentException.class, () -> existing.add(roi));
		assertThrows(IllegalArgumentException.class, () -> PhasorROIs.of(List.of(roi, roi.withRadius(0.5))));
	}
	
	@Test
	public void test_immutable() {
		var rois = PhasorROIs.empty().add(0.5, 0.3, 0.1);
		var added = rois.add(0.2, 0.2, 0.1);
		assertEquals(1, rois.size());
		assertEquals(2, added.size());
		assertThrows(UnsupportedOperationException.class, () -> added.getROIs().clear());
	}
	
	@Test
	public void test_replaceRemove() {
		var rois = PhasorROIs.empty().add(0.5, 0.3, 0.1).add(0.2, 0.2, 0.1);
		var moved = rois.get("ROI").translate(0.1, 0);
		var replaced = rois.replace(moved);
		assertEquals(0, replaced.indexOf("ROI"));
		assertEquals(0.6, replaced.get("ROI").getCenterG(), 1e-12);
		assertThrows(IllegalArgumentException.class, () -> rois.replace(PhasorROI.create("Other", 0, 0, 1, 0)));
		
		var removed = rois.remove("ROI");
		assertEquals(1, removed.size());
		assertEquals(0, removed.indexOf("ROI (1)"));
		assertSame(rois, rois.remove("missing"));
	}
	
	@Test
	public void test_masks() {
		float[] g = {0.5f, 0.52f, 0.9f, Float.NaN};
		float[] s = {0.3f, 0.3f, 0.1f, Float.NaN};
		var field = PhasorField.create(2, 2, new int[] {1}, new float[][] {g}, new float[][] {s}, new int[] {10, 10, 10, 0});
		var rois = PhasorROIs.of(List.of(
				PhasorROI.create("A", 0.5, 0.3, 0.05, ColorTools.RED),
				PhasorROI.create("B", 0.52, 0.3, 0.05, ColorTools.GREEN),
				PhasorROI.create("C", 0.5, 0.5, 2.0, ColorTools.BLUE)));
		var masks = rois.createMasks("dataset", field);
		assertEquals(3, masks.size());
		
		var a = masks.get(0);
		assertEquals("dataset", a.getDatasetName());
		assertEquals(1, a.getLabel());
		assertArrayEquals(new int[] {1, 1, 0, 0}, a.getLabels());
		assertEquals(2, a.getNumMembers());
		assertEquals(2.0 / 3.0, a.getMemberFraction(), 1e-12);
		
		// Overlapping ROIs share members
		var b = masks.get(1);
		assertEquals(2, b.getLabel());
		assertArrayEquals(new int[] {2, 2, 0, 0}, b.getLabels());
		
		// Invalid pixels are never members, even if a ROI covers everything
		var c = masks.get(2);
		assertEquals(3, c.getNumMembers());
		assertTrue(c.isMember(2));
		assertFalse(c.isMember(3));
		assertSame(rois.get("C"), c.getROI());
	}

}
