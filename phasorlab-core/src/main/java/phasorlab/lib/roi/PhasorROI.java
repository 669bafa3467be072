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

import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.util.GeometricShapeFactory;

import phasorlab.lib.common.GeneralTools;

/**
 * Circular region of interest in phasor space.
 * <p>
 * A coordinate belongs to the ROI if its distance from the center is &leq; the radius.
 * Instances are immutable: moving or resizing a ROI creates a new instance with the same name.
 * 
 * @author PhasorLab developers
 */
public class PhasorROI {
	
	private static final GeometryFactory DEFAULT_FACTORY = new GeometryFactory();
	
	private static final int DEFAULT_POINTS = 64;
	
	private final String name;
	private final double centerG;
	private final double centerS;
	private final double radius;
	private final int color;
	
	private PhasorROI(String name, double centerG, double centerS, double radius, int color) {
		if (GeneralTools.blankString(name, true))
			throw new IllegalArgumentException("ROI name must not be blank");
		if (!Double.isFinite(centerG) || !Double.isFinite(centerS))
			throw new IllegalArgumentException("ROI center must be finite");
		if (!(radius > 0) || !Double.isFinite(radius))
			throw new IllegalArgumentException("ROI radius must be > 0, but was " + radius);
		this.name = name;
		this.centerG = centerG;
		this.centerS = centerS;
		this.radius = radius;
		this.color = color;
	}
	
	/**
	 * Create a new ROI.
	 * 
	 * @param name unique name
	 * @param centerG
	 * @param centerS
	 * @param radius radius, must be &gt; 0
	 * @param color packed RGB display color
	 * @return
	 */
	public static PhasorROI create(String name, double centerG, double centerS, double radius, int color) {
		return new PhasorROI(name, centerG, centerS, radius, color);
	}
	
	/**
	 * Create a copy of this ROI with a new center.
	 * @param centerG
	 * @param centerS
	 * @return
	 */
	public PhasorROI withCenter(double centerG, double centerS) {
		return new PhasorROI(name, centerG, centerS, radius, color);
	}
	
	/**
	 * Create a copy of this ROI translated by the specified amounts.
	 * @param dg
	 * @param ds
	 * @return
	 */
	public PhasorROI translate(double dg, double ds) {
		return withCenter(centerG + dg, centerS + ds);
	}
	
	/**
	 * Create a copy of this ROI with a new radius.
	 * @param radius
	 * @return
	 */
	public PhasorROI withRadius(double radius) {
		return new PhasorROI(name, centerG, centerS, radius, color);
	}
	
	/**
	 * Create a copy of this ROI with a new display color.
	 * @param color
	 * @return
	 */
	public PhasorROI withColor(int color) {
		return new PhasorROI(name, centerG, centerS, radius, color);
	}
	
	public String getName() {
		return name;
	}
	
	public double getCenterG() {
		return centerG;
	}
	
	public double getCenterS() {
		return centerS;
	}
	
	public double getRadius() {
		return radius;
	}
	
	public int getColor() {
		return color;
	}
	
	/**
	 * Get the bounding box of the ROI, with g along x and s along y.
	 * @return
	 */
	public Envelope getEnvelope() {
		return new Envelope(centerG - radius, centerG + radius, centerS - radius, centerS + radius);
	}
	
	/**
	 * Query if a phasor coordinate is inside the ROI.
	 * NaN coordinates are never inside.
	 * 
	 * @param g
	 * @param s
	 * @return
	 */
	public boolean contains(double g, double s) {
		double dg = g - centerG;
		double ds = s - centerS;
		// False for NaN
		return dg * dg + ds * ds <= radius * radius;
	}
	
	/**
	 * Get a polygon approximating the ROI boundary, for display.
	 * @return
	 */
	public Polygon getGeometry() {
		var shapeFactory = new GeometricShapeFactory(DEFAULT_FACTORY);
		shapeFactory.setNumPoints(DEFAULT_POINTS);
		shapeFactory.setCentre(new Coordinate(centerG, centerS));
		shapeFactory.setSize(radius * 2);
		return shapeFactory.createCircle();
	}
	
	@Override
	public int hashCode() {
		return Objects.hash(name, centerG, centerS, radius, color);
	}
	
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof PhasorROI))
			return false;
		var other = (PhasorROI)obj;
		return name.equals(other.name) && Double.compare(centerG, other.centerG) == 0 &&
				Double.compare(centerS, other.centerS) == 0 && Double.compare(radius, other.radius) == 0 &&
				color == other.color;
	}
	
	@Override
	public String toString() {
		return String.format("PhasorROI[%s, center=(%.4f, %.4f), radius=%.4f]", name, centerG, centerS, radius);
	}

}
