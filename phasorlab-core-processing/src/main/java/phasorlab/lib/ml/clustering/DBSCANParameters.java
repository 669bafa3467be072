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

package phasorlab.lib.ml.clustering;

import java.util.Objects;

/**
 * Parameters for DBSCAN clustering.
 * 
 * @author PhasorLab developers
 */
public class DBSCANParameters implements ClusteringParameters {
	
	private final double eps;
	private final int minPts;
	
	private DBSCANParameters(double eps, int minPts) {
		if (!(eps > 0) || !Double.isFinite(eps))
			throw new IllegalArgumentException("Neighborhood radius must be > 0, but was " + eps);
		if (minPts < 1)
			throw new IllegalArgumentException("Minimum points must be >= 1, but was " + minPts);
		this.eps = eps;
		this.minPts = minPts;
	}
	
	/**
	 * Create parameters.
	 * @param eps neighborhood radius in embedding units
	 * @param minPts minimum number of neighbors (excluding the point itself) for a point to be a core point
	 * @return
	 */
	public static DBSCANParameters create(double eps, int minPts) {
		return new DBSCANParameters(eps, minPts);
	}
	
	@Override
	public ClusteringAlgorithm getAlgorithm() {
		return ClusteringAlgorithm.DBSCAN;
	}
	
	@Override
	public int getMinimumPoints() {
		return 1;
	}
	
	public double getEps() {
		return eps;
	}
	
	public int getMinPts() {
		return minPts;
	}
	
	@Override
	public int hashCode() {
		return Objects.hash(eps, minPts);
	}
	
	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof DBSCANParameters))
			return false;
		var other = (DBSCANParameters)obj;
		return Double.compare(eps, other.eps) == 0 && minPts == other.minPts;
	}
	
	@Override
	public String toString() {
		return "DBSCANParameters (eps=" + eps + ", minPts=" + minPts + ")";
	}

}
