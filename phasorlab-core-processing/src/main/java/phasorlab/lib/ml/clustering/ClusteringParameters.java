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

/**
 * Parameters for one clustering algorithm.
 * 
 * @author PhasorLab developers
 * @see KMeansParameters
 * @see DBSCANParameters
 */
public interface ClusteringParameters {
	
	/**
	 * Get the algorithm these parameters are for.
	 * @return
	 */
	ClusteringAlgorithm getAlgorithm();
	
	/**
	 * Get the minimum number of points needed to apply the algorithm.
	 * @return
	 */
	int getMinimumPoints();

}
