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

package phasorlab.lib.filters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phasorlab.lib.images.PhasorField;

/**
 * The filter pipeline: a median filter applied to g and s, followed by a photon count threshold.
 * <p>
 * The order is fixed. The threshold always reads the raw photon counts, so median filtering 
 * can change coordinates but never which pixels are excluded.
 * 
 * @author PhasorLab developers
 */
public class PhasorFilters {
	
	private static final Logger logger = LoggerFactory.getLogger(PhasorFilters.class);
	
	private PhasorFilters() {
		throw new AssertionError();
	}
	
	/**
	 * Apply the median filter to the coordinates of every harmonic.
	 * 
	 * @param field
	 * @param kernelSize
	 * @param repetitions
	 * @return a new field
	 */
	public static PhasorField applyMedian(PhasorField field, int kernelSize, int repetitions) {
		var filter = new MedianFilter(kernelSize, repetitions);
		float[][] real = field.getRealArrays();
		float[][] imag = field.getImaginaryArrays();
		if (!filter.isNoOp()) {
			int width = field.getWidth();
			int height = field.getHeight();
			for (int h = 0; h < real.length; h++) {
				real[h] = filter.filter(real[h], width, height);
				imag[h] = filter.filter(imag[h], width, height);
			}
		}
		return field.withCoordinates(real, imag);
	}
	
	/**
	 * Apply the full pipeline.
	 * 
	 * @param field the field to filter (unchanged)
	 * @param params
	 * @return a new filtered field
	 */
	public static PhasorField apply(PhasorField field, FilterParameters params) {
		long startTime = System.currentTimeMillis();
		var filtered = applyMedian(field, params.getKernelSize(), params.getRepetitions());
		filtered = new PhotonCountThreshold(params.getMinCount(), params.getMaxCount()).apply(filtered);
		logger.debug("Applied {} in {} ms ({}/{} pixels valid)", params, System.currentTimeMillis() - startTime,
				filtered.countValid(), filtered.nPixels());
		return filtered;
	}

}
