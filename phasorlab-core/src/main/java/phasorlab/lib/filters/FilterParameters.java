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

import java.util.Collection;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.ToIntFunction;

import phasorlab.lib.common.Prefs;

/**
 * Immutable parameters for the filter pipeline: a median filter followed by a photon count threshold.
 * 
 * @author PhasorLab developers
 */
public class FilterParameters {
	
	private final int kernelSize;
	private final int repetitions;
	private final int minCount;
	private final int maxCount;
	
	private FilterParameters(int kernelSize, int repetitions, int minCount, int maxCount) {
		if (kernelSize < 1 || kernelSize % 2 == 0)
			throw new IllegalArgumentException("Kernel size must be odd and >= 1, but was " + kernelSize);
		if (repetitions < 0)
			throw new IllegalArgumentException("Repetitions must be >= 0, but was " + repetitions);
		if (minCount > maxCount)
			throw new IllegalArgumentException("Minimum count " + minCount + " exceeds maximum count " + maxCount);
		this.kernelSize = kernelSize;
		this.repetitions = repetitions;
		this.minCount = minCount;
		this.maxCount = maxCount;
	}
	
	/**
	 * Create filter parameters.
	 * 
	 * @param kernelSize median filter window size, odd and &geq; 1
	 * @param repetitions number of times the median filter is applied, &geq; 0
	 * @param minCount minimum photon count (inclusive)
	 * @param maxCount maximum photon count (inclusive)
	 * @return
	 */
	public static FilterParameters create(int kernelSize, int repetitions, int minCount, int maxCount) {
		return new FilterParameters(kernelSize, repetitions, minCount, maxCount);
	}
	
	/**
	 * Get the default parameters, based upon {@link Prefs}.
	 * The median filter is disabled by default (0 repetitions).
	 * @return
	 */
	public static FilterParameters getDefault() {
		return new FilterParameters(Prefs.getDefaultKernelSize(), 0, Prefs.getDefaultMinCount(), Prefs.getDefaultMaxCount());
	}
	
	/**
	 * Median filter window size.
	 * @return
	 */
	public int getKernelSize() {
		return kernelSize;
	}

	/**
	 * Number of median filter repetitions.
	 * @return
	 */
	public int getRepetitions() {
		return repetitions;
	}

	/**
	 * Minimum photon count (inclusive).
	 * @return
	 */
	public int getMinCount() {
		return minCount;
	}

	/**
	 * Maximum photon count (inclusive).
	 * @return
	 */
	public int getMaxCount() {
		return maxCount;
	}
	
	/**
	 * Create a copy with a different median filter.
	 * @param kernelSize
	 * @param repetitions
	 * @return
	 */
	public FilterParameters withMedian(int kernelSize, int repetitions) {
		return new FilterParameters(kernelSize, repetitions, minCount, maxCount);
	}
	
	/**
	 * Create a copy with a different photon count range.
	 * @param minCount
	 * @param maxCount
	 * @return
	 */
	public FilterParameters withCountRange(int minCount, int maxCount) {
		return new FilterParameters(kernelSize, repetitions, minCount, maxCount);
	}
	
	/**
	 * Summarize the parameters of several datasets, e.g. for a multi-selection.
	 * Each value of the result is present only if it is shared by all the parameters, 
	 * and is otherwise empty (i.e. 'mixed').
	 * 
	 * @param parameters
	 * @return
	 */
	public static PartialParameters consensus(Collection<FilterParameters> parameters) {
		return new PartialParameters(
				shared(parameters, FilterParameters::getKernelSize),
				shared(parameters, FilterParameters::getRepetitions),
				shared(parameters, FilterParameters::getMinCount),
				shared(parameters, FilterParameters::getMaxCount)
				);
	}
	
	private static OptionalInt shared(Collection<FilterParameters> parameters, ToIntFunction<FilterParameters> fun) {
		var values = parameters.stream().mapToInt(fun).distinct().toArray();
		return values.length == 1 ? OptionalInt.of(values[0]) : OptionalInt.empty();
	}
	
	/**
	 * Filter parameter values that may each be absent.
	 * <p>
	 * When summarizing several datasets, an empty value indicates that the datasets differ ('mixed').
	 * When editing several datasets, an empty value indicates that the existing value should be kept.
	 */
	public static class PartialParameters {
		
		private final OptionalInt kernelSize;
		private final OptionalInt repetitions;
		private final OptionalInt minCount;
		private final OptionalInt maxCount;
		
		private PartialParameters(OptionalInt kernelSize, OptionalInt repetitions, OptionalInt minCount, OptionalInt maxCount) {
			this.kernelSize = kernelSize;
			this.repetitions = repetitions;
			this.minCount = minCount;
			this.maxCount = maxCount;
		}
		
		/**
		 * Create partial parameters from optional values.
		 * @param kernelSize
		 * @param repetitions
		 * @param minCount
		 * @param maxCount
		 * @return
		 */
		public static PartialParameters of(OptionalInt kernelSize, OptionalInt repetitions, OptionalInt minCount, OptionalInt maxCount) {
			return new PartialParameters(kernelSize, repetitions, minCount, maxCount);
		}
		
		/**
		 * Shared kernel size, if any.
		 * @return
		 */
		public OptionalInt getKernelSize() {
			return kernelSize;
		}
		
		/**
		 * Shared number of repetitions, if any.
		 * @return
		 */
		public OptionalInt getRepetitions() {
			return repetitions;
		}
		
		/**
		 * Shared minimum count, if any.
		 * @return
		 */
		public OptionalInt getMinCount() {
			return minCount;
		}
		
		/**
		 * Shared maximum count, if any.
		 * @return
		 */
		public OptionalInt getMaxCount() {
			return maxCount;
		}
		
		/**
		 * Apply the values that are present to existing parameters, keeping the existing values otherwise.
		 * This makes it possible to edit only some parameters of a multi-selection.
		 * 
		 * @param existing
		 * @return
		 */
		public FilterParameters applyTo(FilterParameters existing) {
			return FilterParameters.create(
					kernelSize.orElse(existing.kernelSize),
					repetitions.orElse(existing.repetitions),
					minCount.orElse(existing.minCount),
					maxCount.orElse(existing.maxCount));
		}
		
		/**
		 * Returns true if any value is absent.
		 * @return
		 */
		public boolean isMixed() {
			return kernelSize.isEmpty() || repetitions.isEmpty() || minCount.isEmpty() || maxCount.isEmpty();
		}
		
	}

	@Override
	public int hashCode() {
		return Objects.hash(kernelSize, maxCount, minCount, repetitions);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		FilterParameters other = (FilterParameters) obj;
		return kernelSize == other.kernelSize && maxCount == other.maxCount && minCount == other.minCount
				&& repetitions == other.repetitions;
	}
	
	@Override
	public String toString() {
		return String.format("FilterParameters[median %dx%d (x%d), counts %d-%d]", kernelSize, kernelSize, repetitions, minCount, maxCount);
	}

}
