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

import java.util.Arrays;
import java.util.List;

/**
 * Per-pixel measurements that can be summarized for a dataset.
 * 
 * @author PhasorLab developers
 */
public enum Measurement {
	
	/**
	 * Raw total photon count.
	 */
	PHOTON_COUNT("photon_count", "Photon count", false),
	/**
	 * Phasor g coordinate.
	 */
	G("g", "G", false),
	/**
	 * Phasor s coordinate.
	 */
	S("s", "S", false),
	/**
	 * Apparent lifetime from phase.
	 */
	PHI_LIFETIME("phi_lifetime", "Phase lifetime", true),
	/**
	 * Apparent lifetime from modulation.
	 */
	M_LIFETIME("m_lifetime", "Modulation lifetime", true),
	/**
	 * Lifetime of the closest point on the universal semicircle.
	 */
	PROJ_LIFETIME("proj_lifetime", "Projected lifetime", true),
	/**
	 * Shorter lifetime of a two-component mixture.
	 */
	GEO_TAU1("geo_tau1", "Tau 1", true),
	/**
	 * Longer lifetime of a two-component mixture.
	 */
	GEO_TAU2("geo_tau2", "Tau 2", true),
	/**
	 * Fractional intensity of the shorter component.
	 */
	GEO_FRAC1("geo_frac1", "Fraction 1", true),
	/**
	 * Fractional intensity of the longer component.
	 */
	GEO_FRAC2("geo_frac2", "Fraction 2", true),
	/**
	 * Intensity-weighted average of the two-component lifetimes.
	 */
	AVG_LIFETIME("avg_lifetime", "Average lifetime", true);
	
	private final String key;
	private final String displayName;
	private final boolean requiresFrequency;
	
	Measurement(String key, String displayName, boolean requiresFrequency) {
		this.key = key;
		this.displayName = displayName;
		this.requiresFrequency = requiresFrequency;
	}
	
	/**
	 * Get the key used to identify this measurement in feature names and exports.
	 * @return
	 */
	public String getKey() {
		return key;
	}
	
	/**
	 * Returns true if the laser frequency must be known to compute this measurement.
	 * @return
	 */
	public boolean requiresFrequency() {
		return requiresFrequency;
	}
	
	/**
	 * Get the measurements exported by {@code Dataset.summarize()}.
	 * @return
	 */
	public static List<Measurement> getSummaryMeasurements() {
		return Arrays.asList(PHOTON_COUNT, PHI_LIFETIME, M_LIFETIME, PROJ_LIFETIME, AVG_LIFETIME);
	}
	
	/**
	 * Get the measurement with the specified key.
	 * @param key
	 * @return
	 * @throws IllegalArgumentException if the key is unknown
	 */
	public static Measurement fromKey(String key) {
		for (var m : values()) {
			if (m.key.equals(key))
				return m;
		}
		throw new IllegalArgumentException("Unknown measurement: " + key);
	}
	
	@Override
	public String toString() {
		return displayName;
	}

}
