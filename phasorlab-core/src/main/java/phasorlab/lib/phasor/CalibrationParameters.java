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

import java.util.Arrays;

import phasorlab.lib.images.PhasorField;

/**
 * Immutable phase and modulation correction, applied by rotating and scaling phasor coordinates.
 * <p>
 * Parameters are stored per harmonic. Manually-specified parameters are given for the fundamental only; 
 * for harmonic {@code n} the phase is multiplied by {@code n} (as for a pure time delay) and the modulation is unchanged.
 * 
 * @author PhasorLab developers
 */
public class CalibrationParameters {
	
	/**
	 * Origin of calibration parameters.
	 */
	public static enum Provenance {
		/**
		 * No calibration: phase 0, modulation 1.
		 */
		DEFAULT,
		/**
		 * Computed from a reference measurement.
		 */
		COMPUTED,
		/**
		 * Entered directly by the user.
		 */
		MANUAL
	}
	
	private static final CalibrationParameters DEFAULT = new CalibrationParameters(Provenance.DEFAULT, new double[] {0.0}, new double[] {1.0});
	
	private final Provenance provenance;
	private final double[] phases;
	private final double[] modulations;
	
	private CalibrationParameters(Provenance provenance, double[] phases, double[] modulations) {
		this.provenance = provenance;
		this.phases = phases;
		this.modulations = modulations;
	}
	
	/**
	 * Get the default (no-op) parameters, with phase 0 and modulation 1 for all harmonics.
	 * @return
	 */
	public static CalibrationParameters getDefault() {
		return DEFAULT;
	}
	
	/**
	 * Create parameters that have been computed from a reference.
	 * 
	 * @param phases phase offsets in radians, where {@code phases[n-1]} applies to harmonic {@code n}
	 * @param modulations modulation ratios, where {@code modulations[n-1]} applies to harmonic {@code n}
	 * @return
	 */
	public static CalibrationParameters createComputed(double[] phases, double[] modulations) {
		if (phases.length == 0 || phases.length != modulations.length)
			throw new IllegalArgumentException("Phases and modulations must be non-empty arrays of the same length");
		for (int i = 0; i < phases.length; i++)
			checkValues(phases[i], modulations[i]);
		return new CalibrationParameters(Provenance.COMPUTED, phases.clone(), modulations.clone());
	}
	
	/**
	 * Create parameters entered manually for the fundamental harmonic.
	 * 
	 * @param phase phase offset in radians
	 * @param modulation modulation ratio, must be &gt; 0
	 * @return
	 */
	public static CalibrationParameters createManual(double phase, double modulation) {
		checkValues(phase, modulation);
		return new CalibrationParameters(Provenance.MANUAL, new double[] {phase}, new double[] {modulation});
	}
	
	private static void checkValues(double phase, double modulation) {
		if (!Double.isFinite(phase))
			throw new IllegalArgumentException("Phase must be finite, but was " + phase);
		if (!(modulation > 0) || !Double.isFinite(modulation))
			throw new IllegalArgumentException("Modulation must be finite and > 0, but was " + modulation);
	}
	
	/**
	 * Get the origin of these parameters.
	 * @return
	 */
	public Provenance getProvenance() {
		return provenance;
	}
	
	/**
	 * Get the phase offset for the fundamental harmonic.
	 * @return phase in radians
	 */
	public double getPhase() {
		return getPhase(1);
	}
	
	/**
	 * Get the modulation ratio for the fundamental harmonic.
	 * @return
	 */
	public double getModulation() {
		return getModulation(1);
	}
	
	/**
	 * Get the phase offset for a specified harmonic.
	 * @param harmonic
	 * @return phase in radians
	 * @throws IllegalArgumentException if computed parameters are not available for the harmonic
	 */
	public double getPhase(int harmonic) {
		if (harmonic < 1)
			throw new IllegalArgumentException("Harmonic must be >= 1");
		if (harmonic <= phases.length)
			return phases[harmonic-1];
		switch (provenance) {
		case DEFAULT:
			return 0.0;
		case MANUAL:
			return phases[0] * harmonic;
		case COMPUTED:
		default:
			throw new IllegalArgumentException("No calibration computed for harmonic " + harmonic);
		}
	}
	
	/**
	 * Get the modulation ratio for a specified harmonic.
	 * @param harmonic
	 * @return
	 * @throws IllegalArgumentException if computed parameters are not available for the harmonic
	 */
	public double getModulation(int harmonic) {
		if (harmonic < 1)
			throw new IllegalArgumentException("Harmonic must be >= 1");
		if (harmonic <= modulations.length)
			return modulations[harmonic-1];
		switch (provenance) {
		case DEFAULT:
			return 1.0;
		case MANUAL:
			return modulations[0];
		case COMPUTED:
		default:
			throw new IllegalArgumentException("No calibration computed for harmonic " + harmonic);
		}
	}
	
	/**
	 * Returns true if these parameters have no effect, i.e. all phases are 0 and all modulations are 1.
	 * @return
	 */
	public boolean isIdentity() {
		return Arrays.stream(phases).allMatch(p -> p == 0.0) && Arrays.stream(modulations).allMatch(m -> m == 1.0);
	}
	
	/**
	 * Apply the correction to every pixel of a phasor field.
	 * <p>
	 * Note that this is not idempotent: applying the same parameters to an already-calibrated field applies the correction twice.
	 * 
	 * @param field the field to calibrate (unchanged)
	 * @return a new calibrated field
	 */
	public PhasorField apply(PhasorField field) {
		int[] harmonics = field.getHarmonics();
		float[][] real = field.getRealArrays();
		float[][] imag = field.getImaginaryArrays();
		if (isIdentity())
			return field.withCoordinates(real, imag);
		for (int h = 0; h < harmonics.length; h++) {
			double phase = getPhase(harmonics[h]);
			double modulation = getModulation(harmonics[h]);
			double cos = modulation * Math.cos(phase);
			double sin = modulation * Math.sin(phase);
			float[] g = real[h];
			float[] s = imag[h];
			for (int i = 0; i < g.length; i++) {
				double gi = g[i];
				double si = s[i];
				g[i] = (float)(gi * cos - si * sin);
				s[i] = (float)(gi * sin + si * cos);
			}
		}
		return field.withCoordinates(real, imag);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + Arrays.hashCode(modulations);
		result = prime * result + Arrays.hashCode(phases);
		result = prime * result + provenance.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		CalibrationParameters other = (CalibrationParameters) obj;
		return provenance == other.provenance && 
				Arrays.equals(phases, other.phases) && 
				Arrays.equals(modulations, other.modulations);
	}
	
	@Override
	public String toString() {
		return String.format("CalibrationParameters[%s, phase=%.4f, modulation=%.4f]", provenance, getPhase(), getModulation());
	}

}
