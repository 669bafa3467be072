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

/**
 * Static helper methods for working with phasor coordinates, the universal semicircle 
 * and the conversion between laser frequency and angular frequency.
 * <p>
 * Throughout PhasorLab, laser frequencies are given in MHz and lifetimes in ns.
 * 
 * @author PhasorLab developers
 */
public class PhasorTools {
	
	private PhasorTools() {
		throw new AssertionError();
	}
	
	/**
	 * Convert a laser repetition frequency to angular frequency.
	 * 
	 * @param frequencyMHz frequency in MHz
	 * @param harmonic harmonic number (1 for the fundamental)
	 * @return angular frequency in radians per ns
	 */
	public static double angularFrequency(double frequencyMHz, int harmonic) {
		return 2.0 * Math.PI * frequencyMHz * harmonic * 1e-3;
	}
	
	/**
	 * Convert a laser repetition frequency to angular frequency for the fundamental harmonic.
	 * 
	 * @param frequencyMHz frequency in MHz
	 * @return angular frequency in radians per ns
	 */
	public static double angularFrequency(double frequencyMHz) {
		return angularFrequency(frequencyMHz, 1);
	}
	
	/**
	 * Get the phasor coordinate of a single-exponential decay, which lies on the universal semicircle.
	 * 
	 * @param omega angular frequency in radians per ns
	 * @param lifetime lifetime in ns
	 * @return array containing {g, s}
	 */
	public static double[] semicirclePoint(double omega, double lifetime) {
		double wt = omega * lifetime;
		double denom = 1.0 + wt * wt;
		return new double[] {1.0 / denom, wt / denom};
	}
	
	/**
	 * Get the phase angle of a phasor coordinate.
	 * @param g
	 * @param s
	 * @return phase in radians
	 */
	public static double phase(double g, double s) {
		return Math.atan2(s, g);
	}
	
	/**
	 * Get the modulation (magnitude) of a phasor coordinate.
	 * @param g
	 * @param s
	 * @return
	 */
	public static double modulation(double g, double s) {
		return Math.sqrt(g * g + s * s);
	}
	
	/**
	 * Get the signed distance of a phasor coordinate from the universal semicircle.
	 * Negative values are inside the semicircle, positive values outside.
	 * @param g
	 * @param s
	 * @return
	 */
	public static double distanceFromSemicircle(double g, double s) {
		double dg = g - 0.5;
		return Math.sqrt(dg * dg + s * s) - 0.5;
	}
	
	/**
	 * Rotate a phasor coordinate by a phase and scale it by a modulation factor, 
	 * i.e. multiply {@code g + i*s} by {@code modulation * exp(i*phase)}.
	 * 
	 * @param g
	 * @param s
	 * @param phase phase rotation in radians
	 * @param modulation scale factor
	 * @return array containing the transformed {g, s}
	 */
	public static double[] transform(double g, double s, double phase, double modulation) {
		double cos = modulation * Math.cos(phase);
		double sin = modulation * Math.sin(phase);
		return new double[] {g * cos - s * sin, g * sin + s * cos};
	}

}
