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

package phasorlab.lib.lifetime;

import phasorlab.lib.common.GeneralTools;
import phasorlab.lib.phasor.PhasorTools;

/**
 * Static methods to estimate fluorescence lifetimes from phasor coordinates.
 * <p>
 * All methods take the angular frequency {@code omega} (radians per ns) of the harmonic 
 * the coordinates belong to, and return lifetimes in ns. 
 * Where an estimate is undefined, {@code Double.NaN} is returned.
 * 
 * @author PhasorLab developers
 * @see PhasorTools#angularFrequency(double, int)
 */
public class LifetimeTools {
	
	/**
	 * Tolerance used when deciding whether a coordinate is inside the semicircle, 
	 * and when accepting fractions at the boundary of [0, 1].
	 */
	static final double EPS = 1e-9;
	
	private LifetimeTools() {
		throw new AssertionError();
	}
	
	/**
	 * Apparent lifetime from the phase angle, {@code tan(phi) / omega}.
	 * 
	 * @param g
	 * @param s
	 * @param omega
	 * @return the phase lifetime, or NaN if {@code g <= 0} or the input is not finite
	 */
	public static double phiLifetime(double g, double s, double omega) {
		if (!Double.isFinite(g) || !Double.isFinite(s) || !(omega > 0) || g <= 0)
			return Double.NaN;
		return (s / g) / omega;
	}
	
	/**
	 * Apparent lifetime from the modulation, {@code sqrt(1/M^2 - 1) / omega}.
	 * 
	 * @param g
	 * @param s
	 * @param omega
	 * @return the modulation lifetime, or NaN if the modulation is zero or exceeds 1
	 */
	public static double mLifetime(double g, double s, double omega) {
		if (!Double.isFinite(g) || !Double.isFinite(s) || !(omega > 0))
			return Double.NaN;
		double m2 = g * g + s * s;
		if (m2 == 0 || m2 > 1)
			return Double.NaN;
		return Math.sqrt(1.0 / m2 - 1.0) / omega;
	}
	
	/**
	 * Lifetime of the point on the universal semicircle closest to the coordinate.
	 * <p>
	 * The semicircle is the upper half of the circle with centre (0.5, 0) and radius 0.5. 
	 * Coordinates at the centre itself project onto the top of the semicircle.
	 * 
	 * @param g
	 * @param s
	 * @param omega
	 * @return the projected lifetime, or NaN if the input is not finite
	 */
	public static double projLifetime(double g, double s, double omega) {
		if (!Double.isFinite(g) || !Double.isFinite(s) || !(omega > 0))
			return Double.NaN;
		double dg = g - 0.5;
		double ds = Math.abs(s);
		double r = Math.hypot(dg, ds);
		double pg, ps;
		if (r == 0) {
			pg = 0.5;
			ps = 0.5;
		} else {
			pg = 0.5 + 0.5 * dg / r;
			ps = 0.5 * ds / r;
		}
		if (pg <= 0)
			return Double.POSITIVE_INFINITY;
		// On the semicircle, s/g = omega * tau
		return (ps / pg) / omega;
	}
	
	/**
	 * Resolve a coordinate into two lifetime components lying on the universal semicircle.
	 * <p>
	 * For a mixture with fractional intensities {@code a} and {@code 1-a} of components with 
	 * {@code x_j = omega*tau_j}, the phasor at harmonic {@code n} is 
	 * {@code P_n = a/(1 - i*n*x1) + (1-a)/(1 - i*n*x2)}. 
	 * Combining the first and second harmonic eliminates the fraction and gives a linear system 
	 * in {@code x1 + x2} and {@code x1 * x2}; the lifetimes are the roots of the resulting quadratic.
	 * The fraction is then found by the lever rule along the chord joining both components.
	 * 
	 * @param g1 first harmonic g
	 * @param s1 first harmonic s
	 * @param g2 second harmonic g
	 * @param s2 second harmonic s
	 * @param omega angular frequency of the first harmonic
	 * @return the resolved components
	 * @throws UnresolvableMixtureException if no physically meaningful solution exists
	 */
	public static TwoComponentSolution resolveTwoComponents(double g1, double s1, double g2, double s2, double omega) throws UnresolvableMixtureException {
		if (!Double.isFinite(g1) || !Double.isFinite(s1) || !Double.isFinite(g2) || !Double.isFinite(s2))
			throw new UnresolvableMixtureException("Phasor coordinates are not finite");
		if (!(omega > 0) || !Double.isFinite(omega))
			throw new UnresolvableMixtureException("Angular frequency must be > 0");
		if (s1 <= 0 || PhasorTools.distanceFromSemicircle(g1, s1) >= -EPS)
			throw new UnresolvableMixtureException("Phasor coordinate is not inside the universal semicircle");
		
		// Real and imaginary parts of 2*P1*(1 - i*sum - prod) - P2*(1 - 2i*sum - 4*prod) = 1
		// Coefficient of sum: i*2*(P2 - P1)
		double aRe = -2 * (s2 - s1);
		double aIm = 2 * (g2 - g1);
		// Coefficient of prod: 4*P2 - 2*P1
		double bRe = 4 * g2 - 2 * g1;
		double bIm = 4 * s2 - 2 * s1;
		// Right-hand side: 1 - 2*P1 + P2
		double cRe = 1 - 2 * g1 + g2;
		double cIm = -2 * s1 + s2;
		
		double det = aRe * bIm - aIm * bRe;
		if (Math.abs(det) < EPS)
			throw new UnresolvableMixtureException("Linear system for the component lifetimes is singular");
		double sum = (cRe * bIm - cIm * bRe) / det;
		double prod = (aRe * cIm - aIm * cRe) / det;
		
		double disc = sum * sum - 4 * prod;
		if (disc < 0)
			throw new UnresolvableMixtureException("No real component lifetimes (discriminant " + disc + ")");
		double root = Math.sqrt(disc);
		double x1 = (sum - root) / 2.0;
		double x2 = (sum + root) / 2.0;
		if (x1 <= 0 || x2 <= 0)
			throw new UnresolvableMixtureException("Component lifetimes must be > 0");
		
		double[] z1 = PhasorTools.semicirclePoint(1.0, x1);
		double[] z2 = PhasorTools.semicirclePoint(1.0, x2);
		double dg = z1[0] - z2[0];
		double ds = z1[1] - z2[1];
		double len2 = dg * dg + ds * ds;
		if (len2 < EPS * EPS)
			throw new UnresolvableMixtureException("Component lifetimes are indistinguishable");
		double fraction = ((g1 - z2[0]) * dg + (s1 - z2[1]) * ds) / len2;
		if (fraction < -EPS || fraction > 1 + EPS)
			throw new UnresolvableMixtureException("Fraction " + fraction + " is outside [0, 1]");
		fraction = GeneralTools.clipValue(fraction, 0.0, 1.0);
		
		return new TwoComponentSolution(x1 / omega, x2 / omega, fraction);
	}

}
