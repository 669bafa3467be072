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

/**
 * Lifetimes and fractional intensities of a two-component mixture.
 * The first component always has the shorter lifetime.
 * 
 * @author PhasorLab developers
 */
public class TwoComponentSolution {
	
	private final double tau1;
	private final double tau2;
	private final double fraction1;
	
	TwoComponentSolution(double tau1, double tau2, double fraction1) {
		this.tau1 = tau1;
		this.tau2 = tau2;
		this.fraction1 = fraction1;
	}
	
	/**
	 * Shorter lifetime, in ns.
	 * @return
	 */
	public double getTau1() {
		return tau1;
	}
	
	/**
	 * Longer lifetime, in ns.
	 * @return
	 */
	public double getTau2() {
		return tau2;
	}
	
	/**
	 * Fractional intensity of the shorter lifetime component.
	 * @return
	 */
	public double getFraction1() {
		return fraction1;
	}
	
	/**
	 * Fractional intensity of the longer lifetime component.
	 * @return
	 */
	public double getFraction2() {
		return 1.0 - fraction1;
	}
	
	/**
	 * Intensity-weighted average lifetime.
	 * @return
	 */
	public double getAverageLifetime() {
		return fraction1 * tau1 + (1.0 - fraction1) * tau2;
	}
	
	@Override
	public String toString() {
		return String.format("TwoComponentSolution (tau1=%.4f, tau2=%.4f, fraction1=%.4f)", tau1, tau2, fraction1);
	}

}
