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

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import phasorlab.lib.common.Prefs;
import phasorlab.lib.images.DecayCube;
import phasorlab.lib.images.PhasorField;

/**
 * Calibration against a reference measurement, shared by all datasets within a session.
 * <p>
 * A new calibration starts with default parameters (phase 0, modulation 1), which are a valid no-op.
 * Parameters become computed once a reference has been loaded and {@link #calibrate(double, double)} succeeds.
 * They can be overridden manually at any time with {@link #setManual(double, double)}; manual parameters 
 * are kept until {@link #reset()} or a new successful {@link #calibrate(double, double)} call.
 * <p>
 * Listeners are notified whenever the parameters change, so that datasets calibrated with older parameters 
 * can be marked as stale.
 * 
 * @author PhasorLab developers
 */
public class Calibration {
	
	private static final Logger logger = LoggerFactory.getLogger(Calibration.class);
	
	private String referenceName;
	private PhasorField reference;
	private double referenceFrequency = Double.NaN;
	
	private CalibrationMode mode = CalibrationMode.REFERENCE_LIFETIME;
	
	private double frequency = Double.NaN;
	private double lifetime = Double.NaN;
	
	private CalibrationParameters parameters = CalibrationParameters.getDefault();
	
	private List<CalibrationListener> listeners = new CopyOnWriteArrayList<>();
	
	/**
	 * Compute calibration parameters from a reference phasor field.
	 * <p>
	 * The reference is pooled over all valid pixels (photon-weighted). For each harmonic {@code n} of the reference, 
	 * the measured phase and modulation are compared with the theoretical values at angular frequency {@code n*omega}:
	 * <pre>
	 *   phase      = atan(n*omega*tau) - atan2(s, g)
	 *   modulation = (1 / sqrt(1 + (n*omega*tau)^2)) / sqrt(g^2 + s^2)
	 * </pre>
	 * In {@link CalibrationMode#IRF} mode, the reference lifetime is taken to be 0.
	 * 
	 * @param reference the reference phasor field
	 * @param frequency laser frequency in MHz
	 * @param lifetime reference lifetime in ns (ignored in IRF mode)
	 * @param mode
	 * @return the computed parameters
	 * @throws CalibrationException if the frequency or lifetime is not &gt; 0, or the reference has no valid pixels
	 */
	public static CalibrationParameters computeParameters(PhasorField reference, double frequency, double lifetime, CalibrationMode mode) throws CalibrationException {
		Objects.requireNonNull(mode);
		if (reference == null)
			throw new CalibrationException("No reference has been loaded");
		if (!(frequency > 0) || !Double.isFinite(frequency))
			throw new CalibrationException("Laser frequency must be > 0, but was " + frequency);
		if (mode == CalibrationMode.IRF)
			lifetime = 0;
		else if (!(lifetime > 0) || !Double.isFinite(lifetime))
			throw new CalibrationException("Reference lifetime must be > 0, but was " + lifetime);
		if (reference.countValid() == 0)
			throw new CalibrationException("Reference has no valid pixels");
		
		int[] harmonics = reference.getHarmonics();
		int maxHarmonic = 0;
		for (int h : harmonics)
			maxHarmonic = Math.max(maxHarmonic, h);
		// Parameters are stored for harmonics 1..max, so every intermediate harmonic must be available
		double[] phases = new double[maxHarmonic];
		double[] modulations = new double[maxHarmonic];
		for (int h = 1; h <= maxHarmonic; h++) {
			if (!reference.hasHarmonic(h))
				throw new CalibrationException("Reference does not contain harmonic " + h);
			double[] center = reference.getPooledCenter(h);
			double measuredModulation = PhasorTools.modulation(center[0], center[1]);
			if (!(measuredModulation > 0))
				throw new CalibrationException("Reference phasor for harmonic " + h + " has zero modulation");
			double wt = PhasorTools.angularFrequency(frequency, h) * lifetime;
			double theoryPhase = Math.atan(wt);
			double theoryModulation = 1.0 / Math.sqrt(1.0 + wt * wt);
			phases[h-1] = theoryPhase - PhasorTools.phase(center[0], center[1]);
			modulations[h-1] = theoryModulation / measuredModulation;
		}
		return CalibrationParameters.createComputed(phases, modulations);
	}
	
	/**
	 * Set the reference from a decay cube.
	 * If the cube provides a laser frequency, it is stored as a suggestion (see {@link #getReferenceFrequency()}).
	 * 
	 * @param cube
	 * @param transform the transform used to compute the reference phasors
	 */
	public void setReference(DecayCube cube, PhasorTransform transform) {
		setReference(cube.getName(), transform.apply(cube));
		this.referenceFrequency = cube.getFrequency();
	}
	
	/**
	 * Set the reference phasor field directly.
	 * This does not change the current parameters; call {@link #calibrate(double, double)} to do so.
	 * 
	 * @param name name of the reference, used for logging
	 * @param reference
	 */
	public void setReference(String name, PhasorField reference) {
		this.referenceName = name;
		this.reference = Objects.requireNonNull(reference);
		this.referenceFrequency = Double.NaN;
		logger.info("Loaded calibration reference {} ({} valid pixels)", name, reference.countValid());
	}
	
	/**
	 * Returns true if a reference has been set.
	 * @return
	 */
	public boolean hasReference() {
		return reference != null;
	}
	
	/**
	 * Name of the current reference, or null if there is none.
	 * @return
	 */
	public String getReferenceName() {
		return referenceName;
	}
	
	/**
	 * Laser frequency found in the reference metadata, or NaN if unknown.
	 * @return
	 */
	public double getReferenceFrequency() {
		return referenceFrequency;
	}
	
	/**
	 * Get the calibration mode.
	 * @return
	 */
	public CalibrationMode getMode() {
		return mode;
	}
	
	/**
	 * Set the calibration mode used by the next call to {@link #calibrate(double, double)}.
	 * @param mode
	 */
	public void setMode(CalibrationMode mode) {
		this.mode = Objects.requireNonNull(mode);
	}
	
	/**
	 * Laser frequency (MHz) used for the last successful calibration, or NaN.
	 * @return
	 */
	public double getFrequency() {
		return frequency;
	}
	
	/**
	 * Reference lifetime (ns) used for the last successful calibration, or NaN.
	 * @return
	 */
	public double getLifetime() {
		return lifetime;
	}
	
	/**
	 * Get the current parameters.
	 * @return
	 */
	public CalibrationParameters getParameters() {
		return parameters;
	}
	
	/**
	 * Compute parameters from the current reference.
	 * On failure, the current parameters are unchanged.
	 * 
	 * @param frequency laser frequency in MHz
	 * @param lifetime reference lifetime in ns (ignored in IRF mode)
	 * @return the new parameters
	 * @throws CalibrationException if the reference, frequency or lifetime is missing or invalid
	 */
	public CalibrationParameters calibrate(double frequency, double lifetime) throws CalibrationException {
		var computed = computeParameters(reference, frequency, lifetime, mode);
		this.frequency = frequency;
		this.lifetime = lifetime;
		logger.info("Calibrated using {} ({}, {} MHz, {} ns): {}", referenceName, mode, frequency, lifetime, computed);
		updateParameters(computed);
		return computed;
	}
	
	/**
	 * Get the laser frequency to suggest for calibration: the reference frequency if known, 
	 * otherwise the default from {@link Prefs}.
	 * @return frequency in MHz
	 */
	public double getSuggestedFrequency() {
		if (referenceFrequency > 0 && Double.isFinite(referenceFrequency))
			return referenceFrequency;
		return Prefs.getDefaultLaserFrequency();
	}
	
	/**
	 * Compute parameters from the current reference, using the suggested frequency and the default 
	 * reference lifetime from {@link Prefs}.
	 * 
	 * @return the new parameters
	 * @throws CalibrationException if no valid reference is available
	 * @see #getSuggestedFrequency()
	 */
	public CalibrationParameters calibrateWithDefaults() throws CalibrationException {
		return calibrate(getSuggestedFrequency(), Prefs.getDefaultReferenceLifetime());
	}
	
	/**
	 * Override the parameters manually. 
	 * 
	 * @param phase phase offset in radians
	 * @param modulation modulation ratio
	 * @return the new parameters
	 */
	public CalibrationParameters setManual(double phase, double modulation) {
		var manual = CalibrationParameters.createManual(phase, modulation);
		logger.info("Calibration set manually: {}", manual);
		updateParameters(manual);
		return manual;
	}
	
	/**
	 * Reset to default parameters.
	 * The reference is retained, so that parameters can be recomputed.
	 */
	public void reset() {
		this.frequency = Double.NaN;
		this.lifetime = Double.NaN;
		updateParameters(CalibrationParameters.getDefault());
	}
	
	private void updateParameters(CalibrationParameters newParameters) {
		var previous = this.parameters;
		this.parameters = newParameters;
		if (previous.equals(newParameters))
			return;
		for (var listener : listeners)
			listener.calibrationChanged(this, previous, newParameters);
	}
	
	/**
	 * Add a listener to be notified when the parameters change.
	 * @param listener
	 */
	public void addCalibrationListener(CalibrationListener listener) {
		listeners.add(listener);
	}
	
	/**
	 * Remove a listener.
	 * @param listener
	 */
	public void removeCalibrationListener(CalibrationListener listener) {
		listeners.remove(listener);
	}
	
	@Override
	public String toString() {
		return "Calibration (" + (referenceName == null ? "no reference" : referenceName) + ", " + parameters + ")";
	}

}
