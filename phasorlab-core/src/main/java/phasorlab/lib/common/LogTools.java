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

package phasorlab.lib.common;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.event.Level;

/**
 * Helper class for logging.
 * <p>
 * Batch operations over many pixels or datasets can otherwise emit the same warning many times.
 * 
 * @author PhasorLab developers
 */
public class LogTools {
	
	private static Map<Logger, Map<Level, Set<String>>> alreadyLogged = new ConcurrentHashMap<>();

	/**
	 * Log a message once at the specified level.
	 * 
	 * @param logger
	 * @param level
	 * @param message
	 * @return true if the message was logged, false otherwise (i.e. it has already been logged)
	 */
	public static boolean logOnce(Logger logger, Level level, String message) {
		var map = alreadyLogged.computeIfAbsent(logger, l -> new ConcurrentHashMap<>());
		var set = map.computeIfAbsent(level, l -> ConcurrentHashMap.newKeySet());
		if (set.add(message)) {
			logger.atLevel(level).log(message);
			return true;
		}
		return false;
	}

	/**
	 * Log a message once at the WARN level.
	 * 
	 * @param logger
	 * @param message
	 * @return true if the message was logged, false otherwise (i.e. it has already been logged)
	 */
	public static boolean warnOnce(Logger logger, String message) {
		return logOnce(logger, Level.WARN, message);
	}
	
	/**
	 * Log the fraction of items affected by a non-fatal failure, if there were any.
	 * Nothing is logged if {@code nFailed} is zero.
	 * 
	 * @param logger
	 * @param what short description of the failure, e.g. "unresolved mixture pixels"
	 * @param nFailed number of items that failed
	 * @param nTotal total number of items
	 */
	public static void logFailureFraction(Logger logger, String what, long nFailed, long nTotal) {
		if (nFailed <= 0 || nTotal <= 0)
			return;
		logger.warn("{} {}/{} ({}%)", what, nFailed, nTotal, String.format("%.1f", nFailed * 100.0 / nTotal));
	}

}
