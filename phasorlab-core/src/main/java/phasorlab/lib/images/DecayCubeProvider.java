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

package phasorlab.lib.images;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Supplier of decay cubes read from files.
 * <p>
 * Parsing of time-resolved file formats is handled outside PhasorLab; implementations 
 * should populate the laser frequency when it can be discovered from the file metadata, 
 * and otherwise leave it as NaN so that it must be supplied manually.
 * 
 * @author PhasorLab developers
 */
public interface DecayCubeProvider {
	
	/**
	 * Returns true if this provider is able to read the specified file.
	 * @param path
	 * @return
	 */
	boolean supports(Path path);
	
	/**
	 * Read a single channel from a file.
	 * 
	 * @param path
	 * @param channel zero-based channel index
	 * @return
	 * @throws IOException if the file could not be read, or the channel does not exist
	 */
	DecayCube read(Path path, int channel) throws IOException;

}
