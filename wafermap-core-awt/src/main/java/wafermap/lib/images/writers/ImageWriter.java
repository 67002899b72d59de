/*-
 * #%L
 * This file is part of WaferMap.
 * %%
 * Copyright (C) 2024 WaferMap developers
 * %%
 * WaferMap is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * WaferMap is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with WaferMap.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package wafermap.lib.images.writers;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Collection;

/**
 * Interface for defining class that can write images.
 * <p>
 * Implementations are discovered with a {@link java.util.ServiceLoader}.
 * 
 * @author WaferMap developers
 *
 */
public interface ImageWriter {
	
	/**
	 * Get the name of the image writer.
	 * @return
	 */
	public String getName();

	/**
	 * Get the file extensions used by the image writer.
	 * These are returned without the leading 'dot'.
	 * In the case where multiple extensions are associated with a file type 
	 * (e.g. "jpg", "jpeg") the preferred should be returned first.
	 * @return
	 */
	public Collection<String> getExtensions();
	
	/**
	 * Get the default extension. This should be the first returned by {@link #getExtensions()}.
	 * @return
	 */
	public default String getDefaultExtension() {
		return getExtensions().iterator().next();
	}
	
	/**
	 * Get further details of the writer, which may be displayed to a user.
	 * @return
	 */
	public String getDetails();
	
	/**
	 * Write an image to a specified path.
	 * @param img
	 * @param pathOutput
	 * @throws IOException
	 */
	public void writeImage(BufferedImage img, String pathOutput) throws IOException;
	
	/**
	 * Write an image to an output stream.
	 * @param img
	 * @param stream
	 * @throws IOException
	 */
	public void writeImage(BufferedImage img, OutputStream stream) throws IOException;

}
