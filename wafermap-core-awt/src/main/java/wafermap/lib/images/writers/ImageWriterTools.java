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
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import wafermap.lib.common.GeneralTools;

/**
 * Static methods to access {@link ImageWriter} objects and write images.
 * 
 * @author WaferMap developers
 *
 */
public class ImageWriterTools {
	
	private static final Logger logger = LoggerFactory.getLogger(ImageWriterTools.class);
	
	private static ServiceLoader<ImageWriter> serviceLoader = ServiceLoader.load(ImageWriter.class);
	
	// Suppressed default constructor for non-instantiability
	private ImageWriterTools() {
		throw new AssertionError();
	}
	
	/**
	 * Get a list of ImageWriters supporting a file extension.
	 * 
	 * @param ext the desired output file extension (e.g. ".png", "jpg"); if null, all writers are returned
	 * @return
	 */
	public static List<ImageWriter> getCompatibleWriters(final String ext) {
		String ext2;
		if (ext == null)
			ext2 = null;
		else {
			ext2 = ext.trim().toLowerCase();
			ext2 = ext2.startsWith(".") ? ext2.substring(1) : ext2;
		}
		List<ImageWriter> writers = new ArrayList<>();
		synchronized(serviceLoader) {
			for (ImageWriter writer : serviceLoader) {
				if (ext2 == null || writer.getExtensions().contains(ext2))
					writers.add(writer);
			}
		}
		return writers;
	}
	
	/**
	 * Write an image using the first compatible writer based on the file path.
	 * @param img
	 * @param path
	 * @return the writer that was used
	 * @throws IOException if the path has no supported extension, or the image could not be written
	 */
	public static ImageWriter writeImage(final BufferedImage img, final String path) throws IOException {
		String ext = GeneralTools.getExtension(path).orElse(null);
		if (ext == null)
			throw new IOException("Unable to write " + path + " - no file extension");
		List<ImageWriter> compatibleWriters = getCompatibleWriters(ext);
		if (compatibleWriters.isEmpty())
			throw new IOException("Unable to write " + path + " - no writer found for " + ext);
		
		IOException lastException = null;
		for (ImageWriter writer : compatibleWriters) {
			try {
				writer.writeImage(img, path);
				logger.debug("Image written to {} with {}", path, writer.getName());
				return writer;
			} catch (IOException e) {
				logger.warn("Unable to write image with {}: {}", writer.getName(), e.getLocalizedMessage());
				lastException = e;
			}
		}
		throw new IOException("Unable to write " + path, lastException);
	}

}
