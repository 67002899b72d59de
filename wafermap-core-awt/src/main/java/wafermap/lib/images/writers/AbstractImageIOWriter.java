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
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;

import javax.imageio.ImageIO;

/**
 * Abstract ImageWriter to use Java's ImageIO.
 * 
 * @author WaferMap developers
 *
 */
abstract class AbstractImageIOWriter implements ImageWriter {

	@Override
	public void writeImage(BufferedImage img, String pathOutput) throws IOException {
		File file = new File(pathOutput);
		String ext = getDefaultExtension();
		if (!ImageIO.write(img, ext, file))
			throw new IOException("Unable to write using ImageIO with extension " + ext);
	}

	@Override
	public void writeImage(BufferedImage img, OutputStream stream) throws IOException {
		String ext = getDefaultExtension();
		if (!ImageIO.write(img, ext, stream))
			throw new IOException("Unable to write using ImageIO with extension " + ext);
	}
	
	@Override
	public String toString() {
		return getName();
	}
	
}
