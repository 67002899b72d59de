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

import java.awt.Graphics2D;
import java.awt.Transparency;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.Collection;

/**
 * ImageWriter implementation to write JPEG images using ImageIO.
 * 
 * @author WaferMap developers
 *
 */
public class JpegWriter extends AbstractImageIOWriter {

	@Override
	public String getName() {
		return "JPEG";
	}

	@Override
	public String getDetails() {
		return "Write image as JPEG using ImageIO (lossy compression). Any transparency is lost.";
	}
	
	@Override
	public void writeImage(BufferedImage img, String pathOutput) throws IOException {
		super.writeImage(ensureOpaque(img), pathOutput);
	}
	
	@Override
	public void writeImage(BufferedImage img, OutputStream stream) throws IOException {
		super.writeImage(ensureOpaque(img), stream);
	}
	
	// JPEG encoders in ImageIO reject images with alpha
	private static BufferedImage ensureOpaque(BufferedImage img) {
		if (img.getTransparency() == Transparency.OPAQUE)
			return img;
		BufferedImage img2 = new BufferedImage(img.getWidth(), img.getHeight(), BufferedImage.TYPE_INT_RGB);
		Graphics2D g2d = img2.createGraphics();
		g2d.drawImage(img, 0, 0, null);
		g2d.dispose();
		return img2;
	}

	@Override
	public Collection<String> getExtensions() {
		return Arrays.asList("jpg", "jpeg");
	}

}
