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

import java.util.Collection;
import java.util.Collections;

/**
 * ImageWriter implementation to write PNG images using ImageIO.
 * 
 * @author WaferMap developers
 *
 */
public class PngWriter extends AbstractImageIOWriter {

	@Override
	public String getName() {
		return "PNG";
	}

	@Override
	public Collection<String> getExtensions() {
		return Collections.singleton("png");
	}

	@Override
	public String getDetails() {
		return "Write image as PNG using ImageIO (lossless compression).";
	}

}
