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

package wafermap.lib.render;

import wafermap.lib.exceptions.RenderException;

/**
 * Draws a wafer map and writes it to its destination.
 * <p>
 * Implementations decide how the map looks (palette, marker style, image format); 
 * everything they need is contained in the {@link RenderRequest}.
 * 
 * @author WaferMap developers
 */
public interface WaferMapRenderer {
	
	/**
	 * Draw the map described by the request and persist it.
	 * @param request
	 * @throws RenderException if the map cannot be drawn or written
	 */
	public void render(RenderRequest request) throws RenderException;

}
