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

package wafermap.lib.exceptions;

import java.io.IOException;

/**
 * Exception thrown when a wafer map cannot be drawn or written, 
 * e.g. because the display range is invalid or the destination is not writable.
 * 
 * @author WaferMap developers
 */
public class RenderException extends IOException {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor.
	 * @param message
	 */
	public RenderException(String message) {
		super(message);
	}

	/**
	 * Constructor with a cause.
	 * @param message
	 * @param cause
	 */
	public RenderException(String message, Throwable cause) {
		super(message, cause);
	}

}
