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

/**
 * Exception thrown when a scattered-data interpolant cannot be fitted, 
 * typically because the points are coincident or collinear and the linear system is singular.
 * 
 * @author WaferMap developers
 */
public class InterpolationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor.
	 * @param message
	 */
	public InterpolationException(String message) {
		super(message);
	}

	/**
	 * Constructor with a cause.
	 * @param message
	 * @param cause
	 */
	public InterpolationException(String message, Throwable cause) {
		super(message, cause);
	}

}
