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

package wafermap.lib.analysis.interpolation;

import wafermap.lib.analysis.boundary.ExtendedSampleSet;

/**
 * The result of interpolating an {@link ExtendedSampleSet}: the evaluation grid and the field values on it.
 * 
 * @author WaferMap developers
 */
public class InterpolatedField {
	
	private final ExtendedSampleSet samples;
	private final InterpolationGrid grid;
	private final Field field;
	private final RbfInterpolator interpolator;
	
	InterpolatedField(ExtendedSampleSet samples, InterpolationGrid grid, Field field, RbfInterpolator interpolator) {
		this.samples = samples;
		this.grid = grid;
		this.field = field;
		this.interpolator = interpolator;
	}
	
	/**
	 * The samples the field was fitted to.
	 * @return
	 */
	public ExtendedSampleSet getSamples() {
		return samples;
	}
	
	/**
	 * The grid on which the field was evaluated.
	 * @return
	 */
	public InterpolationGrid getGrid() {
		return grid;
	}
	
	/**
	 * The field values.
	 * @return
	 */
	public Field getField() {
		return field;
	}
	
	/**
	 * The fitted interpolant, which may be evaluated at arbitrary locations.
	 * @return
	 */
	public RbfInterpolator getInterpolator() {
		return interpolator;
	}

}
