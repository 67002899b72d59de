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

/**
 * Radial basis functions available for scattered-data interpolation.
 * <p>
 * Each function is evaluated on the distance {@code r} between two points. 
 * Some functions are scaled by a shape parameter {@code epsilon}; others ignore it.
 * 
 * @author WaferMap developers
 * @see RbfInterpolator
 */
public enum RadialBasisFunction {
	
	/**
	 * {@code sqrt((r/epsilon)^2 + 1)}
	 */
	MULTIQUADRIC {
		@Override
		public double evaluate(double r, double epsilon) {
			double s = r / epsilon;
			return Math.sqrt(s*s + 1);
		}
	},
	
	/**
	 * {@code 1 / sqrt((r/epsilon)^2 + 1)}
	 */
	INVERSE_MULTIQUADRIC {
		@Override
		public double evaluate(double r, double epsilon) {
			double s = r / epsilon;
			return 1.0 / Math.sqrt(s*s + 1);
		}
	},
	
	/**
	 * {@code exp(-(r/epsilon)^2)}
	 */
	GAUSSIAN {
		@Override
		public double evaluate(double r, double epsilon) {
			double s = r / epsilon;
			return Math.exp(-s*s);
		}
	},
	
	/**
	 * {@code r}
	 */
	LINEAR {
		@Override
		public double evaluate(double r, double epsilon) {
			return r;
		}
	},
	
	/**
	 * {@code r^3}
	 */
	CUBIC {
		@Override
		public double evaluate(double r, double epsilon) {
			return r*r*r;
		}
	},
	
	/**
	 * {@code r^5}
	 */
	QUINTIC {
		@Override
		public double evaluate(double r, double epsilon) {
			double r2 = r*r;
			return r2*r2*r;
		}
	},
	
	/**
	 * Thin-plate spline, {@code r^2 log(r)}, defined as 0 at {@code r = 0}.
	 * This minimizes a bending energy, giving smooth surfaces through noisy scattered measurements.
	 */
	THIN_PLATE {
		@Override
		public double evaluate(double r, double epsilon) {
			if (r == 0)
				return 0;
			return r*r*Math.log(r);
		}
	};
	
	/**
	 * Evaluate the function at distance r.
	 * @param r distance, &ge; 0
	 * @param epsilon shape parameter (ignored by some functions)
	 * @return
	 */
	public abstract double evaluate(double r, double epsilon);
	
	/**
	 * Parse a function from its name, ignoring case and treating '-' and ' ' as '_'.
	 * "inverse" is accepted as an alias for {@link #INVERSE_MULTIQUADRIC}.
	 * @param name
	 * @return
	 * @throws IllegalArgumentException if the name is not recognized
	 */
	public static RadialBasisFunction fromString(String name) throws IllegalArgumentException {
		String normalized = name.trim().toUpperCase().replace('-', '_').replace(' ', '_');
		if ("INVERSE".equals(normalized))
			return INVERSE_MULTIQUADRIC;
		return valueOf(normalized);
	}

}
